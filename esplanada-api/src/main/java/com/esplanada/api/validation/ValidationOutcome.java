package com.esplanada.api.validation;

import com.esplanada.api.duplicate.DuplicateResolution;
import com.esplanada.api.suspicious.SuspicionVerdict;

/**
 * Result of a validation run: an accepted operation or the first rejection.
 * A suspicious-activity rejection carries the verdict so the caller can record it.
 */
public record ValidationOutcome(
        boolean accepted,
        Operation operation,
        DuplicateResolution resolution,
        Rejection rejection,
        String rejectedBy,
        SuspicionVerdict suspicion
) {
    public enum Operation {
        CREATE,
        UPDATE_IN_PLACE
    }

    public static ValidationOutcome accept(DuplicateResolution resolution) {
        Operation operation = resolution != null && resolution.status() == DuplicateResolution.Status.UPDATE_ALLOWED
                ? Operation.UPDATE_IN_PLACE
                : Operation.CREATE;
        return new ValidationOutcome(true, operation, resolution, null, null, null);
    }

    public static ValidationOutcome reject(String stage, Rejection rejection, SuspicionVerdict suspicion) {
        return new ValidationOutcome(false, null, null, rejection, stage, suspicion);
    }

    public boolean flagged() {
        return suspicion != null && suspicion.flagged();
    }
}
