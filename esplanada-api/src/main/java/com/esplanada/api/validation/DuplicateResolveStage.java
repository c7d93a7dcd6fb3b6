package com.esplanada.api.validation;

import com.esplanada.api.duplicate.DuplicateGuard;
import com.esplanada.api.duplicate.DuplicateResolution;

import java.util.Optional;

public class DuplicateResolveStage implements ValidationStage {

    private final DuplicateGuard duplicateGuard;

    public DuplicateResolveStage(DuplicateGuard duplicateGuard) {
        this.duplicateGuard = duplicateGuard;
    }

    @Override
    public String name() {
        return "DuplicateResolve";
    }

    @Override
    public Optional<Rejection> check(ValidationContext context) {
        DuplicateResolution resolution = duplicateGuard.resolve(
                context.submission().identity(), context.submission().subjectId(), context.now());
        context.setResolution(resolution);
        return switch (resolution.status()) {
            case NEW, UPDATE_ALLOWED -> Optional.empty();
            case DENIED -> Optional.of(Rejection.duplicateActive(resolution.retryAfter()));
            case UNAVAILABLE -> Optional.of(Rejection.storageFailure());
        };
    }
}
