package com.esplanada.api.validation;

import com.esplanada.api.suspicious.SuspicionVerdict;
import com.esplanada.api.suspicious.SuspiciousActivityDetector;

import java.util.Optional;

public class SuspiciousActivityStage implements ValidationStage {

    private final SuspiciousActivityDetector detector;

    public SuspiciousActivityStage(SuspiciousActivityDetector detector) {
        this.detector = detector;
    }

    @Override
    public String name() {
        return "SuspiciousActivity";
    }

    @Override
    public Optional<Rejection> check(ValidationContext context) {
        SuspicionVerdict verdict = detector.assess(
                context.submission(),
                context.meta(),
                context.subject() != null ? context.subject().getCreatedAt() : null);
        context.setSuspicion(verdict);
        return verdict.flagged() ? Optional.of(Rejection.suspiciousActivity()) : Optional.empty();
    }
}
