package com.esplanada.api.validation;

import java.util.Optional;

/**
 * One named step of the validation pipeline. Returns a rejection to stop the pipeline.
 */
public interface ValidationStage {

    String name();

    Optional<Rejection> check(ValidationContext context);
}
