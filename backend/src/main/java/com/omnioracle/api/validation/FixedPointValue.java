package com.omnioracle.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import jakarta.validation.ReportAsSingleViolation;
import jakarta.validation.constraints.Pattern;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Positive 18-decimal fixed-point integer given as a decimal string, e.g. "1000000000000000000" for 1.0.
 * Error code for API: INVALID_PRICE.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@ReportAsSingleViolation
@Pattern(regexp = "^[1-9][0-9]{0,76}$")
@Constraint(validatedBy = {})
public @interface FixedPointValue {

    String message() default "INVALID_PRICE";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
