package com.ledgerimport.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Start date not after end date, span within {@link DateRangeValidator#MAX_DAYS} days.
 * Error code for API: INVALID_DATE_RANGE.
 */
@Target(TYPE)
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = DateRangeValidator.class)
public @interface ValidDateRange {

    String message() default "INVALID_DATE_RANGE";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
