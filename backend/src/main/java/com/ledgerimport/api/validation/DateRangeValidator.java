package com.ledgerimport.api.validation;

import com.ledgerimport.api.dto.StartImportRequest;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.time.temporal.ChronoUnit;

/**
 * Missing dates are left to @NotNull.
 */
public class DateRangeValidator implements ConstraintValidator<ValidDateRange, StartImportRequest> {

    /** Aggregators keep about two years of history. */
    static final long MAX_DAYS = 730;

    @Override
    public boolean isValid(StartImportRequest value, ConstraintValidatorContext context) {
        if (value == null || value.startDate() == null || value.endDate() == null) {
            return true;
        }
        if (value.endDate().isBefore(value.startDate())) {
            return false;
        }
        return ChronoUnit.DAYS.between(value.startDate(), value.endDate()) < MAX_DAYS;
    }
}
