package com.heronix.beacon.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validator for {@link HardwareAddress}.
 */
public class HardwareAddressValidator implements ConstraintValidator<HardwareAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || NetworkAddresses.isHardwareAddress(value);
    }
}
