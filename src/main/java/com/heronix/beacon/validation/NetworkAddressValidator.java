package com.heronix.beacon.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validator for {@link NetworkAddress}.
 */
public class NetworkAddressValidator implements ConstraintValidator<NetworkAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || NetworkAddresses.isIpLiteral(value);
    }
}
