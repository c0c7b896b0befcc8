package com.heronix.beacon.validation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

/**
 * Six colon-separated hexadecimal octets, e.g. {@code 00:1A:2B:3C:4D:5E}.
 * Null is valid.
 */
@Documented
@Constraint(validatedBy = HardwareAddressValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.TYPE_USE})
@Retention(RetentionPolicy.RUNTIME)
public @interface HardwareAddress {

    String message() default "must be a MAC address (six colon-separated hex octets)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
