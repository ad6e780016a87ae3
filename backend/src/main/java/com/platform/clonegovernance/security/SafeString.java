package com.platform.clonegovernance.security;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Free-text input that is stored in the governance tables and echoed in logs.
 * Null passes; combine with {@code @NotBlank} where the value is required.
 */
@Documented
@Constraint(validatedBy = SafeStringValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface SafeString {

    String message() default "Invalid characters in input";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};

    int maxLength() default 255;

    boolean allowNewlines() default false;

    /**
     * Restrict the value to letters, digits and {@code . _ - : @ /}, as used for names and ids.
     */
    boolean identifier() default false;
}
