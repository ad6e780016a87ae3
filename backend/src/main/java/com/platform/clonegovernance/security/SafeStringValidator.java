package com.platform.clonegovernance.security;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

/**
 * Validator for {@link SafeString}.
 */
public class SafeStringValidator implements ConstraintValidator<SafeString, String> {

    private static final Pattern SCRIPT_PATTERN = Pattern.compile(
        "<script[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern HTML_TAG_PATTERN = Pattern.compile("<[^>]+>");
    private static final Pattern CONTROL_PATTERN = Pattern.compile("[\\p{Cntrl}&&[^\\r\\n\\t]]");
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[\\p{L}\\p{N}._:@/ -]*$");

    private int maxLength;
    private boolean allowNewlines;
    private boolean identifier;

    @Override
    public void initialize(SafeString constraintAnnotation) {
        this.maxLength = constraintAnnotation.maxLength();
        this.allowNewlines = constraintAnnotation.allowNewlines();
        this.identifier = constraintAnnotation.identifier();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }

        if (value.length() > maxLength) {
            setMessage(context, "Input exceeds maximum length of " + maxLength);
            return false;
        }

        if (SCRIPT_PATTERN.matcher(value).find() || HTML_TAG_PATTERN.matcher(value).find()) {
            setMessage(context, "HTML tags are not allowed");
            return false;
        }

        if (!allowNewlines && (value.contains("\n") || value.contains("\r"))) {
            setMessage(context, "Newlines are not allowed");
            return false;
        }

        if (CONTROL_PATTERN.matcher(value).find()) {
            setMessage(context, "Control characters are not allowed");
            return false;
        }

        if (identifier && !IDENTIFIER_PATTERN.matcher(value).matches()) {
            setMessage(context, "Only letters, digits, spaces and . _ - : @ / are allowed");
            return false;
        }

        return true;
    }

    private void setMessage(ConstraintValidatorContext context, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message).addConstraintViolation();
    }
}
