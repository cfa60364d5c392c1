package com.zzf.miku.highlight.tool;

import lombok.Value;

@Value
public class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null);

    boolean valid;
    String error;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, error);
    }
}
