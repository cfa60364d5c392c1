package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum ReviewStatus {
    COMPLETED,
    PARTIAL,
    NO_ISSUES_FOUND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReviewStatus fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (ReviewStatus s : values()) {
            if (s.wireName().equals(value)) {
                return s;
            }
        }
        return null;
    }

    static List<String> wireNames() {
        return Arrays.stream(values()).map(ReviewStatus::wireName).toList();
    }
}
