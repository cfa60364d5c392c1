package com.zzf.miku.highlight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HighlightPriority {
    CRITICAL(100),
    HIGH(75),
    MEDIUM(50),
    LOW(25),
    BACKGROUND(0);

    private final int weight;

    HighlightPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static HighlightPriority fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (HighlightPriority p : values()) {
            if (p.wireName().equalsIgnoreCase(value.trim())) {
                return p;
            }
        }
        return null;
    }
}
