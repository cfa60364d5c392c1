package com.zzf.miku.highlight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Kinds of highlight. {@code SEARCH} and {@code SELECTION} are editor-owned and never carry a suggestion.
 */
public enum HighlightCategory {
    CLARITY,
    GRAMMAR,
    STYLE,
    STRUCTURE,
    ECONOMY,
    SEARCH,
    SELECTION;

    public boolean isSuggestionCategory() {
        return this != SEARCH && this != SELECTION;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static HighlightCategory fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (HighlightCategory c : values()) {
            if (c.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return c;
            }
        }
        return null;
    }

    public static List<HighlightCategory> suggestionCategories() {
        return Arrays.stream(values()).filter(HighlightCategory::isSuggestionCategory).toList();
    }
}
