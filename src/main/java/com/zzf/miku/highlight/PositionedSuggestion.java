package com.zzf.miku.highlight;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Value;

/**
 * A suggestion paired with the 1-indexed line and column of its start offset.
 */
@Value
public class PositionedSuggestion {
    @JsonUnwrapped
    SuggestionHighlight suggestion;
    int lineNumber;
    int columnNumber;
}
