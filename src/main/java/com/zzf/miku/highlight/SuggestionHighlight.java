package com.zzf.miku.highlight;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;

/**
 * A highlight proposed by the reviewing agent: the text it flagged, why, and what to replace it with.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SuggestionHighlight implements Highlight, RangeItem<SuggestionHighlight> {
    private final String id;
    private final Range range;
    private final HighlightCategory category;
    private final HighlightPriority priority;
    private final Map<String, Object> metadata;
    private final String originalText;
    private final String observation;
    private final String suggestedRevision;
    private final Double confidence;

    @Builder(toBuilder = true)
    private SuggestionHighlight(String id, Range range, HighlightCategory category, HighlightPriority priority,
                                Map<String, Object> metadata, String originalText, String observation,
                                String suggestedRevision, Double confidence) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Suggestion id must not be blank");
        }
        Objects.requireNonNull(range, "range");
        if (category == null || !category.isSuggestionCategory()) {
            throw new IllegalArgumentException("Invalid suggestion category: " + category);
        }
        if (confidence != null && (confidence.isNaN() || confidence < 0 || confidence > 1)) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got " + confidence);
        }
        this.id = id;
        this.range = range;
        this.category = category;
        this.priority = priority == null ? HighlightPriority.MEDIUM : priority;
        this.metadata = metadata == null ? null : Map.copyOf(metadata);
        this.originalText = originalText == null ? "" : originalText;
        this.observation = observation == null ? "" : observation;
        this.suggestedRevision = suggestedRevision == null ? "" : suggestedRevision;
        this.confidence = confidence;
    }

    @Override
    public SuggestionHighlight withRange(Range range) {
        return toBuilder().range(range).build();
    }

    @Override
    @JsonIgnore
    public int priorityWeight() {
        return priority.getWeight();
    }
}
