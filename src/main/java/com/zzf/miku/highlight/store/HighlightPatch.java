package com.zzf.miku.highlight.store;

import com.zzf.miku.highlight.HighlightCategory;
import com.zzf.miku.highlight.HighlightPriority;
import com.zzf.miku.highlight.Range;
import com.zzf.miku.highlight.SuggestionHighlight;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Partial update for {@code UPDATE_HIGHLIGHT}. Null fields keep the current value; the id can never change.
 */
@Value
@Builder
public class HighlightPatch {
    Range range;
    HighlightCategory category;
    HighlightPriority priority;
    Map<String, Object> metadata;
    String originalText;
    String observation;
    String suggestedRevision;
    Double confidence;

    public boolean changesRange(SuggestionHighlight current) {
        return range != null && !range.equals(current.getRange());
    }

    public SuggestionHighlight applyTo(SuggestionHighlight current) {
        SuggestionHighlight.SuggestionHighlightBuilder b = current.toBuilder();
        if (range != null) {
            b.range(range);
        }
        if (category != null) {
            b.category(category);
        }
        if (priority != null) {
            b.priority(priority);
        }
        if (metadata != null) {
            b.metadata(metadata);
        }
        if (originalText != null) {
            b.originalText(originalText);
        }
        if (observation != null) {
            b.observation(observation);
        }
        if (suggestedRevision != null) {
            b.suggestedRevision(suggestedRevision);
        }
        if (confidence != null) {
            b.confidence(confidence);
        }
        return b.build();
    }
}
