package com.zzf.miku.highlight.tool;

import lombok.Value;

/**
 * Both fields are optional; a null status is inferred from the store at execution time.
 */
@Value
public class FinishReviewParams {
    String summary;
    ReviewStatus status;
}
