package com.zzf.miku.highlight.tool;

import lombok.Value;

@Value
public class FinishReviewResult {
    int suggestionCount;
    String summary;
    ReviewStatus status;
    long finishedAt;
}
