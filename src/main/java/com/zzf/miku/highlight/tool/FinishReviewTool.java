package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * finish_review: the agent's terminal signal for a review pass.
 */
@Slf4j
@Component
public class FinishReviewTool implements ToolDefinition<FinishReviewParams, FinishReviewResult> {
    public static final String NAME = "finish_review";

    private static final ObjectNode SCHEMA = SchemaBuilder.object()
            .string("summary", "Optional summary of the review findings")
            .enumeration("status", "Review completion status", ReviewStatus.wireNames())
            .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Signal that the document review is complete.\n\n"
                + "Call this tool when you have finished analyzing the document and creating all suggestions.\n\n"
                + "Parameters:\n"
                + "- summary: (optional) A brief summary of your findings\n"
                + "- status: (optional) 'completed', 'partial', or 'no_issues_found'\n\n"
                + "If status is not provided, it will be inferred:\n"
                + "- 'no_issues_found' if no suggestions were created\n"
                + "- 'completed' otherwise\n\n"
                + "Use status 'partial' if you weren't able to fully analyze the document (e.g., document was very long).";
    }

    @Override
    public ObjectNode getParametersSchema() {
        return SCHEMA.deepCopy();
    }

    @Override
    public ToolAccess getAccess() {
        return ToolAccess.MUTATING;
    }

    @Override
    public Optional<FinishReviewParams> parse(JsonNode args) {
        if (args == null || args.isNull() || args.isMissingNode()) {
            return Optional.of(new FinishReviewParams(null, null));
        }
        if (!args.isObject()) {
            return Optional.empty();
        }
        String summary = null;
        if (!ToolArguments.isAbsent(args, "summary")) {
            summary = ToolArguments.string(args, "summary");
            if (summary == null) {
                return Optional.empty();
            }
        }
        ReviewStatus status = null;
        if (!ToolArguments.isAbsent(args, "status")) {
            status = ReviewStatus.fromWireName(ToolArguments.oneOf(args, "status", ReviewStatus.wireNames()));
            if (status == null) {
                return Optional.empty();
            }
        }
        return Optional.of(new FinishReviewParams(summary, status));
    }

    @Override
    public CompletableFuture<ToolResult<FinishReviewResult>> execute(FinishReviewParams params, ToolContext context) {
        int count = context.getStore().getHighlights().size();
        ReviewStatus status = params.getStatus();
        if (status == null) {
            status = count == 0 ? ReviewStatus.NO_ISSUES_FOUND : ReviewStatus.COMPLETED;
        }
        FinishReviewResult result = new FinishReviewResult(count, params.getSummary(), status, System.currentTimeMillis());

        String plural = count == 1 ? "" : "s";
        String message;
        switch (status) {
            case PARTIAL:
                message = "Partial review completed with " + count + " suggestion" + plural
                        + ". Some areas may not have been fully analyzed.";
                break;
            case NO_ISSUES_FOUND:
                message = "Review completed. No issues found in the document.";
                break;
            case COMPLETED:
            default:
                message = "Review completed with " + count + " suggestion" + plural + ".";
                break;
        }
        if (params.getSummary() != null && !params.getSummary().isEmpty()) {
            message += " Summary: " + params.getSummary();
        }
        log.info("review.finish status={} suggestions={}", status.wireName(), count);
        return CompletableFuture.completedFuture(ToolResult.success(result, message));
    }
}
