package com.zzf.miku.config;

import com.zzf.miku.highlight.tool.FinishReviewTool;
import com.zzf.miku.highlight.tool.GetDocumentStatsTool;
import com.zzf.miku.highlight.tool.GetLineContentTool;
import com.zzf.miku.highlight.tool.HighlightTextTool;
import com.zzf.miku.highlight.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HighlightConfigurationTest {

    private final HighlightConfiguration configuration = new HighlightConfiguration();

    @Test
    void registryFollowsDefaultToolOrderWhateverTheBeanOrder() {
        ToolRegistry registry = configuration.toolRegistry(List.of(
                new FinishReviewTool(), new GetDocumentStatsTool(), new HighlightTextTool(), new GetLineContentTool()));

        assertEquals(ToolRegistry.DEFAULT_TOOL_NAMES, registry.getNames());
        assertEquals(HighlightTextTool.NAME, registry.toProviderFormat().get(0).get("name").asText());
    }

    @Test
    void missingDefaultToolFailsStartup() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> configuration.toolRegistry(List.of(new HighlightTextTool(), new FinishReviewTool())));

        assertEquals("Missing required tools: get_line_content, get_document_stats", e.getMessage());
    }
}
