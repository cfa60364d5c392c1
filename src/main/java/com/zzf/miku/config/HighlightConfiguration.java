package com.zzf.miku.config;

import com.zzf.miku.highlight.tool.ToolDefinition;
import com.zzf.miku.highlight.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Comparator;
import java.util.List;

@Slf4j
@Configuration
public class HighlightConfiguration {

    /**
     * Registry of every tool bean in the context, default tools first in their canonical order and any
     * others after them by name. Fails startup when one of the default tools is missing.
     */
    @Bean
    public ToolRegistry toolRegistry(List<ToolDefinition<?, ?>> tools) {
        List<ToolDefinition<?, ?>> ordered = tools.stream()
                .sorted(Comparator.<ToolDefinition<?, ?>>comparingInt(HighlightConfiguration::defaultRank)
                        .thenComparing(ToolDefinition::getName))
                .toList();
        ToolRegistry registry = new ToolRegistry().registerAll(ordered);
        List<String> missing = registry.validateRequired(ToolRegistry.DEFAULT_TOOL_NAMES);
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required tools: " + String.join(", ", missing));
        }
        log.info("tool.registry.ready tools={}", registry.getNames());
        return registry;
    }

    private static int defaultRank(ToolDefinition<?, ?> tool) {
        int index = ToolRegistry.DEFAULT_TOOL_NAMES.indexOf(tool.getName());
        return index == -1 ? ToolRegistry.DEFAULT_TOOL_NAMES.size() : index;
    }
}
