package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-keyed set of tools, in registration order.
 */
public final class ToolRegistry {
    public static final List<String> DEFAULT_TOOL_NAMES = List.of(
            HighlightTextTool.NAME,
            GetLineContentTool.NAME,
            GetDocumentStatsTool.NAME,
            FinishReviewTool.NAME);

    private final Map<String, ToolDefinition<?, ?>> tools = new LinkedHashMap<>();

    public static ToolRegistry createDefault() {
        ToolRegistry registry = new ToolRegistry();
        registry.registerAll(List.of(
                new HighlightTextTool(),
                new GetLineContentTool(),
                new GetDocumentStatsTool(),
                new FinishReviewTool()));
        return registry;
    }

    /**
     * @throws IllegalArgumentException when a tool with the same name is already present
     */
    public ToolRegistry register(ToolDefinition<?, ?> tool) {
        if (tool == null || tool.getName() == null || tool.getName().isBlank()) {
            throw new IllegalArgumentException("Tool must have a name");
        }
        if (tools.containsKey(tool.getName())) {
            throw new IllegalArgumentException("Tool \"" + tool.getName() + "\" is already registered");
        }
        tools.put(tool.getName(), tool);
        return this;
    }

    public ToolRegistry registerAll(Collection<? extends ToolDefinition<?, ?>> list) {
        for (ToolDefinition<?, ?> tool : list) {
            register(tool);
        }
        return this;
    }

    public boolean unregister(String name) {
        return tools.remove(name) != null;
    }

    public ToolDefinition<?, ?> get(String name) {
        return name == null ? null : tools.get(name);
    }

    public boolean has(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<ToolDefinition<?, ?>> getAll() {
        return List.copyOf(tools.values());
    }

    public List<String> getNames() {
        return List.copyOf(tools.keySet());
    }

    public int size() {
        return tools.size();
    }

    /**
     * A new registry holding only the named tools; unknown names are skipped.
     */
    public ToolRegistry subset(Collection<String> names) {
        ToolRegistry out = new ToolRegistry();
        for (String name : names) {
            ToolDefinition<?, ?> tool = tools.get(name);
            if (tool != null && !out.has(name)) {
                out.register(tool);
            }
        }
        return out;
    }

    public ToolRegistry copy() {
        ToolRegistry out = new ToolRegistry();
        out.tools.putAll(tools);
        return out;
    }

    public void clear() {
        tools.clear();
    }

    /**
     * Function-calling declarations for every registered tool.
     */
    public ArrayNode toProviderFormat() {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        for (ToolDefinition<?, ?> tool : tools.values()) {
            out.add(tool.toProviderFormat());
        }
        return out;
    }

    /**
     * @return the names from {@code required} that are not registered, empty when all are present
     */
    public List<String> validateRequired(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (!tools.containsKey(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return "ToolRegistry" + tools.keySet();
    }
}
