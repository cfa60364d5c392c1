package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.zzf.miku.highlight.HighlightIds;

/**
 * A request from the agent to run one named tool. A call without an id gets a generated one, so
 * results of a batch stay one per call.
 */
public final class ToolCall {
    private final String id;
    private final String name;
    private final JsonNode arguments;

    @JsonCreator
    public ToolCall(@JsonProperty("id") String id,
                    @JsonProperty("name") String name,
                    @JsonProperty("arguments") JsonNode arguments) {
        this.id = id == null || id.trim().isEmpty() ? HighlightIds.toolCallId() : id.trim();
        this.name = name == null ? "" : name.trim();
        this.arguments = arguments == null ? JsonNodeFactory.instance.objectNode() : arguments;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public JsonNode getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return "ToolCall{id=" + id + ", name=" + name + "}";
    }
}
