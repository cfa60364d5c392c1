package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A tool the reviewing agent can call.
 * <p>
 * Arguments arrive as untyped JSON and are turned into {@code P} by {@link #parse(JsonNode)} before
 * anything runs; an empty result means the call is rejected without executing.
 *
 * @param <P> parsed parameter type
 * @param <R> success value type
 */
public interface ToolDefinition<P, R> {

    String getName();

    String getDescription();

    /**
     * JSON-Schema object: {@code {type: "object", properties, required}}.
     */
    ObjectNode getParametersSchema();

    ToolAccess getAccess();

    Optional<P> parse(JsonNode arguments);

    CompletableFuture<ToolResult<R>> execute(P params, ToolContext context);

    default List<String> getRequiredParameters() {
        List<String> required = new ArrayList<>();
        JsonNode node = getParametersSchema().get("required");
        if (node instanceof ArrayNode array) {
            array.forEach(n -> required.add(n.asText()));
        }
        return required;
    }

    /**
     * Function-calling export: {@code {name, description, parameters: {type, properties, required}}}.
     */
    default ObjectNode toProviderFormat() {
        ObjectNode schema = getParametersSchema();
        ObjectNode out = schema.objectNode();
        out.put("name", getName());
        out.put("description", getDescription());
        ObjectNode parameters = out.putObject("parameters");
        parameters.put("type", "object");
        parameters.set("properties", schema.has("properties") ? schema.get("properties").deepCopy() : schema.objectNode());
        ArrayNode required = parameters.putArray("required");
        getRequiredParameters().forEach(required::add);
        return out;
    }
}
