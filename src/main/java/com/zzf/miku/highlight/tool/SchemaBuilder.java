package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;

/**
 * Small fluent helper for the parameter schemas tools publish.
 */
final class SchemaBuilder {
    private final ObjectNode schema = JsonNodeFactory.instance.objectNode();
    private final ObjectNode properties;
    private final ArrayNode required;

    private SchemaBuilder() {
        schema.put("type", "object");
        properties = schema.putObject("properties");
        required = schema.putArray("required");
    }

    static SchemaBuilder object() {
        return new SchemaBuilder();
    }

    ObjectNode property(String name, String type, String description) {
        ObjectNode p = properties.putObject(name);
        p.put("type", type);
        p.put("description", description);
        return p;
    }

    SchemaBuilder integer(String name, String description, Integer minimum, Integer maximum) {
        ObjectNode p = property(name, "number", description);
        if (minimum != null) {
            p.put("minimum", minimum);
        }
        if (maximum != null) {
            p.put("maximum", maximum);
        }
        return this;
    }

    SchemaBuilder string(String name, String description) {
        property(name, "string", description);
        return this;
    }

    SchemaBuilder nonEmptyString(String name, String description) {
        property(name, "string", description).put("minLength", 1);
        return this;
    }

    SchemaBuilder enumeration(String name, String description, Collection<String> values) {
        ArrayNode options = property(name, "string", description).putArray("enum");
        values.forEach(options::add);
        return this;
    }

    SchemaBuilder number(String name, String description, double minimum, double maximum) {
        ObjectNode p = property(name, "number", description);
        p.put("minimum", minimum);
        p.put("maximum", maximum);
        return this;
    }

    SchemaBuilder bool(String name, String description, boolean defaultValue) {
        property(name, "boolean", description).put("default", defaultValue);
        return this;
    }

    SchemaBuilder required(String... names) {
        for (String n : names) {
            required.add(n);
        }
        return this;
    }

    ObjectNode build() {
        return schema.deepCopy();
    }
}
