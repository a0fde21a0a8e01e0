package com.eainde.forecast.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts a draft 2020-12 JSON Schema document into a LangChain4j {@link JsonSchema}
 * usable as a structured-output response format.
 *
 * <p>Only the subset the narrative schema needs is mapped: object, array, string
 * (with enum), integer, number, boolean. Unsupported keywords are ignored.</p>
 */
public final class JsonSchemaConverter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        JsonNode root;
        try {
            root = MAPPER.readTree(jsonSchemaString);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse JSON Schema '" + name + "'", e);
        }
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(parseElement(root))
                .build();
    }

    public static JsonSchema fromClasspath(String name, String resourcePath) {
        try (InputStream in = JsonSchemaConverter.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Schema resource not found: " + resourcePath);
            }
            return toLangChainSchema(name, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read schema resource: " + resourcePath, e);
        }
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) return parseObject(node);
            if (node.has("enum")) return parseEnum(node);
            return JsonStringSchema.builder().description(description(node)).build();
        }

        JsonNode typeNode = node.get("type");
        // ["string", "null"] style unions collapse to the first non-null member
        String type = typeNode.isArray() ? firstNonNull(typeNode) : typeNode.asText();

        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> node.has("enum")
                    ? parseEnum(node)
                    : JsonStringSchema.builder().description(description(node)).build();
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description(node));

        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> required = new ArrayList<>();
            node.get("required").forEach(n -> required.add(n.asText()));
            builder.required(required);
        }

        if (node.has("additionalProperties") && node.get("additionalProperties").isBoolean()) {
            builder.additionalProperties(node.get("additionalProperties").asBoolean());
        }

        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description(node));
        builder.items(node.has("items")
                ? parseElement(node.get("items"))
                : JsonStringSchema.builder().build());
        return builder.build();
    }

    private static JsonEnumSchema parseEnum(JsonNode node) {
        List<String> values = new ArrayList<>();
        node.get("enum").forEach(n -> values.add(n.asText()));
        return JsonEnumSchema.builder()
                .description(description(node))
                .enumValues(values)
                .build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }

    private static String firstNonNull(JsonNode types) {
        for (JsonNode t : types) {
            if (!"null".equals(t.asText())) {
                return t.asText();
            }
        }
        return "string";
    }
}
