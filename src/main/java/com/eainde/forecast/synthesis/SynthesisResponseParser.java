package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.ForecastJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses the model's narrative JSON. Tolerates code fences and text around the object;
 * anything else is a {@link MalformedNarrativeException}.
 */
public class SynthesisResponseParser {

    public static final String NARRATIVE_SCHEMA = "schema/forecast-narrative.schema.json";

    private static final Pattern FENCE = Pattern.compile("(?s)```(?:json)?\\s*(.*?)\\s*```");

    private final JsonSchema schema;

    public SynthesisResponseParser() {
        this.schema = loadSchema(NARRATIVE_SCHEMA);
    }

    public ForecastNarrative parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedNarrativeException("response was empty");
        }
        String candidate = extractObject(raw);

        JsonNode node;
        try {
            node = ForecastJson.mapper().readTree(candidate);
        } catch (JsonProcessingException e) {
            throw new MalformedNarrativeException("response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedNarrativeException("response is not a JSON object");
        }

        Set<ValidationMessage> errors = schema.validate(node);
        if (!errors.isEmpty()) {
            String issues = errors.stream().map(ValidationMessage::getMessage).sorted()
                    .collect(Collectors.joining("; "));
            throw new MalformedNarrativeException("response does not match the narrative shape: " + issues);
        }

        return new ForecastNarrative(
                node.get("outlook").asText().strip(),
                strings(node.get("key_themes")),
                node.get("sentiment").asText().strip(),
                strings(node.get("risks")),
                strings(node.get("opportunities")));
    }

    static String extractObject(String raw) {
        String text = raw.strip();
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            text = fence.group(1);
        }
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return text;
        }
        return text.substring(open, close + 1);
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array != null) {
            for (JsonNode n : array) {
                String s = n.asText().strip();
                if (!s.isEmpty()) {
                    out.add(s);
                }
            }
        }
        return out;
    }

    static JsonSchema loadSchema(String resource) {
        try (InputStream in = SynthesisResponseParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + resource);
            }
            JsonNode schemaNode = ForecastJson.mapper().readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load schema " + resource, e);
        }
    }
}
