package com.memelet.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memelet.model.MediaAnalysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns the model's raw answer into a {@link MediaAnalysis}.
 * Tolerates markdown code fences, list-valued fields, non-string values and unknown keys.
 */
public class AnalysisResponseParser {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[\\w-]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");
    private static final Pattern TAG_SEPARATOR = Pattern.compile("[,\\n]");

    private final ObjectMapper mapper = new ObjectMapper();

    public MediaAnalysis parse(String rawText) throws ResponseParseException {
        String json = stripFences(rawText);
        if (json.isEmpty()) {
            throw new ResponseParseException("Empty response from model");
        }

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("Response is not valid JSON: " + abbreviate(json), e);
        }
        if (root == null || !root.isObject()) {
            throw new ResponseParseException("Response is not a JSON object: " + abbreviate(json));
        }

        return new MediaAnalysis(
                normalize(root.get("references")),
                normalize(root.get("template")),
                normalize(root.get("caption")),
                normalize(root.get("description")),
                normalize(root.get("meaning")),
                parseTags(root.get("tags")));
    }

    /**
     * Trims the text and removes a leading fence (with optional language tag) and a trailing fence.
     */
    public String stripFences(String rawText) {
        if (rawText == null) {
            return "";
        }
        String text = rawText.trim();
        text = LEADING_FENCE.matcher(text).replaceFirst("");
        text = TRAILING_FENCE.matcher(text).replaceFirst("");
        return text.trim();
    }

    // Strings as-is, lists newline-joined, anything else as JSON text
    private String normalize(JsonNode value) throws ResponseParseException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode element : value) {
                parts.add(element.isTextual() ? element.asText() : toJson(element));
            }
            return String.join("\n", parts);
        }
        return toJson(value);
    }

    // Other value types are ignored
    List<String> parseTags(JsonNode value) {
        List<String> candidates = new ArrayList<>();
        if (value == null || value.isNull() || value.isMissingNode()) {
            return candidates;
        }
        if (value.isTextual()) {
            for (String part : TAG_SEPARATOR.split(value.asText())) {
                candidates.add(part);
            }
        } else if (value.isArray()) {
            for (JsonNode element : value) {
                if (element.isTextual()) {
                    candidates.add(element.asText());
                }
            }
        }

        // Case-insensitive de-duplication, first spelling wins
        Map<String, String> unique = new LinkedHashMap<>();
        for (String candidate : candidates) {
            String name = candidate.trim();
            if (!name.isEmpty()) {
                unique.putIfAbsent(name.toLowerCase(), name);
            }
        }
        return new ArrayList<>(unique.values());
    }

    private String toJson(JsonNode node) throws ResponseParseException {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("Could not serialize value " + node, e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
