package com.eainde.auditor.extraction;

import com.eainde.auditor.model.ScoreScale;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a reviewer's raw reply into an {@link OpinionPayload}.
 *
 * <p>Strict parse expects a single JSON object, optionally wrapped in markdown fences, with an
 * in-scale integer {@code score} and a non-blank {@code argument}. The fallback first looks for
 * the outermost {@code {...}} block anywhere in the text, then for the first score token inside
 * the scale.</p>
 */
@Slf4j
public class OpinionSchema implements OutputSchema<OpinionPayload> {

    static final String PLACEHOLDER_ARGUMENT =
            "[STRUCTURAL FAILURE] reviewer output could not be read as a valid opinion";

    private static final Pattern JSON_BLOCK = Pattern.compile("\\{.*}", Pattern.DOTALL);
    // a sign or decimal point next to the digits means the number is not an integer score
    private static final Pattern LABELLED_SCORE = Pattern.compile("(?i)score\\W{0,5}?(?<![-\\d.])(\\d+)(?![\\d.])");
    private static final Pattern BARE_NUMBER = Pattern.compile("(?<![-\\d.])(\\d+)(?![\\d.])");
    private static final int MAX_RECOVERED_ARGUMENT = 2000;

    private final ObjectMapper objectMapper;
    private final ScoreScale scale;

    public OpinionSchema(ObjectMapper objectMapper, ScoreScale scale) {
        this.objectMapper = objectMapper;
        this.scale = scale;
    }

    @Override
    public OpinionPayload parse(String raw) throws SchemaViolationException {
        JsonNode root;
        try {
            root = objectMapper.readTree(cleanJson(raw));
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaViolationException("expected a JSON object");
        }
        JsonNode argument = root.has("argument") ? root.get("argument") : root.get("rationale");
        if (argument == null || !argument.isTextual() || argument.asText().isBlank()) {
            throw new SchemaViolationException("missing argument");
        }
        return new OpinionPayload(requireScore(root.get("score")), argument.asText(), citations(root));
    }

    @Override
    public Optional<OpinionPayload> fallback(String raw) {
        Matcher block = JSON_BLOCK.matcher(raw);
        if (block.find()) {
            try {
                JsonNode root = objectMapper.readTree(block.group());
                JsonNode argument = root.has("argument") ? root.get("argument") : root.get("rationale");
                String text = argument != null && argument.isTextual() && !argument.asText().isBlank()
                        ? argument.asText() : truncate(raw);
                return Optional.of(new OpinionPayload(requireScore(root.get("score")), text, citations(root)));
            } catch (JsonProcessingException | SchemaViolationException e) {
                log.debug("Embedded JSON block unusable: {}", e.getMessage());
            }
        }
        return firstScoreToken(raw).map(score -> new OpinionPayload(score, truncate(raw), List.of()));
    }

    @Override
    public OpinionPayload placeholder() {
        return new OpinionPayload(scale.midpoint(), PLACEHOLDER_ARGUMENT, List.of());
    }

    private Optional<Integer> firstScoreToken(String raw) {
        Optional<Integer> labelled = firstInScale(LABELLED_SCORE.matcher(raw));
        return labelled.isPresent() ? labelled : firstInScale(BARE_NUMBER.matcher(raw));
    }

    private Optional<Integer> firstInScale(Matcher matcher) {
        while (matcher.find()) {
            try {
                int candidate = Integer.parseInt(matcher.group(1));
                if (scale.contains(candidate)) {
                    return Optional.of(candidate);
                }
            } catch (NumberFormatException e) {
                log.trace("Skipping oversized number token {}", matcher.group(1));
            }
        }
        return Optional.empty();
    }

    private int requireScore(JsonNode score) throws SchemaViolationException {
        int value;
        if (score != null && score.isIntegralNumber() && score.canConvertToInt()) {
            value = score.asInt();
        } else if (score != null && score.isTextual()) {
            try {
                value = Integer.parseInt(score.asText().trim());
            } catch (NumberFormatException e) {
                throw new SchemaViolationException("score must be an integer, got '" + score.asText() + "'", e);
            }
        } else {
            throw new SchemaViolationException("score must be an integer");
        }
        if (!scale.contains(value)) {
            throw new SchemaViolationException("score " + value + " outside " + scale.min() + ".." + scale.max());
        }
        return value;
    }

    private static List<String> citations(JsonNode root) {
        JsonNode cited = root.has("cited_evidence") ? root.get("cited_evidence") : root.get("citedEvidence");
        List<String> locations = new ArrayList<>();
        if (cited != null && cited.isArray()) {
            cited.forEach(node -> {
                if (node.isTextual() && !node.asText().isBlank()) {
                    locations.add(node.asText());
                }
            });
        }
        return locations;
    }

    private static String cleanJson(String json) {
        // Remove markdown fences, trim
        return json.replace("```json", "")
                .replace("```", "")
                .trim();
    }

    private static String truncate(String raw) {
        String trimmed = raw.trim();
        return trimmed.length() <= MAX_RECOVERED_ARGUMENT ? trimmed : trimmed.substring(0, MAX_RECOVERED_ARGUMENT);
    }
}
