package com.eainde.auditor.collector;

import com.eainde.auditor.error.CollectionException;
import com.eainde.auditor.model.Evidence;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the accompanying report (plain text or markdown) and records which required concepts it
 * explains and which repository paths it claims exist.
 *
 * <p>The claimed paths are emitted as one {@link #CROSS_REFERENCE_GOAL} evidence item whose
 * content is the comma-separated path list; the aggregator checks them against the repository
 * manifest.</p>
 */
@Slf4j
public class DocumentConceptCollector implements EvidenceCollector {

    public static final String SOURCE_KEY = "doc";
    public static final String CROSS_REFERENCE_GOAL = "cross_reference: file paths claimed by the document";

    private static final List<Pattern> PATH_PATTERNS = List.of(
            Pattern.compile("`?((?:src|lib|app|test|tests)/[A-Za-z0-9_/.-]+\\.[A-Za-z0-9]+)`?"),
            Pattern.compile("(?<![/\\w.])([A-Za-z0-9_-]+\\.(?:toml|md|json|txt|xml|yml|yaml|gradle))\\b"),
            Pattern.compile("(?<![/\\w])(\\.env[A-Za-z0-9._]*)"));

    private final Map<String, List<String>> concepts;
    private final String conceptCriterionId;

    public DocumentConceptCollector(Map<String, List<String>> concepts, String conceptCriterionId) {
        this.concepts = new LinkedHashMap<>(concepts);
        this.conceptCriterionId = conceptCriterionId;
    }

    @Override
    public String sourceKey() {
        return SOURCE_KEY;
    }

    @Override
    public List<Evidence> collect(String reference) throws CollectionException {
        if (reference == null || reference.isBlank()) {
            throw new CollectionException("no document reference given");
        }
        Path document = Path.of(reference);
        String text;
        try {
            text = Files.readString(document, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollectionException("could not read document " + reference + ": " + e.getMessage(), e);
        }
        if (text.isBlank()) {
            throw new CollectionException("document " + reference + " is empty");
        }

        List<Evidence> evidence = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        concepts.forEach((concept, keywords) -> evidence.add(conceptEvidence(reference, lower, concept, keywords)));

        List<String> claimed = claimedPaths(text);
        log.info("Document {} claims {} path(s)", reference, claimed.size());
        evidence.add(Evidence.of(CROSS_REFERENCE_GOAL, !claimed.isEmpty(), reference, 0.9,
                        "Paths mentioned in the document text")
                .withContent(String.join(",", claimed)));
        return evidence;
    }

    private Evidence conceptEvidence(String reference, String lowerText, String concept, List<String> keywords) {
        List<String> hits = keywords.stream()
                .filter(keyword -> lowerText.contains(keyword.toLowerCase(Locale.ROOT)))
                .toList();
        if (hits.isEmpty()) {
            return Evidence.of("Document explains concept: " + concept, false, reference, 0.7,
                            "None of " + keywords + " appear in the document")
                    .forCriterion(conceptCriterionId);
        }
        double confidence = Math.min(0.9, 0.5 + 0.1 * hits.size());
        int line = lineOf(lowerText, hits.get(0).toLowerCase(Locale.ROOT));
        return Evidence.of("Document explains concept: " + concept, true, reference + ":" + line, confidence,
                        "Matched " + hits.size() + " of " + keywords.size() + " keywords: " + hits)
                .forCriterion(conceptCriterionId);
    }

    static List<String> claimedPaths(String text) {
        TreeSet<String> found = new TreeSet<>();
        for (Pattern pattern : PATH_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String path = matcher.group(1).replace("`", "").trim();
                if (path.length() > 2) {
                    found.add(path);
                }
            }
        }
        return List.copyOf(found);
    }

    private static int lineOf(String text, String keyword) {
        int index = text.indexOf(keyword);
        int line = 1;
        for (int i = 0; i < index; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
