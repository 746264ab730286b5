package com.eainde.auditor.nodes;

import com.eainde.auditor.collector.DocumentConceptCollector;
import com.eainde.auditor.collector.RepositoryFileCollector;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.Severity;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fan-in step after collection: checks the paths the document claims against the files the
 * repository collector actually saw. Paths that exist nowhere in the repository are reported
 * under {@code cross_ref}.
 */
@Slf4j
public class EvidenceAggregatorNode implements AuditNode {

    public static final String ID = "evidence_aggregator";
    public static final String CROSS_REF_KEY = "cross_ref";

    private final String accuracyCriterionId;

    public EvidenceAggregatorNode(String accuracyCriterionId) {
        this.accuracyCriterionId = accuracyCriterionId;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> ownedEvidenceKeys() {
        return Set.of(CROSS_REF_KEY);
    }

    @Override
    public Map<String, Object> apply(AuditState state) {
        log.info("Aggregated {} evidence item(s) from {} source(s)", state.totalEvidence(), state.getEvidence().size());

        Set<String> repositoryFiles = repositoryFiles(state.getEvidence(RepositoryFileCollector.SOURCE_KEY));
        List<Evidence> crossReferences = new ArrayList<>();
        for (Evidence claim : state.getEvidence(DocumentConceptCollector.SOURCE_KEY)) {
            if (!claim.goal().toLowerCase(Locale.ROOT).contains("cross_reference")
                    || claim.content() == null || claim.content().isBlank()) {
                continue;
            }
            crossReferences.add(crossReference(claim, repositoryFiles));
        }
        if (crossReferences.isEmpty()) {
            return AuditDelta.empty();
        }
        return AuditDelta.builder().evidence(CROSS_REF_KEY, crossReferences).build();
    }

    private Evidence crossReference(Evidence claim, Set<String> repositoryFiles) {
        List<String> claimed = Arrays.stream(claim.content().split(","))
                .map(String::trim)
                .filter(path -> !path.isEmpty())
                .toList();
        List<String> verified = new ArrayList<>();
        List<String> hallucinated = new ArrayList<>();
        for (String path : claimed) {
            String normalized = normalize(path);
            boolean exists = repositoryFiles.stream().anyMatch(file -> file.equals(normalized) || file.endsWith("/" + normalized)
                    || file.contains(normalized));
            (exists ? verified : hallucinated).add(path);
        }
        if (!hallucinated.isEmpty()) {
            log.warn("Cross-reference found {} hallucinated path(s): {}", hallucinated.size(), hallucinated);
        }
        Evidence evidence = Evidence.of("Cross-reference: document paths missing from the repository",
                        !hallucinated.isEmpty(), "evidence_aggregator/cross_reference", 0.9,
                        "Document cited " + claimed.size() + " path(s): " + verified.size() + " verified, "
                                + hallucinated.size() + " not found in the repository")
                .withContent("Hallucinated paths: " + hallucinated + ". Verified: " + verified)
                .forCriterion(accuracyCriterionId);
        return hallucinated.isEmpty() ? evidence : evidence.withSeverity(Severity.MEDIUM);
    }

    private static Set<String> repositoryFiles(List<Evidence> repositoryEvidence) {
        Set<String> files = new LinkedHashSet<>();
        for (Evidence item : repositoryEvidence) {
            if (!item.found() || !item.goal().toLowerCase(Locale.ROOT).contains("file")) {
                continue;
            }
            files.add(normalize(item.location()));
            if (item.content() != null) {
                item.content().lines()
                        .map(String::trim)
                        .filter(line -> !line.isEmpty())
                        .map(EvidenceAggregatorNode::normalize)
                        .forEach(files::add);
            }
        }
        files.remove(".");
        files.remove("");
        return files;
    }

    private static String normalize(String path) {
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }
}
