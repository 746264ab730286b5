package com.eainde.auditor.nodes;

import com.eainde.auditor.extraction.ExtractionResult;
import com.eainde.auditor.extraction.OpinionPayload;
import com.eainde.auditor.extraction.OpinionSchema;
import com.eainde.auditor.extraction.StructuredExtractionAdapter;
import com.eainde.auditor.generator.OpinionGenerator;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.JudicialOpinion;
import com.eainde.auditor.model.ReviewerRole;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * One reviewer role judging one rubric criterion. Produces exactly one opinion: a parsed one,
 * or a degraded placeholder plus a GenerationError when the generator never delivers.
 *
 * <p>The judge stage holds one of these per (role, criterion) pair, so a slow criterion only
 * costs its own opinion when the per-node timeout fires.</p>
 */
@Slf4j
public class JudgeNode implements AuditNode {

    private final ReviewerRole role;
    private final Criterion criterion;
    private final OpinionGenerator generator;
    private final StructuredExtractionAdapter adapter;
    private final OpinionSchema schema;

    public JudgeNode(ReviewerRole role, Criterion criterion, OpinionGenerator generator,
                     StructuredExtractionAdapter adapter, OpinionSchema schema) {
        this.role = role;
        this.criterion = criterion;
        this.generator = generator;
        this.adapter = adapter;
        this.schema = schema;
    }

    public static String nodeId(ReviewerRole role, Criterion criterion) {
        return role.nodeId() + "/" + criterion.id();
    }

    @Override
    public String id() {
        return nodeId(role, criterion);
    }

    public ReviewerRole role() {
        return role;
    }

    @Override
    public Map<String, Object> apply(AuditState state) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException(id() + " interrupted before judging");
        }
        // the run's criteria win over the rubric the graph was built from
        Optional<Criterion> target = state.getCriteria().stream()
                .filter(candidate -> candidate.id().equals(criterion.id()))
                .findFirst();
        if (target.isEmpty()) {
            log.debug("{}: criterion '{}' is not part of this run", id(), criterion.id());
            return AuditDelta.empty();
        }
        Criterion judged = target.get();
        log.info("{} judging '{}'", role.displayName(), judged.id());

        ExtractionResult<OpinionPayload> result = adapter.extract(id(), schema,
                () -> generator.generate(role, judged, state.getEvidence()));
        JudicialOpinion opinion = result.value().toOpinion(judged.id(), role, result.degraded());
        AuditDelta delta = AuditDelta.builder().opinion(opinion);
        if (result.degraded()) {
            delta.error(result.error());
        } else {
            log.info("{} scored '{}': {}", role.displayName(), judged.id(), opinion.score());
        }
        return delta.build();
    }
}
