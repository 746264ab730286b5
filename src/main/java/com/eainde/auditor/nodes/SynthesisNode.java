package com.eainde.auditor.nodes;

import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.state.AuditDelta;
import com.eainde.auditor.state.AuditState;
import com.eainde.auditor.synthesis.SynthesisEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Final stage: reduces every opinion to verdicts and seals the run by setting the final result.
 */
@Slf4j
public class SynthesisNode implements AuditNode {

    public static final String ID = "chief_justice";

    private final SynthesisEngine engine;

    public SynthesisNode(SynthesisEngine engine) {
        this.engine = engine;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Map<String, Object> apply(AuditState state) {
        AuditReport report = engine.report(state.getCriteria(), state.getEvidence(), state.getOpinions());
        log.info("Synthesized {} verdict(s), overall score {}", report.verdicts().size(), report.overallScore());
        return AuditDelta.builder().finalResult(report).build();
    }
}
