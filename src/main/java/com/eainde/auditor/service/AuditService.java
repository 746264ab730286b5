package com.eainde.auditor.service;

import com.eainde.auditor.config.RubricLoader;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.report.ReportRenderer;
import com.eainde.auditor.workflow.AuditGraph;
import com.eainde.auditor.workflow.AuditOutcome;
import com.eainde.auditor.workflow.AuditWorkflowEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for running audits: one call per run, rubric loaded once at startup.
 */
@Slf4j
@Service
public class AuditService {

    private final AuditWorkflowEngine engine;
    private final AuditGraph auditGraph;
    private final ReportRenderer reportRenderer;
    private final List<Criterion> criteria;

    public AuditService(AuditWorkflowEngine engine, AuditGraph auditGraph, ReportRenderer reportRenderer,
                        RubricLoader.Rubric rubric) {
        this.engine = engine;
        this.auditGraph = auditGraph;
        this.reportRenderer = reportRenderer;
        this.criteria = rubric.dimensions();
    }

    public AuditOutcome audit(AuditRunRequest request) {
        log.info("Starting audit {} of {}", request.runId(), request.repositoryRef());
        return engine.run(auditGraph, request, criteria);
    }

    public String render(AuditOutcome outcome) {
        return reportRenderer.render(outcome.verdicts(), outcome.errors());
    }

    public List<Criterion> criteria() {
        return criteria;
    }
}
