package com.eainde.auditor.workflow;

import com.eainde.auditor.collector.DocumentConceptCollector;
import com.eainde.auditor.collector.RepositoryFileCollector;
import com.eainde.auditor.config.AuditorProperties;
import com.eainde.auditor.config.RubricLoader;
import com.eainde.auditor.edges.AuditRoutes;
import com.eainde.auditor.edges.ConditionalRouter;
import com.eainde.auditor.extraction.OpinionSchema;
import com.eainde.auditor.extraction.StructuredExtractionAdapter;
import com.eainde.auditor.generator.OpinionGenerator;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.ReviewerRole;
import com.eainde.auditor.nodes.EvidenceAggregatorNode;
import com.eainde.auditor.nodes.EvidenceCollectorNode;
import com.eainde.auditor.nodes.JudgeNode;
import com.eainde.auditor.nodes.SynthesisNode;
import com.eainde.auditor.synthesis.SynthesisEngine;
import org.bsc.langgraph4j.GraphStateException;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The audit graph:
 *
 * <pre>
 * collect (repo_investigator | doc_analyst)
 *   -> no evidence and errors ? failed
 *   -> aggregate (evidence_aggregator)
 *   -> judge (one node per role and rubric criterion, e.g. prosecutor/git_forensic_analysis)
 *   -> synthesize (chief_justice)
 *   -> END
 * </pre>
 */
@Component
public class AuditWorkflowGraph {

    public static final String COLLECT = "collect";
    public static final String AGGREGATE = "aggregate";
    public static final String JUDGE = "judge";
    public static final String SYNTHESIZE = "synthesize";

    public static final String REPO_INVESTIGATOR = "repo_investigator";
    public static final String DOC_ANALYST = "doc_analyst";

    private final RepositoryFileCollector repositoryCollector;
    private final DocumentConceptCollector documentCollector;
    private final OpinionGenerator opinionGenerator;
    private final StructuredExtractionAdapter adapter;
    private final OpinionSchema opinionSchema;
    private final SynthesisEngine synthesisEngine;
    private final AuditorProperties properties;
    private final RubricLoader.Rubric rubric;

    public AuditWorkflowGraph(RepositoryFileCollector repositoryCollector,
                              DocumentConceptCollector documentCollector,
                              OpinionGenerator opinionGenerator,
                              StructuredExtractionAdapter adapter,
                              OpinionSchema opinionSchema,
                              SynthesisEngine synthesisEngine,
                              AuditorProperties properties,
                              RubricLoader.Rubric rubric) {
        this.repositoryCollector = repositoryCollector;
        this.documentCollector = documentCollector;
        this.opinionGenerator = opinionGenerator;
        this.adapter = adapter;
        this.opinionSchema = opinionSchema;
        this.synthesisEngine = synthesisEngine;
        this.properties = properties;
        this.rubric = rubric;
    }

    @Bean("auditGraph")
    public AuditGraph build() throws GraphStateException {
        AuditGraph.Builder graph = AuditGraph.builder()
                .addNode(EvidenceCollectorNode.forRepository(REPO_INVESTIGATOR, repositoryCollector))
                .addNode(EvidenceCollectorNode.forDocument(DOC_ANALYST, documentCollector))
                .addNode(new EvidenceAggregatorNode(properties.getCollectors().getAccuracyCriterion()))
                .addNode(new SynthesisNode(synthesisEngine));
        List<String> judges = new ArrayList<>();
        for (ReviewerRole role : ReviewerRole.values()) {
            for (Criterion criterion : rubric.dimensions()) {
                JudgeNode judge = new JudgeNode(role, criterion, opinionGenerator, adapter, opinionSchema);
                graph.addNode(judge);
                judges.add(judge.id());
            }
        }

        return graph
                .addStage(COLLECT, REPO_INVESTIGATOR, DOC_ANALYST)
                .addStage(AGGREGATE, EvidenceAggregatorNode.ID)
                .addStage(JUDGE, judges)
                .addStage(SYNTHESIZE, SynthesisNode.ID)
                .addTerminal(AuditGraph.END)
                .addTerminal(AuditGraph.FAILED)
                .setEntryPoint(COLLECT)
                .addRouter(ConditionalRouter.from(COLLECT)
                        .when("no_evidence", AuditRoutes.noEvidenceWithErrors(), AuditGraph.FAILED)
                        .otherwise(AGGREGATE))
                .addRouter(ConditionalRouter.always(AGGREGATE, JUDGE))
                .addRouter(ConditionalRouter.always(JUDGE, SYNTHESIZE))
                .addRouter(ConditionalRouter.always(SYNTHESIZE, AuditGraph.END))
                .compile();
    }
}
