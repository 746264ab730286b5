package com.eainde.auditor.config;

import com.eainde.auditor.collector.DocumentConceptCollector;
import com.eainde.auditor.collector.RepositoryFileCollector;
import com.eainde.auditor.extraction.CallLimiter;
import com.eainde.auditor.extraction.OpinionSchema;
import com.eainde.auditor.extraction.RetryPolicy;
import com.eainde.auditor.extraction.Sleeper;
import com.eainde.auditor.extraction.StructuredExtractionAdapter;
import com.eainde.auditor.generator.ChatModelOpinionGenerator;
import com.eainde.auditor.generator.OpinionGenerator;
import com.eainde.auditor.model.ReviewerRole;
import com.eainde.auditor.model.ScoreScale;
import com.eainde.auditor.report.JsonReportRenderer;
import com.eainde.auditor.report.ReportRenderer;
import com.eainde.auditor.state.StateStore;
import com.eainde.auditor.synthesis.SynthesisConfig;
import com.eainde.auditor.synthesis.SynthesisEngine;
import com.eainde.auditor.synthesis.WeightTable;
import com.eainde.auditor.thread.MdcAwareExecutor;
import com.eainde.auditor.workflow.AuditWorkflowEngine;
import com.eainde.auditor.workflow.FanOutScheduler;
import com.eainde.auditor.workflow.NodeExecutor;
import com.eainde.auditor.workflow.SchedulerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns {@link AuditorProperties} into the immutable runtime configuration and wires the
 * engine's collaborators.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AuditorProperties.class)
public class AuditorConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean
    public SchedulerConfig schedulerConfig(AuditorProperties properties) {
        AuditorProperties.Scheduler scheduler = properties.getScheduler();
        return new SchedulerConfig(scheduler.getWorkerPoolSize(), scheduler.getNodeTimeout(),
                scheduler.getRunTimeout(), scheduler.getMaxStageTransitions());
    }

    @Bean
    public ScoreScale scoreScale(AuditorProperties properties) {
        return new ScoreScale(properties.getSynthesis().getScoreMin(), properties.getSynthesis().getScoreMax());
    }

    @Bean
    public SynthesisConfig synthesisConfig(AuditorProperties properties, ScoreScale scale) {
        AuditorProperties.Synthesis synthesis = properties.getSynthesis();
        return new SynthesisConfig(scale, synthesis.getFactOverrideCeiling(), synthesis.getDissentThreshold(),
                synthesis.getConfirmationConfidence(), weightTable(synthesis.getWeights()));
    }

    @Bean
    public RetryPolicy retryPolicy(AuditorProperties properties) {
        AuditorProperties.Adapter adapter = properties.getAdapter();
        return new RetryPolicy(adapter.getMaxAttempts(), adapter.getInitialBackoff(),
                adapter.getBackoffMultiplier(), adapter.getMaxBackoff());
    }

    @Bean
    public CallLimiter callLimiter(AuditorProperties properties) {
        return new CallLimiter(properties.getAdapter().getMaxConcurrentCalls());
    }

    @Bean
    public StructuredExtractionAdapter structuredExtractionAdapter(RetryPolicy retryPolicy, CallLimiter callLimiter) {
        return new StructuredExtractionAdapter(retryPolicy, callLimiter, Sleeper.THREAD);
    }

    @Bean
    public OpinionSchema opinionSchema(ObjectMapper objectMapper, ScoreScale scale) {
        return new OpinionSchema(objectMapper, scale);
    }

    @Bean
    @ConditionalOnProperty(prefix = "auditor.model", name = "api-key")
    public ChatModel chatModel(AuditorProperties properties) {
        AuditorProperties.Model model = properties.getModel();
        return OpenAiChatModel.builder()
                .baseUrl(model.getBaseUrl())
                .apiKey(model.getApiKey())
                .modelName(model.getModelName())
                .temperature(model.getTemperature())
                .timeout(model.getTimeout())
                .build();
    }

    @Bean
    public OpinionGenerator opinionGenerator(ObjectProvider<ChatModel> chatModel, ScoreScale scale) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.warn("No chat model configured (auditor.model.api-key); every opinion will be degraded");
            return (role, criterion, evidence) -> {
                throw new IllegalStateException("no chat model configured");
            };
        }
        return new ChatModelOpinionGenerator(model, scale);
    }

    @Bean
    public SynthesisEngine synthesisEngine(SynthesisConfig synthesisConfig) {
        return new SynthesisEngine(synthesisConfig);
    }

    @Bean
    public RepositoryFileCollector repositoryFileCollector(AuditorProperties properties) {
        AuditorProperties.Collectors collectors = properties.getCollectors();
        return new RepositoryFileCollector(collectors.getRequiredFiles(), collectors.getSecurityCriterion(),
                collectors.getHistoryCriterion());
    }

    @Bean
    public DocumentConceptCollector documentConceptCollector(AuditorProperties properties) {
        AuditorProperties.Collectors collectors = properties.getCollectors();
        return new DocumentConceptCollector(collectors.getConcepts(), collectors.getConceptCriterion());
    }

    @Bean
    public StateStore stateStore() {
        return new StateStore();
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor auditWorkers(SchedulerConfig schedulerConfig) {
        return new MdcAwareExecutor(schedulerConfig.workerPoolSize(), "audit-worker-");
    }

    @Bean
    public FanOutScheduler fanOutScheduler(SchedulerConfig schedulerConfig, StateStore stateStore,
                                           MdcAwareExecutor auditWorkers) {
        return new FanOutScheduler(new NodeExecutor(schedulerConfig.nodeTimeout()), stateStore, auditWorkers);
    }

    @Bean
    public AuditWorkflowEngine auditWorkflowEngine(FanOutScheduler scheduler, StateStore stateStore,
                                                   SchedulerConfig schedulerConfig) {
        return new AuditWorkflowEngine(scheduler, stateStore, schedulerConfig);
    }

    @Bean
    public ReportRenderer reportRenderer(ObjectMapper objectMapper) {
        return new JsonReportRenderer(objectMapper);
    }

    @Bean
    public RubricLoader rubricLoader(ObjectMapper objectMapper) {
        return new RubricLoader(objectMapper);
    }

    @Bean
    public RubricLoader.Rubric rubric(RubricLoader rubricLoader, ResourceLoader resourceLoader,
                                      AuditorProperties properties) {
        try {
            return new RubricLoader.Rubric(rubricLoader.load(resourceLoader.getResource(properties.getRubric())));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load rubric " + properties.getRubric(), e);
        }
    }

    static WeightTable weightTable(Map<String, Map<String, Double>> configured) {
        if (configured == null || configured.isEmpty()) {
            return WeightTable.equalWeights();
        }
        Map<String, Map<ReviewerRole, Double>> rows = new LinkedHashMap<>();
        configured.forEach((category, weights) -> {
            Map<ReviewerRole, Double> row = new EnumMap<>(ReviewerRole.class);
            weights.forEach((role, weight) -> row.put(ReviewerRole.fromDisplayName(role), weight));
            rows.put(category, row);
        });
        return WeightTable.of(rows);
    }
}
