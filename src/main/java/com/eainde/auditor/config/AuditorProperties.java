package com.eainde.auditor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code auditor.*} in application.yml. Converted into the immutable
 * runtime records in {@link AuditorConfiguration}; nothing reads this class at run time.
 */
@Data
@ConfigurationProperties(prefix = "auditor")
public class AuditorProperties {

    /** Rubric location, any Spring resource string. */
    private String rubric = "classpath:rubric.json";

    private Scheduler scheduler = new Scheduler();
    private Adapter adapter = new Adapter();
    private Synthesis synthesis = new Synthesis();
    private Model model = new Model();
    private Collectors collectors = new Collectors();
    private Target target = new Target();

    @Data
    public static class Scheduler {
        private int workerPoolSize = 4;
        private Duration nodeTimeout = Duration.ofMinutes(5);
        private Duration runTimeout = Duration.ofMinutes(30);
        private int maxStageTransitions = 25;
    }

    @Data
    public static class Adapter {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
        private int maxConcurrentCalls = 2;
    }

    @Data
    public static class Synthesis {
        private int scoreMin = 1;
        private int scoreMax = 5;
        private int factOverrideCeiling = 3;
        private int dissentThreshold = 2;
        private double confirmationConfidence = 0.8;
        /** category -> role display name -> weight */
        private Map<String, Map<String, Double>> weights = new LinkedHashMap<>();
    }

    @Data
    public static class Model {
        private String baseUrl;
        private String apiKey;
        private String modelName = "gpt-4o-mini";
        private Double temperature = 0.1;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Collectors {
        private List<String> requiredFiles = new ArrayList<>();
        private String securityCriterion = "safe_tool_engineering";
        private String historyCriterion = "git_forensic_analysis";
        private String conceptCriterion = "theoretical_depth";
        private String accuracyCriterion = "report_accuracy";
        /** concept -> keywords */
        private Map<String, List<String>> concepts = new LinkedHashMap<>();
    }

    @Data
    public static class Target {
        /** Checked-out repository directory; when set, one audit runs at startup. */
        private String repository;
        private String document;
        private String output = "audit-report.json";
    }
}
