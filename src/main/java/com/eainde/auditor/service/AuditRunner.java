package com.eainde.auditor.service;

import com.eainde.auditor.config.AuditorProperties;
import com.eainde.auditor.model.AuditRunRequest;
import com.eainde.auditor.workflow.AuditOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs one audit at startup when {@code auditor.target.repository} is set and writes the JSON
 * report to {@code auditor.target.output}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "auditor.target", name = "repository")
public class AuditRunner implements CommandLineRunner {

    private final AuditService auditService;
    private final AuditorProperties properties;

    @Override
    public void run(String... args) throws Exception {
        AuditorProperties.Target target = properties.getTarget();
        AuditOutcome outcome = auditService.audit(AuditRunRequest.of(target.getRepository(), target.getDocument()));

        Path output = Path.of(target.getOutput());
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, auditService.render(outcome), StandardCharsets.UTF_8);
        log.info("Audit finished ({}, stage '{}'), report written to {}",
                outcome.status(), outcome.finalStage(), output.toAbsolutePath());
        outcome.errors().forEach(error -> log.warn("  {}", error));
    }
}
