package com.eainde.auditor.collector;

import com.eainde.auditor.error.CollectionException;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Inspects a checked-out repository directory: file manifest, required files, version-control
 * history and shell-execution calls in source files.
 *
 * <p>A shell-execution call is reported as a confirmed {@link Severity#HIGH} finding against the
 * security criterion, which lets synthesis cap that criterion's score.</p>
 */
@Slf4j
public class RepositoryFileCollector implements EvidenceCollector {

    public static final String SOURCE_KEY = "repo";
    static final String MANIFEST_GOAL = "Repository file manifest";
    static final String SHELL_SCAN_GOAL = "Detect shell-execution calls in source files";

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(".git", "target", "node_modules", ".venv", "__pycache__");
    private static final Set<String> SCANNED_EXTENSIONS = Set.of(".py", ".java", ".sh", ".js", ".ts", ".rb");
    private static final List<String> SHELL_CALLS = List.of("os.system(", "Runtime.getRuntime().exec(", "shell=True");

    private final List<String> requiredFiles;
    private final String securityCriterionId;
    private final String historyCriterionId;

    public RepositoryFileCollector(List<String> requiredFiles, String securityCriterionId, String historyCriterionId) {
        this.requiredFiles = List.copyOf(requiredFiles);
        this.securityCriterionId = securityCriterionId;
        this.historyCriterionId = historyCriterionId;
    }

    @Override
    public String sourceKey() {
        return SOURCE_KEY;
    }

    @Override
    public List<Evidence> collect(String reference) throws CollectionException {
        if (reference == null || reference.isBlank()) {
            throw new CollectionException("no repository reference given");
        }
        Path root = Path.of(reference);
        if (!Files.isDirectory(root)) {
            throw new CollectionException("repository directory not found: " + reference);
        }

        List<String> manifest = manifest(root);
        log.info("Repository {} has {} file(s)", root, manifest.size());

        List<Evidence> evidence = new ArrayList<>();
        evidence.add(Evidence.of(MANIFEST_GOAL, !manifest.isEmpty(), ".", 1.0,
                        "Walked the working tree, skipping " + SKIPPED_DIRECTORIES)
                .withContent(String.join("\n", manifest)));

        Set<String> present = Set.copyOf(manifest);
        for (String required : requiredFiles) {
            boolean found = present.contains(required);
            evidence.add(Evidence.of("Verify required file exists: " + required, found, required,
                    found ? 1.0 : 0.9,
                    found ? "File present in the working tree" : "File absent from the working tree"));
        }

        boolean hasHistory = Files.isDirectory(root.resolve(".git"));
        evidence.add(Evidence.of("Verify version-control history is present", hasHistory, ".git",
                        hasHistory ? 0.6 : 0.9,
                        hasHistory ? "A .git directory exists; commit progression was not inspected"
                                : "No .git directory in the working tree")
                .forCriterion(historyCriterionId));

        evidence.addAll(scanForShellCalls(root, manifest));
        return evidence;
    }

    private List<Evidence> scanForShellCalls(Path root, List<String> manifest) {
        List<Evidence> findings = new ArrayList<>();
        for (String file : manifest) {
            if (SCANNED_EXTENSIONS.stream().noneMatch(file::endsWith)) {
                continue;
            }
            List<String> lines;
            try {
                lines = readSource(root.resolve(file));
            } catch (MalformedInputException e) {
                log.debug("Skipping non UTF-8 file {}", file);
                continue;
            } catch (IOException e) {
                log.warn("Could not read {}, leaving it out of the shell-call scan: {}", file, e.getMessage());
                findings.add(Evidence.of(SHELL_SCAN_GOAL, false, file, 0.3,
                                "File could not be read and was not scanned: " + e.getMessage())
                        .forCriterion(securityCriterionId));
                continue;
            }
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                for (String call : SHELL_CALLS) {
                    if (line.contains(call)) {
                        findings.add(Evidence.of(SHELL_SCAN_GOAL, true, file + ":" + (i + 1), 1.0,
                                        "Shell execution via " + call.trim() + " allows command injection")
                                .withContent(line.trim())
                                .forCriterion(securityCriterionId)
                                .withSeverity(Severity.HIGH));
                    }
                }
            }
        }
        if (findings.stream().noneMatch(Evidence::found)) {
            findings.add(Evidence.of(SHELL_SCAN_GOAL, false, ".", 0.8,
                            "No " + SHELL_CALLS + " calls in " + SCANNED_EXTENSIONS + " files")
                    .forCriterion(securityCriterionId));
        }
        return findings;
    }

    private static List<String> manifest(Path root) throws CollectionException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(relative -> !isSkipped(relative))
                    .map(relative -> relative.toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new CollectionException("could not walk repository " + root + ": " + e.getMessage(), e);
        }
    }

    private static boolean isSkipped(Path relative) {
        for (Path part : relative) {
            if (SKIPPED_DIRECTORIES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }

    /** Reads one source file of the working tree. */
    List<String> readSource(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }
}
