package com.eainde.auditor.config;

import com.eainde.auditor.model.Criterion;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the rubric's {@code dimensions} array.
 */
@Slf4j
@RequiredArgsConstructor
public class RubricLoader {

    private final ObjectMapper objectMapper;

    public List<Criterion> load(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            List<Criterion> criteria = load(in);
            log.info("Loaded {} rubric criteria from {}", criteria.size(), resource.getDescription());
            return criteria;
        }
    }

    public List<Criterion> load(InputStream in) throws IOException {
        Rubric rubric = objectMapper.readValue(in, Rubric.class);
        if (rubric.dimensions() == null || rubric.dimensions().isEmpty()) {
            throw new IOException("Rubric has no dimensions");
        }
        Set<String> seen = new HashSet<>();
        for (Criterion criterion : rubric.dimensions()) {
            if (!seen.add(criterion.id())) {
                throw new IOException("Rubric lists criterion '" + criterion.id() + "' more than once");
            }
        }
        return List.copyOf(rubric.dimensions());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Rubric(@JsonProperty("dimensions") List<Criterion> dimensions) {
    }
}
