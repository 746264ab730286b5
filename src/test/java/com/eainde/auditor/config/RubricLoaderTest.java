package com.eainde.auditor.config;

import com.eainde.auditor.model.Criterion;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RubricLoaderTest {

    private final RubricLoader loader = new RubricLoader(new ObjectMapper());

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load every dimension of the bundled rubric")
    void bundledRubric() throws IOException {
        List<Criterion> criteria = loader.load(new ClassPathResource("rubric.json"));

        assertThat(criteria).hasSize(7);
        assertThat(criteria).extracting(Criterion::id).contains("git_forensic_analysis", "safe_tool_engineering");
        Criterion history = criteria.get(0);
        assertThat(history.category()).isEqualTo("forensic");
        assertThat(history.targetArtifact()).isEqualTo("repo");
        assertThat(history.forensicInstruction()).isNotBlank();
    }

    @Test
    @DisplayName("should default the category and ignore unknown fields")
    void defaults() throws IOException {
        List<Criterion> criteria = loader.load(json(
                "{\"dimensions\": [{\"id\": \"docs\", \"weight\": 2}], \"synthesis_rules\": {}}"));

        assertThat(criteria).hasSize(1);
        assertThat(criteria.get(0).name()).isEqualTo("docs");
        assertThat(criteria.get(0).category()).isEqualTo(Criterion.DEFAULT_CATEGORY);
    }

    @Test
    @DisplayName("should reject an empty rubric or duplicate criterion ids")
    void rejectsInvalidRubrics() {
        assertThatThrownBy(() -> loader.load(json("{\"dimensions\": []}")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no dimensions");
        assertThatThrownBy(() -> loader.load(json("{\"dimensions\": [{\"id\": \"a\"}, {\"id\": \"a\"}]}")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("'a' more than once");
    }
}
