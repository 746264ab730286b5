package com.eainde.auditor.report;

import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.CriterionVerdict;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Renders verdicts and errors as pretty-printed JSON. Verdicts are sorted by criterion id and
 * errors lexicographically, so identical runs render byte-identical documents.
 */
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;

    public JsonReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public String render(List<CriterionVerdict> verdicts, List<String> errors) {
        List<CriterionVerdict> sorted = verdicts.stream()
                .sorted(Comparator.comparing(CriterionVerdict::criterionId))
                .toList();
        RenderedReport document = new RenderedReport(
                AuditReport.of(sorted).overallScore(),
                sorted,
                errors.stream().sorted().toList());
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render audit report", e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RenderedReport(
            @JsonProperty("overallScore") BigDecimal overallScore,
            @JsonProperty("verdicts")     List<CriterionVerdict> verdicts,
            @JsonProperty("errors")       List<String> errors
    ) {
    }
}
