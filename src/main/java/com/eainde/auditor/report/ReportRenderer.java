package com.eainde.auditor.report;

import com.eainde.auditor.model.CriterionVerdict;

import java.util.List;

/**
 * One-way consumer of a finished run's verdicts and error list.
 */
public interface ReportRenderer {

    String render(List<CriterionVerdict> verdicts, List<String> errors);
}
