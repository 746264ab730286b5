package com.eainde.auditor.state;

import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.JudicialOpinion;

import java.util.List;
import java.util.SortedMap;

/**
 * Value-comparable projection of an {@link AuditState}: evidence keys sorted, opinions in
 * canonical order, errors sorted.
 */
public record StateView(
        SortedMap<String, List<Evidence>> evidence,
        List<JudicialOpinion> opinions,
        List<String> errors,
        AuditReport finalResult
) {}
