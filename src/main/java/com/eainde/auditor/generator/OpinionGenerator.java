package com.eainde.auditor.generator;

import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.ReviewerRole;

import java.util.List;
import java.util.Map;

/**
 * The external, unreliable call that produces a reviewer's raw reply. Only ever invoked through
 * the structured extraction adapter.
 */
@FunctionalInterface
public interface OpinionGenerator {

    String generate(ReviewerRole role, Criterion criterion, Map<String, List<Evidence>> evidence) throws Exception;
}
