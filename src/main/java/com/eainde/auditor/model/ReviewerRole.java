package com.eainde.auditor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The closed set of reviewer roles on the bench. Adding a role means adding a constant here
 * and a column in the {@link com.eainde.auditor.synthesis.WeightTable}; nothing subclasses.
 *
 * <p>Declaration order is the tie-breaking order used for every externally visible sort.</p>
 */
public enum ReviewerRole {

    PROSECUTOR("Prosecutor", "prosecutor",
            "Trust no one. Look for gaps, security flaws, shortcuts and missing error handling."),
    DEFENSE("Defense", "defense",
            "Reward effort and intent. Look for evidence of iteration, understanding and creative workarounds."),
    TECH_LEAD("TechLead", "tech_lead",
            "Does it work and is it maintainable? Judge architecture and practical viability.");

    private final String displayName;
    private final String nodeId;
    private final String lens;

    ReviewerRole(String displayName, String nodeId, String lens) {
        this.displayName = displayName;
        this.nodeId = nodeId;
        this.lens = lens;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /** Graph node id used for this role's judge node. */
    public String nodeId() {
        return nodeId;
    }

    /** One-line persona handed to the opinion generator. */
    public String lens() {
        return lens;
    }

    @JsonCreator
    public static ReviewerRole fromDisplayName(String value) {
        return Arrays.stream(values())
                .filter(role -> role.displayName.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)
                        || role.nodeId.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown reviewer role: " + value));
    }
}
