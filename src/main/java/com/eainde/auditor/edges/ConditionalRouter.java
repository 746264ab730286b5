package com.eainde.auditor.edges;

import com.eainde.auditor.state.AuditState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.EdgeAction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Chooses the stage that follows {@link #fromStage()} by evaluating named predicates in
 * registration order; the first match wins and {@code otherwise} catches everything else.
 *
 * <p>Routing is a pure function of the merged snapshot. Totality is checked when the graph is
 * compiled: a router without an {@code otherwise} target is rejected there, so an unmatched
 * state can never surface while a run is in progress.</p>
 *
 * <pre>
 * ConditionalRouter.from("collect")
 *         .when("no_evidence", AuditRoutes.noEvidenceWithErrors(), "failed")
 *         .otherwise("aggregate");
 * </pre>
 */
@Slf4j
public final class ConditionalRouter implements EdgeAction<AuditState> {

    /** One named predicate and the stage it leads to. */
    public record Transition(String name, Predicate<AuditState> condition, String target) {
        public Transition {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(target, "target");
        }
    }

    private final String fromStage;
    private final List<Transition> transitions;
    private final String otherwise;

    private ConditionalRouter(String fromStage, List<Transition> transitions, String otherwise) {
        this.fromStage = fromStage;
        this.transitions = List.copyOf(transitions);
        this.otherwise = otherwise;
    }

    public static Builder from(String fromStage) {
        return new Builder(fromStage);
    }

    /** Unconditional edge. */
    public static ConditionalRouter always(String fromStage, String target) {
        return from(fromStage).otherwise(target);
    }

    @Override
    public String apply(AuditState state) {
        for (Transition transition : transitions) {
            if (matches(transition, state)) {
                log.debug("Route {} -> {} via '{}'", fromStage, transition.target(), transition.name());
                return transition.target();
            }
        }
        if (otherwise == null) {
            throw new IllegalStateException("Router for stage '" + fromStage + "' has no otherwise target");
        }
        return otherwise;
    }

    private boolean matches(Transition transition, AuditState state) {
        try {
            return transition.condition().test(state);
        } catch (RuntimeException e) {
            log.warn("Route predicate '{}' on stage '{}' failed and is treated as not matching",
                    transition.name(), fromStage, e);
            return false;
        }
    }

    public String fromStage() {
        return fromStage;
    }

    public Optional<String> otherwise() {
        return Optional.ofNullable(otherwise);
    }

    /** Every stage this router can lead to. */
    public Set<String> targets() {
        Set<String> targets = new LinkedHashSet<>();
        transitions.forEach(transition -> targets.add(transition.target()));
        if (otherwise != null) {
            targets.add(otherwise);
        }
        return targets;
    }

    public static final class Builder {
        private final String fromStage;
        private final List<Transition> transitions = new ArrayList<>();

        private Builder(String fromStage) {
            this.fromStage = Objects.requireNonNull(fromStage, "fromStage");
        }

        public Builder when(String name, Predicate<AuditState> condition, String target) {
            transitions.add(new Transition(name, condition, target));
            return this;
        }

        public ConditionalRouter otherwise(String target) {
            return new ConditionalRouter(fromStage, transitions, Objects.requireNonNull(target, "target"));
        }

        /**
         * Builds without a fallback. Such a router is only useful to show a configuration defect:
         * {@link com.eainde.auditor.workflow.AuditGraph.Builder#compile()} rejects it.
         */
        public ConditionalRouter withoutFallback() {
            return new ConditionalRouter(fromStage, transitions, null);
        }
    }
}
