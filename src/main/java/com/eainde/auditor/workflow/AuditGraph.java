package com.eainde.auditor.workflow;

import com.eainde.auditor.edges.ConditionalRouter;
import com.eainde.auditor.nodes.AuditNode;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A compiled, validated stage graph. Stages run strictly one after another; after each stage's
 * barrier the stage's router picks the next one, until a terminal stage is reached.
 *
 * <p>Construction failures surface as {@link GraphStateException} from {@link Builder#compile()},
 * before any run starts.</p>
 */
public final class AuditGraph {

    /** Default terminal stage for a successful run. */
    public static final String END = StateGraph.END;

    /** Terminal stage for runs that had nothing to judge. */
    public static final String FAILED = "failed";

    private final String entryStage;
    private final Map<String, Stage> stages;
    private final Map<String, ConditionalRouter> routers;
    private final Set<String> terminals;

    private AuditGraph(String entryStage, Map<String, Stage> stages,
                       Map<String, ConditionalRouter> routers, Set<String> terminals) {
        this.entryStage = entryStage;
        this.stages = Map.copyOf(stages);
        this.routers = Map.copyOf(routers);
        this.terminals = Set.copyOf(terminals);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String entryStage() {
        return entryStage;
    }

    public boolean isTerminal(String stageId) {
        return terminals.contains(stageId);
    }

    public Stage stage(String stageId) {
        Stage stage = stages.get(stageId);
        if (stage == null) {
            throw new IllegalArgumentException("Unknown stage: " + stageId);
        }
        return stage;
    }

    public ConditionalRouter router(String stageId) {
        ConditionalRouter router = routers.get(stageId);
        if (router == null) {
            throw new IllegalArgumentException("No router for stage: " + stageId);
        }
        return router;
    }

    public Set<String> terminals() {
        return terminals;
    }

    public static final class Builder {

        private final Map<String, AuditNode> nodes = new LinkedHashMap<>();
        private final Map<String, List<String>> stageNodeIds = new LinkedHashMap<>();
        private final Map<String, ConditionalRouter> routers = new LinkedHashMap<>();
        private final Set<String> terminals = new LinkedHashSet<>();
        private final List<String> problems = new ArrayList<>();
        private String entryStage;

        private Builder() {
        }

        public Builder addNode(AuditNode node) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                problems.add("duplicate node id '" + node.id() + "'");
            }
            return this;
        }

        public Builder addStage(String stageId, String... nodeIds) {
            return addStage(stageId, List.of(nodeIds));
        }

        public Builder addStage(String stageId, List<String> nodeIds) {
            if (stageNodeIds.putIfAbsent(stageId, List.copyOf(nodeIds)) != null) {
                problems.add("duplicate stage id '" + stageId + "'");
            }
            return this;
        }

        public Builder addTerminal(String stageId) {
            terminals.add(stageId);
            return this;
        }

        public Builder addRouter(ConditionalRouter router) {
            if (routers.putIfAbsent(router.fromStage(), router) != null) {
                problems.add("stage '" + router.fromStage() + "' has more than one router");
            }
            return this;
        }

        public Builder setEntryPoint(String stageId) {
            this.entryStage = stageId;
            return this;
        }

        public AuditGraph compile() throws GraphStateException {
            List<String> errors = new ArrayList<>(problems);

            if (terminals.isEmpty()) {
                errors.add("no terminal stage declared");
            }
            if (entryStage == null) {
                errors.add("no entry point set");
            } else if (!stageNodeIds.containsKey(entryStage) && !terminals.contains(entryStage)) {
                errors.add("entry point '" + entryStage + "' is not a defined stage");
            }

            Map<String, Stage> stages = new LinkedHashMap<>();
            stageNodeIds.forEach((stageId, ids) -> {
                if (terminals.contains(stageId)) {
                    errors.add("stage '" + stageId + "' is declared both as a work stage and as terminal");
                }
                if (ids.isEmpty()) {
                    errors.add("stage '" + stageId + "' has no nodes");
                }
                List<AuditNode> resolved = new ArrayList<>();
                Map<String, String> keyOwners = new HashMap<>();
                for (String nodeId : ids) {
                    AuditNode node = nodes.get(nodeId);
                    if (node == null) {
                        errors.add("stage '" + stageId + "' references undefined node '" + nodeId + "'");
                        continue;
                    }
                    for (String key : node.ownedEvidenceKeys()) {
                        String previous = keyOwners.putIfAbsent(key, nodeId);
                        if (previous != null) {
                            errors.add("stage '" + stageId + "': evidence key '" + key
                                    + "' is owned by both '" + previous + "' and '" + nodeId + "'");
                        }
                    }
                    resolved.add(node);
                }
                stages.put(stageId, new Stage(stageId, resolved));
            });

            for (String stageId : stageNodeIds.keySet()) {
                ConditionalRouter router = routers.get(stageId);
                if (router == null) {
                    errors.add("stage '" + stageId + "' has no outgoing router");
                    continue;
                }
                if (router.otherwise().isEmpty()) {
                    errors.add("router for stage '" + stageId + "' has no otherwise target, so it is not total");
                }
                for (String target : router.targets()) {
                    if (!stageNodeIds.containsKey(target) && !terminals.contains(target)) {
                        errors.add("router for stage '" + stageId + "' targets undefined stage '" + target + "'");
                    }
                }
            }
            for (String routed : routers.keySet()) {
                if (!stageNodeIds.containsKey(routed)) {
                    errors.add("router declared for unknown or terminal stage '" + routed + "'");
                }
            }

            if (entryStage != null && errors.isEmpty()) {
                Set<String> reachable = reachableFrom(entryStage);
                stageNodeIds.keySet().stream()
                        .filter(stageId -> !reachable.contains(stageId))
                        .forEach(stageId -> errors.add("stage '" + stageId + "' is unreachable from '" + entryStage + "'"));
            }

            if (!errors.isEmpty()) {
                throw new GraphStateException("Invalid audit graph: " + String.join("; ", errors));
            }
            return new AuditGraph(entryStage, stages, routers, terminals);
        }

        private Set<String> reachableFrom(String start) {
            Set<String> seen = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>(List.of(start));
            while (!pending.isEmpty()) {
                String current = pending.pop();
                if (!seen.add(current)) {
                    continue;
                }
                ConditionalRouter router = routers.get(current);
                if (router != null) {
                    pending.addAll(router.targets());
                }
            }
            return seen;
        }
    }
}
