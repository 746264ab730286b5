package com.eainde.auditor.workflow;

import com.eainde.auditor.nodes.AuditNode;

import java.util.List;

/**
 * One fan-out group: its nodes run concurrently against the same snapshot.
 */
public record Stage(String id, List<AuditNode> nodes) {

    public Stage {
        nodes = List.copyOf(nodes);
    }

    public List<String> nodeIds() {
        return nodes.stream().map(AuditNode::id).toList();
    }
}
