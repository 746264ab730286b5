package com.eainde.auditor.nodes;

import com.eainde.auditor.state.AuditState;
import org.bsc.langgraph4j.action.NodeAction;

import java.util.Set;

/**
 * A unit of work in the audit graph: reads a snapshot, returns a delta.
 *
 * <p>Nodes see the snapshot taken before their stage started and never the deltas of their
 * siblings. They may throw; the {@link com.eainde.auditor.workflow.NodeExecutor} turns any
 * failure into an error entry.</p>
 */
public interface AuditNode extends NodeAction<AuditState> {

    /** Unique node id, also the prefix of every error entry this node causes. */
    String id();

    /** Evidence keys this node may write. A key is owned by exactly one node per stage. */
    default Set<String> ownedEvidenceKeys() {
        return Set.of();
    }
}
