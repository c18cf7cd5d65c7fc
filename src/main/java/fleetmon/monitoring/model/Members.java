package fleetmon.monitoring.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Member list helpers. Membership is by node name; order of first arrival is kept.
 */
final class Members {

    private Members() {
    }

    static List<NodeInfo> replaceOrAppend(List<NodeInfo> members, NodeInfo node) {
        List<NodeInfo> updated = new ArrayList<>(members.size() + 1);
        boolean replaced = false;
        for (NodeInfo existing : members) {
            if (existing.nodeName().equals(node.nodeName())) {
                updated.add(node);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(node);
        }
        return updated;
    }

    static List<NodeInfo> remove(List<NodeInfo> members, String nodeName) {
        List<NodeInfo> updated = new ArrayList<>(members.size());
        for (NodeInfo existing : members) {
            if (!existing.nodeName().equals(nodeName)) {
                updated.add(existing);
            }
        }
        return updated;
    }
}
