package podpilot.controlplane.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.repository.NodeRepository;
import podpilot.controlplane.repository.StateStore;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Sticky, deterministic leader selection among healthy nodes.
 *
 * The recorded leader is kept while it exists and is healthy. Otherwise the
 * healthy node with the lexicographically smallest ID takes over. This is
 * selection only: there are no terms and no quorum.
 */
public class LeaderElector {

    private static final Logger log = LoggerFactory.getLogger(LeaderElector.class);

    /** Leader value when no node is healthy */
    public static final String NO_LEADER = "none";

    private final NodeRepository nodes;
    private final ClusterSettings settings;
    private final ClusterLock lock;

    public LeaderElector(StateStore store, ClusterSettings settings, ClusterLock lock) {
        this.nodes = store.nodes();
        this.settings = settings;
        this.lock = lock;
    }

    /**
     * Return the current leader, electing and persisting a new one if needed.
     *
     * @return a healthy node ID, or {@link #NO_LEADER}
     */
    public String resolveLeader() {
        return lock.call(() -> {
            Optional<String> current = settings.leader();
            if (current.isPresent() && !NO_LEADER.equals(current.get())) {
                Optional<Node> node = nodes.findById(current.get());
                if (node.isPresent() && node.get().isHealthy()) {
                    return current.get();
                }
            }

            String elected = electFrom(nodes.findByStatus(NodeStatus.HEALTHY));
            if (!elected.equals(current.orElse(null))) {
                log.info("Leader changed: {} -> {}", current.orElse(NO_LEADER), elected);
            }
            settings.setLeader(elected);
            return elected;
        });
    }

    /**
     * Pick the healthy node with the smallest ID.
     */
    static String electFrom(Collection<Node> candidates) {
        return candidates.stream()
                .filter(Node::isHealthy)
                .map(Node::id)
                .min(Comparator.naturalOrder())
                .orElse(NO_LEADER);
    }
}
