package podpilot.controlplane.placement;

import podpilot.controlplane.model.Node;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Bin-packing policies for choosing a node for a pod.
 *
 * Every strategy walks the candidates in registry order and only considers
 * nodes whose available CPU covers the request. Ties keep the first node seen.
 */
public enum PlacementStrategy {

    /** First node, in registry order, that fits the request. */
    FIRST_FIT("first_fit") {
        @Override
        public Optional<Node> select(List<Node> candidates, int cpuRequest) {
            for (Node node : candidates) {
                if (node.canFit(cpuRequest)) {
                    return Optional.of(node);
                }
            }
            return Optional.empty();
        }
    },

    /** Feasible node with the least available CPU, leaving the smallest leftover. */
    BEST_FIT("best_fit") {
        @Override
        public Optional<Node> select(List<Node> candidates, int cpuRequest) {
            Node best = null;
            for (Node node : candidates) {
                if (node.canFit(cpuRequest) && (best == null || node.availableCpu() < best.availableCpu())) {
                    best = node;
                }
            }
            return Optional.ofNullable(best);
        }
    },

    /** Feasible node leaving the largest leftover after placement. */
    WORST_FIT("worst_fit") {
        @Override
        public Optional<Node> select(List<Node> candidates, int cpuRequest) {
            Node worst = null;
            long maxLeftover = -1;
            for (Node node : candidates) {
                long leftover = (long) node.availableCpu() - cpuRequest;
                if (node.canFit(cpuRequest) && leftover > maxLeftover) {
                    maxLeftover = leftover;
                    worst = node;
                }
            }
            return Optional.ofNullable(worst);
        }
    };

    /** Strategy used when none is configured or an unknown name is given */
    public static final PlacementStrategy DEFAULT = BEST_FIT;

    private final String wireName;

    PlacementStrategy(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Select a node for the request.
     *
     * @param candidates nodes eligible for placement, in registry order
     * @param cpuRequest CPU the pod needs
     * @return the chosen node, or empty if none fits
     */
    public abstract Optional<Node> select(List<Node> candidates, int cpuRequest);

    /** Lower-case name used in the API and the settings table */
    public String wireName() {
        return wireName;
    }

    /**
     * Parse a strategy name, case-insensitively.
     *
     * @return the strategy, or empty if the name is not recognized
     */
    public static Optional<PlacementStrategy> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (PlacementStrategy strategy : values()) {
            if (strategy.wireName.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    /** Parse a strategy name, falling back to {@link #DEFAULT} */
    public static PlacementStrategy fromName(String name) {
        return parse(name).orElse(DEFAULT);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
