package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.placement.PlacementStrategy;

public record StrategyResponse(@JsonProperty("strategy") String strategy) {
    public static StrategyResponse from(PlacementStrategy strategy) {
        return new StrategyResponse(strategy.wireName());
    }
}
