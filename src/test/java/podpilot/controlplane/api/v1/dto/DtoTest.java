package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import podpilot.controlplane.exception.MissingFieldException;
import podpilot.controlplane.model.LaunchResult;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.Pod;
import podpilot.controlplane.placement.PlacementStrategy;
import podpilot.controlplane.server.RouterHandler;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON shape of the public API DTOs.
 */
class DtoTest {

    @Test
    void nodeResponseWritesIsoTimestamps() throws Exception {
        Node node = Node.builder().id("A").totalCpu(8).availableCpu(5)
                .lastHeartbeat(Instant.parse("2024-01-15T10:00:00Z")).build();

        JsonNode json = RouterHandler.mapper().readTree(
                RouterHandler.mapper().writeValueAsString(NodeResponse.from(node)));

        assertEquals("A", json.get("nodeId").asText());
        assertEquals("healthy", json.get("status").asText());
        assertEquals(5, json.get("availableCpu").asInt());
        assertEquals("2024-01-15T10:00:00Z", json.get("lastHeartbeat").asText());
    }

    @Test
    void pendingPodOmitsNode() throws Exception {
        Pod pod = Pod.builder().id("p1").cpuRequest(2).build();

        JsonNode json = RouterHandler.mapper().readTree(
                RouterHandler.mapper().writeValueAsString(PodResponse.from(pod)));

        assertEquals("pending", json.get("status").asText());
        assertFalse(json.has("nodeId"));
    }

    @Test
    void launchResponseUsesWireStrategyName() {
        LaunchPodResponse response = LaunchPodResponse.from(
                new LaunchResult("p1", "A", PlacementStrategy.WORST_FIT));

        assertEquals("worst_fit", response.strategy());
        assertEquals("running", response.status());
    }

    @Test
    void launchRequestReadsSnakeCaseFields() throws Exception {
        LaunchPodRequest request = RouterHandler.mapper().readValue(
                "{\"pod_id\":\"p1\",\"cpu\":3,\"strategy\":\"FIRST_FIT\",\"extra\":1}", LaunchPodRequest.class);

        request.validate();
        assertEquals("p1", request.podId());
        assertEquals(3, request.cpu());
        assertEquals(PlacementStrategy.FIRST_FIT, request.strategyOverride());
    }

    @Test
    void launchRequestWithoutStrategyHasNoOverride() {
        assertNull(new LaunchPodRequest("p1", 1, null).strategyOverride());
        assertNull(new LaunchPodRequest("p1", 1, " ").strategyOverride());
        assertEquals(PlacementStrategy.BEST_FIT, new LaunchPodRequest("p1", 1, "nope").strategyOverride());
    }

    @Test
    void requestsReportTheMissingField() {
        assertEquals("cpu", assertThrows(MissingFieldException.class,
                () -> new LaunchPodRequest("p1", null, null).validate()).field());
        assertEquals("node_id", assertThrows(MissingFieldException.class,
                () -> new AddNodeRequest(null, 4).validate()).field());
        assertEquals("count", assertThrows(MissingFieldException.class,
                () -> new ScaleUpRequest(0).validate()).field());
        assertEquals("strategy", assertThrows(MissingFieldException.class,
                () -> new StrategyRequest(null).validate()).field());
    }
}
