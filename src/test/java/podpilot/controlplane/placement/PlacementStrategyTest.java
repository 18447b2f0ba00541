package podpilot.controlplane.placement;

import org.junit.jupiter.api.Test;
import podpilot.controlplane.model.Node;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlacementStrategyTest {

    private static Node node(String id, int total, int available) {
        return Node.builder().id(id).totalCpu(total).availableCpu(available).build();
    }

    private final Node a = node("A", 10, 10);
    private final Node b = node("B", 4, 4);

    @Test
    void bestFitPicksSmallestLeftover() {
        assertEquals("B", PlacementStrategy.BEST_FIT.select(List.of(a, b), 3).orElseThrow().id());
    }

    @Test
    void worstFitPicksLargestLeftover() {
        assertEquals("A", PlacementStrategy.WORST_FIT.select(List.of(a, b), 3).orElseThrow().id());
    }

    @Test
    void firstFitFollowsRegistryOrder() {
        assertEquals("B", PlacementStrategy.FIRST_FIT.select(List.of(b, a), 3).orElseThrow().id());
        assertEquals("A", PlacementStrategy.FIRST_FIT.select(List.of(a, b), 3).orElseThrow().id());
    }

    @Test
    void firstFitSkipsNodesThatDoNotFit() {
        assertEquals("A", PlacementStrategy.FIRST_FIT.select(List.of(b, a), 6).orElseThrow().id());
    }

    @Test
    void tiesKeepFirstCandidate() {
        Node x = node("X", 5, 5);
        Node y = node("Y", 5, 5);

        assertEquals("X", PlacementStrategy.BEST_FIT.select(List.of(x, y), 2).orElseThrow().id());
        assertEquals("X", PlacementStrategy.WORST_FIT.select(List.of(x, y), 2).orElseThrow().id());
    }

    @Test
    void exactFitIsFeasible() {
        Node exact = node("E", 8, 3);

        for (PlacementStrategy strategy : PlacementStrategy.values()) {
            assertEquals("E", strategy.select(List.of(exact), 3).orElseThrow().id(), strategy.wireName());
        }
    }

    @Test
    void nothingFitsYieldsEmpty() {
        for (PlacementStrategy strategy : PlacementStrategy.values()) {
            assertTrue(strategy.select(List.of(a, b), 11).isEmpty(), strategy.wireName());
            assertTrue(strategy.select(List.of(), 1).isEmpty(), strategy.wireName());
        }
    }

    @Test
    void parsesWireNamesCaseInsensitively() {
        assertEquals(PlacementStrategy.WORST_FIT, PlacementStrategy.parse(" Worst_Fit ").orElseThrow());
        assertEquals(PlacementStrategy.FIRST_FIT, PlacementStrategy.parse("first_fit").orElseThrow());
        assertTrue(PlacementStrategy.parse("round_robin").isEmpty());
        assertTrue(PlacementStrategy.parse(null).isEmpty());
    }

    @Test
    void unknownNamesFallBackToBestFit() {
        assertEquals(PlacementStrategy.BEST_FIT, PlacementStrategy.fromName("random"));
        assertEquals(PlacementStrategy.BEST_FIT, PlacementStrategy.fromName(""));
        assertEquals(PlacementStrategy.BEST_FIT, PlacementStrategy.DEFAULT);
    }

    @Test
    void toStringIsWireName() {
        assertEquals("best_fit", PlacementStrategy.BEST_FIT.toString());
    }
}
