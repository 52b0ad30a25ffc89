package lvcore.engine.plan;

import lvcore.config.TransformerCatalog;
import lvcore.engine.CapacityInfeasibleException;
import lvcore.model.IndividualMeter;
import lvcore.model.TransformerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static lvcore.MeterFixtures.meter;
import static org.junit.jupiter.api.Assertions.*;

class TransformerPlannerTest {

    private final TransformerPlanner planner = new TransformerPlanner(TransformerCatalog.defaultCatalog());

    @ParameterizedTest
    @CsvSource({
            "35, 500",
            "576.8, 500",
            "576.9, 1000",
            "1154.4, 1000",
            "1500, 1500",
            "5000, 1500"
    })
    @DisplayName("Smallest type that holds the remaining load, else the largest")
    void selectsSmallestFitting(double load, int expectedKva) {
        assertEquals(expectedKva, planner.selectFor(load).getCapacityKva());
    }

    @ParameterizedTest
    @CsvSource({
            "1600, 1000",
            "2500, 1500"
    })
    @DisplayName("Dedicated meters map to 1000 or 1500 kVA")
    void dedicatedMapping(int capacity, int expectedKva) {
        IndividualMeter m = meter("1_0", capacity, capacity * 0.8);
        assertEquals(expectedKva, planner.dedicatedTypeFor(m).getCapacityKva());
    }

    @Test
    @DisplayName("Missing dedicated type in a custom catalog is fatal")
    void missingDedicatedType() {
        TransformerPlanner small = new TransformerPlanner(new TransformerCatalog(List.of(
                new TransformerType(500, 721, 4, "500 KVA", 576.80, 576.80, 216))));
        IndividualMeter m = meter("7_0", 2500, 2000.0);

        CapacityInfeasibleException e = assertThrows(CapacityInfeasibleException.class,
                () -> small.dedicatedTypeFor(m));
        assertEquals(m.getId(), e.getMeterId());
    }

    @Test
    @DisplayName("A meter above the largest safe load can never be placed")
    void feasibilityCheck() {
        TransformerPlanner tiny = new TransformerPlanner(new TransformerCatalog(List.of(
                new TransformerType(100, 150, 2, "100 KVA", 100.0, 100.0, 20))));

        assertDoesNotThrow(() -> tiny.checkFeasible(List.of(meter("1_0", 100, 100.0))));
        assertThrows(CapacityInfeasibleException.class,
                () -> tiny.checkFeasible(List.of(meter("1_0", 300, 150.0))));
    }
}
