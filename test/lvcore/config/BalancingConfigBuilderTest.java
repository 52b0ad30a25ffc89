package lvcore.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BalancingConfigBuilderTest {

    @Test
    @DisplayName("Defaults match the documented weights and bounds")
    void defaults() {
        BalancingConfig c = BalancingConfig.defaults();
        assertEquals(1000.0, c.getTargetScoreBase());
        assertEquals(50.0, c.getBalanceScoreBase());
        assertEquals(10.0, c.getBalanceScoreMultiplier());
        assertEquals(25.0, c.getDiversityBonus());
        assertEquals(50.0, c.getFillScoreBase());
        assertEquals(5, c.getRebalanceMaxRounds());
        assertEquals(20.0, c.getRebalanceThreshold());
        assertFalse(c.isConsolidationEnabled());
        assertEquals(20, c.getConsolidationMaxIterations());
        assertEquals(20, c.getConsolidationMinMeterCapacity());
        assertEquals(300, c.getConsolidationMaxMeterCapacity());
    }

    @Test
    @DisplayName("from() copies every field and only the changed one differs")
    void fromCopies() {
        BalancingConfig base = BalancingConfig.defaults();
        BalancingConfig changed = BalancingConfigBuilder.from(base)
                .setConsolidationEnabled(true)
                .build();

        assertTrue(changed.isConsolidationEnabled());
        assertEquals(base.getRebalanceMaxRounds(), changed.getRebalanceMaxRounds());
        assertEquals(base.getDiversityBonus(), changed.getDiversityBonus());
        assertEquals(base.getConsolidationMaxMeterCapacity(), changed.getConsolidationMaxMeterCapacity());
    }

    @Test
    @DisplayName("Invalid bounds are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new BalancingConfigBuilder().setRebalanceMaxRounds(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> new BalancingConfigBuilder()
                        .setConsolidationMinMeterCapacity(400)
                        .setConsolidationMaxMeterCapacity(300)
                        .build());
    }
}
