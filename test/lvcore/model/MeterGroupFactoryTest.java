package lvcore.model;

import lvcore.config.LoadCategory;
import lvcore.config.TimePattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MeterGroupFactoryTest {

    private final MeterGroupFactory factory = new MeterGroupFactory();

    @Test
    @DisplayName("Total CDL = N x capacity x demand x coincidence, per-meter CDL includes coincidence")
    void derivesCdl() {
        MeterGroup g = factory.create(1, "C1", 4, 50);

        assertEquals(0.5, g.getDemandFactor(), 1e-12);
        assertEquals(0.668, g.getCoincidenceFactor(), 1e-12);
        assertEquals(66.8, g.getTotalCdl(), 1e-9);
        assertEquals(16.7, g.getCdlPerMeter(), 1e-9);
        assertEquals(g.getTotalCdl(), g.getCdlPerMeter() * g.getCount(), 1e-9);
    }

    @Test
    @DisplayName("Category and time pattern come from the type table")
    void categoryLookup() {
        MeterGroup shops = factory.create(2, "C2", 25, 70);

        assertEquals("C2", shops.getTypeCode());
        assertEquals(LoadCategory.COMMERCIAL, shops.getCategory());
        assertEquals(TimePattern.DAYTIME, shops.getTimePattern());
        assertEquals(1.0, shops.getCoincidenceFactor(), 1e-12);
        assertEquals(25 * 70 * 0.6, shops.getTotalCdl(), 1e-9);
    }

    @Test
    @DisplayName("Non-positive count or capacity and unknown types are rejected")
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(1, "C1", 0, 30));
        assertThrows(IllegalArgumentException.class, () -> factory.create(1, "C1", 3, 0));
        assertThrows(IllegalArgumentException.class, () -> factory.create(1, "C42", 3, 30));
    }
}
