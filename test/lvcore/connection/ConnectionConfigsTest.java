package lvcore.connection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionConfigsTest {

    @ParameterizedTest
    @CsvSource({
            "35,     1, 1, 70 mm²",
            "108,    1, 1, 70 mm²",
            "108.5,  1, 1, 185 mm²",
            "184,    1, 1, 185 mm²",
            "200,    2, 2, 70 mm²",
            "216,    2, 2, 70 mm²",
            "230,    2, 2, 185 mm²"
    })
    @DisplayName("DP breakpoints")
    void dpConfig(double cdl, int fuses, int cables, String size) {
        ConnectionConfig c = ConnectionConfigs.dpConfig(cdl);
        assertEquals(FeedSource.DP, c.getSource());
        assertEquals(fuses, c.getFuses());
        assertEquals(cables, c.getCustomerCableCount());
        assertEquals(size, c.getCustomerCableSize());
        assertEquals("1x 300 mm²", c.getMainFeederInfo());
    }

    @ParameterizedTest
    @CsvSource({
            "100,  1",
            "248,  1",
            "249,  2",
            "496,  2",
            "497,  3",
            "2000, 9"
    })
    @DisplayName("SS: one 300 mm² cable per 248 A")
    void ssConfig(double cdl, int cables) {
        ConnectionConfig c = ConnectionConfigs.ssConfig(cdl);
        assertEquals(FeedSource.SS, c.getSource());
        assertEquals(cables, c.getCustomerCableCount());
        assertEquals(cables, c.getFuses());
        assertEquals("300 mm²", c.getCustomerCableSize());
        assertEquals("Direct Feeder", c.getMainFeederInfo());
    }

    @ParameterizedTest
    @CsvSource({
            "300,  1 CT box (300/400A)",
            "400,  1 CT box (300/400A)",
            "500,  1 CT box (500/600A)",
            "600,  1 CT box (500/600A)",
            "700,  1 CT box (dedicated)",
            "800,  1 CT box (Remote)",
            "2500, 1 CT box (Remote)"
    })
    @DisplayName("Heavy meter boxes by capacity")
    void heavyBoxes(int capacity, String label) {
        assertEquals(label, MeterBoxes.heavy(capacity));
    }

    @Test
    @DisplayName("Tiers: heavy from 300 A, medium from 200 A")
    void tiers() {
        assertEquals(MeterTier.HEAVY, MeterTier.of(300));
        assertEquals(MeterTier.MEDIUM, MeterTier.of(250));
        assertEquals(MeterTier.MEDIUM, MeterTier.of(200));
        assertEquals(MeterTier.LIGHT, MeterTier.of(150));
        assertEquals("2 double meter box", MeterBoxes.doubleBoxes(3));
        assertEquals("1 double meter box", MeterBoxes.doubleBoxes(1));
    }
}
