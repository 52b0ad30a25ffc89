package lvcore.engine.placement;

import lvcore.config.BalancingConfig;
import lvcore.config.BalancingConfigBuilder;
import lvcore.config.LoadCategory;
import lvcore.config.TransformerCatalog;
import lvcore.model.Breaker;
import lvcore.model.IndividualMeter;
import lvcore.model.Transformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static lvcore.MeterFixtures.meter;
import static org.junit.jupiter.api.Assertions.*;

class BreakerScorerTest {

    private Transformer transformer;
    private Breaker b1;
    private Breaker b2;

    @BeforeEach
    void setUp() {
        transformer = new Transformer(1, TransformerCatalog.defaultCatalog().findByCapacity(500));
        b1 = transformer.getBreakers().get(0);
        b2 = transformer.getBreakers().get(1);
        transformer.assign(b2, meter("9_0", 150, 100.0, LoadCategory.RESIDENTIAL));
    }

    @Test
    @DisplayName("Score = target + balance + diversity + fill")
    void scoreComponents() {
        BreakerScorer scorer = new BreakerScorer(BalancingConfig.defaults());
        IndividualMeter m = meter("1_0", 70, 50.0, LoadCategory.RESIDENTIAL);
        List<Breaker> targets = List.of(b1, b2);

        // b1: |50-100|=50 -> 950; σ{50,100}=25 -> 250; новая категория +25; fill 50
        assertEquals(1275.0, scorer.score(b1, m, targets, 100.0), 1e-9);
        // b2: |150-100|=50 -> 950; σ{0,150}=75 -> -250; категория уже есть; fill -50
        assertEquals(650.0, scorer.score(b2, m, targets, 100.0), 1e-9);

        assertSame(b1, scorer.selectBest(m, targets, 100.0));
    }

    @Test
    @DisplayName("Weights come from the configuration")
    void weightsAreConfigurable() {
        BalancingConfig noDiversity = new BalancingConfigBuilder().setDiversityBonus(0.0).build();
        BreakerScorer scorer = new BreakerScorer(noDiversity);
        IndividualMeter m = meter("1_0", 70, 50.0, LoadCategory.RESIDENTIAL);

        assertEquals(1250.0, scorer.score(b1, m, List.of(b1, b2), 100.0), 1e-9);
    }

    @Test
    @DisplayName("Breakers that would exceed 248 A are not eligible")
    void ceiling() {
        BreakerScorer scorer = new BreakerScorer(BalancingConfig.defaults());
        transformer.assign(b1, meter("8_0", 300, 200.0));

        assertTrue(BreakerScorer.fits(b1, 48.0));
        assertFalse(BreakerScorer.fits(b1, 48.1));
        assertNull(scorer.selectBest(meter("1_0", 250, 160.0), List.of(b1, b2), 100.0));
    }
}
