package imagematch.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import imagematch.exceptions.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

public class SimilarityTest {

    /**
     * Distance zero is 100 percent and full distance is 0 percent
     */
    @Test
    public void percent_bounds() {
        assertEquals(100.0, Similarity.percent(0, 64));
        assertEquals(0.0, Similarity.percent(64, 64));
        assertEquals(100.0, Similarity.percent(0, 256));
        assertEquals(0.0, Similarity.percent(256, 256));
    }

    /**
     * Out of range distances are clamped
     */
    @Test
    public void percent_clamped() {
        assertEquals(100.0, Similarity.percent(-3, 64));
        assertEquals(0.0, Similarity.percent(70, 64));
    }

    /**
     * Exact fractional percentages
     */
    @Test
    public void percent_fractional() {
        assertEquals(90.625, Similarity.percent(6, 64));
        assertEquals(96.875, Similarity.percent(2, 64));
    }

    /**
     * Threshold to distance conversion floors the result
     */
    @Test
    public void maxDistance_floor() {
        assertEquals(6, Similarity.maxDistance(90.0, 64));
        assertEquals(0, Similarity.maxDistance(100.0, 64));
        assertEquals(64, Similarity.maxDistance(0.0, 64));
        assertEquals(2, Similarity.maxDistance(96.0, 64));
        assertEquals(25, Similarity.maxDistance(90.0, 256));
    }

    /**
     * Thresholds outside [0,100] are configuration errors
     */
    @Test
    public void validateThreshold_outOfRange() {
        assertThrows(InvalidConfigurationException.class, () -> Similarity.validateThreshold(-0.1));
        assertThrows(InvalidConfigurationException.class, () -> Similarity.validateThreshold(100.5));
        assertThrows(InvalidConfigurationException.class, () -> Similarity.validateThreshold(Double.NaN));
        assertThrows(InvalidConfigurationException.class, () -> Similarity.maxDistance(101, 64));
        Similarity.validateThreshold(0);
        Similarity.validateThreshold(100);
    }
}
