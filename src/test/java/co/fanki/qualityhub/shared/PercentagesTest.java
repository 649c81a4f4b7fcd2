package co.fanki.qualityhub.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link Percentages}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PercentagesTest {

    @Test
    void whenComputing_givenZeroWhole_shouldReturnZero() {
        assertEquals(0, Percentages.of(0, 0));
        assertEquals(0, Percentages.of(5, 0));
    }

    @Test
    void whenComputing_givenThirds_shouldRoundToNearest() {
        assertEquals(33, Percentages.of(1, 3));
        assertEquals(67, Percentages.of(2, 3));
    }

    @Test
    void whenComputing_givenExactHalf_shouldRoundUp() {
        assertEquals(13, Percentages.of(1, 8));
    }

    @Test
    void whenComputing_givenWholeCovered_shouldReturnHundred() {
        assertEquals(100, Percentages.of(7, 7));
    }

    @Test
    void whenComputingPrecise_givenThirds_shouldKeepTwoDecimals() {
        assertEquals(33.33, Percentages.precise(1, 3));
    }

}
