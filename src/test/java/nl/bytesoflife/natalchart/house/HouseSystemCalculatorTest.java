package nl.bytesoflife.natalchart.house;

import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.model.HouseCusp;
import nl.bytesoflife.natalchart.model.HouseSystem;
import nl.bytesoflife.natalchart.model.ZodiacSign;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class HouseSystemCalculatorTest {

    private static final Instant BIRTH = Instant.parse("1990-04-15T18:30:00Z");
    private static final double NYC_LAT = 40.7128;
    private static final double NYC_LON = -74.0060;

    private final HouseSystemCalculator calculator = new HouseSystemCalculator();

    @Test
    void anglesForNewYork() {
        HouseComputation houses = calculator.compute(BIRTH, NYC_LAT, NYC_LON, HouseSystem.PLACIDUS);
        assertEquals(146.17, houses.angles().ascendant().longitude(), 0.01);
        assertEquals(49.59, houses.angles().midheaven().longitude(), 0.01);
        assertEquals(ZodiacSign.LEO, houses.angles().ascendant().sign());
        assertEquals(ZodiacSign.TAURUS, houses.angles().midheaven().sign());
        assertEquals(326.17, houses.angles().descendant().longitude(), 0.01);
        assertEquals(229.59, houses.angles().imumCoeli().longitude(), 0.01);
    }

    @Test
    void placidusCuspsForNewYork() {
        HouseComputation houses = calculator.compute(BIRTH, NYC_LAT, NYC_LON, HouseSystem.PLACIDUS);
        assertFalse(houses.fallbackOccurred());
        assertNull(houses.fallbackReason());
        assertEquals(HouseSystem.PLACIDUS, houses.used());
        double[] expected = {146.17, 168.79, 196.57, 229.59, 264.87, 297.67,
                326.17, 348.79, 16.57, 49.59, 84.87, 117.67};
        for (int i = 0; i < 12; i++) {
            assertEquals(expected[i], houses.cusp(i + 1).longitude(), 0.01, "cusp " + (i + 1));
        }
    }

    static Stream<Arguments> quadrantCusps() {
        return Stream.of(
                Arguments.of(HouseSystem.KOCH, new double[]{174.00, 201.95, 88.59, 118.47}),
                Arguments.of(HouseSystem.REGIOMONTANUS, new double[]{169.42, 195.71, 88.06, 120.68}),
                Arguments.of(HouseSystem.CAMPANUS, new double[]{175.33, 202.18, 80.10, 113.54}),
                Arguments.of(HouseSystem.TOPOCENTRIC, new double[]{168.79, 196.57, 84.72, 117.56})
        );
    }

    /** Expected cusps 2, 3, 11 and 12. */
    @ParameterizedTest
    @MethodSource("quadrantCusps")
    void quadrantSystemsForNewYork(HouseSystem system, double[] expected) {
        HouseComputation houses = calculator.compute(BIRTH, NYC_LAT, NYC_LON, system);
        assertEquals(system, houses.used());
        assertEquals(expected[0], houses.cusp(2).longitude(), 0.01);
        assertEquals(expected[1], houses.cusp(3).longitude(), 0.01);
        assertEquals(expected[2], houses.cusp(11).longitude(), 0.01);
        assertEquals(expected[3], houses.cusp(12).longitude(), 0.01);
        assertEquals(houses.angles().ascendant().longitude(), houses.cusp(1).longitude(), 1e-9);
        assertEquals(houses.angles().midheaven().longitude(), houses.cusp(10).longitude(), 1e-9);
    }

    @Test
    void equalHousesStepThirtyDegreesFromAscendant() {
        HouseComputation houses = calculator.compute(BIRTH, NYC_LAT, NYC_LON, HouseSystem.EQUAL);
        double asc = houses.angles().ascendant().longitude();
        for (int i = 1; i <= 12; i++) {
            assertEquals(AngleMath.normalize(asc + 30 * (i - 1)), houses.cusp(i).longitude(), 1e-9);
        }
    }

    @Test
    void wholeSignHousesStartAtSignBoundaries() {
        HouseComputation houses = calculator.compute(BIRTH, NYC_LAT, NYC_LON, HouseSystem.WHOLE_SIGN);
        assertEquals(120.0, houses.cusp(1).longitude(), 1e-9);
        assertEquals(ZodiacSign.LEO, houses.cusp(1).sign());
        assertEquals(ZodiacSign.CANCER, houses.cusp(12).sign());
        for (HouseCusp cusp : houses.cusps()) {
            assertEquals(0, cusp.degree());
        }
    }

    @Test
    void porphyryTrisectsQuadrants() {
        HouseComputation houses = calculator.compute(BIRTH, NYC_LAT, NYC_LON, HouseSystem.PORPHYRY);
        double upper = AngleMath.forwardArc(houses.cusp(10).longitude(), houses.cusp(1).longitude()) / 3;
        assertEquals(AngleMath.normalize(houses.cusp(10).longitude() + upper), houses.cusp(11).longitude(), 1e-9);
        assertEquals(AngleMath.normalize(houses.cusp(10).longitude() + 2 * upper), houses.cusp(12).longitude(), 1e-9);
    }

    @Test
    void morinusCuspTenIsEquatorialProjectionOfRamc() {
        HouseFrame frame = HouseFrame.at(BIRTH, NYC_LAT, NYC_LON);
        HouseComputation houses = calculator.compute(frame, HouseSystem.MORINUS);
        assertEquals(HouseSystem.MORINUS, houses.used());
        double expected = AngleMath.atan2Deg(AngleMath.sinDeg(frame.ramc()) * AngleMath.cosDeg(frame.obliquity()),
                AngleMath.cosDeg(frame.ramc()));
        assertEquals(expected, houses.cusp(10).longitude(), 1e-9);
    }

    @ParameterizedTest
    @EnumSource(value = HouseSystem.class, names = {"PLACIDUS", "KOCH"})
    void semiArcSystemsFallBackToEqualInTheArctic(HouseSystem system) {
        HouseComputation houses = calculator.compute(BIRTH, 80.0, NYC_LON, system);
        assertTrue(houses.fallbackOccurred());
        assertEquals(system, houses.requested());
        assertEquals(HouseSystem.EQUAL, houses.used());
        assertTrue(houses.fallbackReason().contains("circumpolar"), houses.fallbackReason());
        assertEquals(12, houses.cusps().size());
        assertTrue(HouseSystemCalculator.isCyclicallyOrdered(longitudes(houses)));
    }

    @ParameterizedTest
    @EnumSource(HouseSystem.class)
    void everySystemYieldsOrderedCuspsAtManyPlaces(HouseSystem system) {
        double[] latitudes = {-90, -66.6, -45, -10, 0, 23.4, 51.5, 66.6, 70, 89.9, 90};
        double[] longitudes = {-179.9, -74, 0, 13.4, 151.2, 180};
        for (double lat : latitudes) {
            for (double lon : longitudes) {
                HouseComputation houses = calculator.compute(BIRTH, lat, lon, system);
                assertEquals(12, houses.cusps().size());
                assertTrue(HouseSystemCalculator.isCyclicallyOrdered(longitudes(houses)),
                        system + " at " + lat + "," + lon);
                for (int i = 0; i < 12; i++) {
                    assertEquals(i + 1, houses.cusps().get(i).number());
                }
            }
        }
    }

    @Test
    void porphyryIsDefinedInsideTheArcticCircle() {
        for (int lon = -180; lon < 180; lon++) {
            HouseComputation houses = calculator.compute(BIRTH, 70.0, lon, HouseSystem.PORPHYRY);
            assertFalse(houses.fallbackOccurred(), "fallback at longitude " + lon + ": " + houses.fallbackReason());
            assertEquals(HouseSystem.PORPHYRY, houses.used());
        }
    }

    @Test
    void arcticAscendantLiesBetweenMidheavenAndImumCoeli() {
        for (int lon = -180; lon < 180; lon++) {
            HouseFrame frame = HouseFrame.at(BIRTH, 70.0, lon);
            assertTrue(AngleMath.forwardArc(frame.midheaven(), frame.ascendant()) <= 180.0, "longitude " + lon);
        }
        // the horizon formula gives 166.90 here, the descending point
        HouseFrame frame = HouseFrame.at(BIRTH, 70.0, 151.2);
        assertEquals(272.16, frame.midheaven(), 0.05);
        assertEquals(346.90, frame.ascendant(), 0.05);
    }

    @Test
    void placidusStillFallsBackAtEightyDegrees() {
        HouseComputation houses = calculator.compute(BIRTH, 80.0, 151.2, HouseSystem.PLACIDUS);
        assertTrue(houses.fallbackOccurred());
        assertEquals(HouseSystem.EQUAL, houses.used());
        assertEquals(houses.angles().ascendant().longitude(), houses.cusp(1).longitude(), 1e-9);
    }

    @Test
    void polesAreClamped() {
        HouseFrame frame = HouseFrame.at(BIRTH, 90.0, 0.0);
        assertEquals(90.0 - HouseFrame.POLE_CLAMP, frame.latitude(), 1e-12);
        assertTrue(Double.isFinite(frame.ascendant()));
    }

    @Test
    void cyclicOrderCheckRejectsDuplicatesAndReversal() {
        double[] equal = new double[12];
        for (int i = 0; i < 12; i++) equal[i] = 30.0 * i;
        assertTrue(HouseSystemCalculator.isCyclicallyOrdered(equal));

        double[] duplicate = equal.clone();
        duplicate[3] = duplicate[2];
        assertFalse(HouseSystemCalculator.isCyclicallyOrdered(duplicate));

        double[] reversed = new double[12];
        for (int i = 0; i < 12; i++) reversed[i] = AngleMath.normalize(-30.0 * i);
        assertFalse(HouseSystemCalculator.isCyclicallyOrdered(reversed));

        double[] nan = equal.clone();
        nan[5] = Double.NaN;
        assertFalse(HouseSystemCalculator.isCyclicallyOrdered(nan));
    }

    private static double[] longitudes(HouseComputation houses) {
        List<Double> values = new ArrayList<>();
        houses.cusps().forEach(c -> values.add(c.longitude()));
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
