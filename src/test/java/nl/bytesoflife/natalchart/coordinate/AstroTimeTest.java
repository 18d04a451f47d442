package nl.bytesoflife.natalchart.coordinate;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AstroTimeTest {

    @Test
    void julianDayOfJ2000() {
        assertEquals(AstroTime.J2000, AstroTime.julianDay(Instant.parse("2000-01-01T12:00:00Z")), 1e-9);
        assertEquals(2440587.5, AstroTime.julianDay(Instant.EPOCH), 1e-9);
    }

    @Test
    void fromJulianDayRoundTripsToTheMillisecond() {
        Instant instant = Instant.parse("1990-04-15T18:30:00Z");
        Instant back = AstroTime.fromJulianDay(AstroTime.julianDay(instant));
        assertTrue(Math.abs(back.toEpochMilli() - instant.toEpochMilli()) <= 1);
    }

    @Test
    void greenwichSiderealTimeMeeusExample() {
        // Meeus, example 12.a: 1987 April 10, 0h UT
        double jd = AstroTime.julianDay(Instant.parse("1987-04-10T00:00:00Z"));
        double expected = 13 * 15 + 10 * 0.25 + 46.3668 * 15 / 3600.0;
        assertEquals(expected, AstroTime.greenwichSiderealTime(jd), 1e-4);
    }

    @Test
    void obliquityAtJ2000() {
        assertEquals(23.4392911, AstroTime.meanObliquity(AstroTime.J2000), 1e-6);
    }

    @Test
    void localSiderealTimeAddsEastLongitude() {
        double jd = AstroTime.J2000;
        assertEquals(AngleMath.normalize(AstroTime.greenwichSiderealTime(jd) - 74.006),
                AstroTime.localSiderealTime(jd, -74.006), 1e-9);
    }
}
