package nl.bytesoflife.natalchart.predictive;

import nl.bytesoflife.natalchart.ChartCalculator;
import nl.bytesoflife.natalchart.ChartConfig;
import nl.bytesoflife.natalchart.ChartResult;
import nl.bytesoflife.natalchart.ComputationTimeoutException;
import nl.bytesoflife.natalchart.StubEphemeris;
import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.AstroTime;
import nl.bytesoflife.natalchart.ephemeris.KeplerianEphemeris;
import nl.bytesoflife.natalchart.model.BirthInput;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.HouseSystem;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SolarReturnCalculatorTest {

    private final ChartCalculator calculator = new ChartCalculator(new KeplerianEphemeris());
    private final SolarReturnCalculator solarReturns = new SolarReturnCalculator(calculator);
    private final ChartResult natal = calculator.calculateChart(
            new BirthInput(Instant.parse("1990-04-15T18:30:00Z"), 40.7128, -74.006, "New York"),
            ChartConfig.builder().houseSystem(HouseSystem.KOCH).build());

    @Test
    void sunReturnsToNatalLongitude() {
        SolarReturn solarReturn = solarReturns.findReturn(natal, 2000);

        assertEquals(2000, solarReturn.year());
        assertTrue(Math.abs(solarReturn.residual()) < SolarReturnCalculator.TOLERANCE_DEGREES);
        Duration fromBirthday = Duration.between(Instant.parse("2000-04-15T18:30:00Z"), solarReturn.instant()).abs();
        assertTrue(fromBirthday.compareTo(Duration.ofDays(2)) < 0, fromBirthday.toString());

        double natalSun = natal.getBody(Body.SUN).getLongitude();
        double returnSun = solarReturn.chart().getBody(Body.SUN).getLongitude();
        assertEquals(0.0, AngleMath.signedDifference(natalSun, returnSun), 1e-5);
    }

    @Test
    void returnChartKeepsNatalConfigAndPlace() {
        SolarReturn solarReturn = solarReturns.findReturn(natal, 2010);
        ChartResult chart = solarReturn.chart();
        assertEquals(HouseSystem.KOCH, chart.getHouseSystemRequested());
        assertEquals(40.7128, chart.getBirthInput().latitude(), 0.0);
        assertEquals("New York, solar return 2010", chart.getBirthInput().label());
    }

    @Test
    void relocatedReturn() {
        SolarReturn home = solarReturns.findReturn(natal, 2020);
        SolarReturn away = solarReturns.findReturn(natal, 2020, 51.5074, -0.1278);

        assertEquals(home.instant(), away.instant());
        assertEquals(51.5074, away.chart().getBirthInput().latitude(), 0.0);
        assertNotEquals(home.chart().getCusp(1).longitude(), away.chart().getCusp(1).longitude());
    }

    @Test
    void anniversaryKeepsTimeOfDay() {
        assertEquals(Instant.parse("2001-04-15T18:30:00Z"),
                SolarReturnCalculator.anniversary(Instant.parse("1990-04-15T18:30:00Z"), 2001));
        assertEquals(Instant.parse("2001-02-28T06:00:00Z"),
                SolarReturnCalculator.anniversary(Instant.parse("1996-02-29T06:00:00Z"), 2001));
        assertEquals(Instant.parse("2004-02-29T06:00:00Z"),
                SolarReturnCalculator.anniversary(Instant.parse("1996-02-29T06:00:00Z"), 2004));
    }

    @Test
    void stationarySunDoesNotConverge() {
        StubEphemeris frozen = new StubEphemeris().set(Body.SUN, 100.0, 0.0);
        double start = AstroTime.julianDay(Instant.parse("2000-01-01T00:00:00Z"));
        assertThrows(ComputationTimeoutException.class, () -> SolarReturnCalculator.solve(frozen, 50.0, start));
    }
}
