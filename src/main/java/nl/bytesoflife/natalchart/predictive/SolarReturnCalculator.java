package nl.bytesoflife.natalchart.predictive;

import nl.bytesoflife.natalchart.CalculationStage;
import nl.bytesoflife.natalchart.ChartCalculator;
import nl.bytesoflife.natalchart.ChartResult;
import nl.bytesoflife.natalchart.ComputationTimeoutException;
import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.AstroTime;
import nl.bytesoflife.natalchart.ephemeris.EphemerisProvider;
import nl.bytesoflife.natalchart.model.BirthInput;
import nl.bytesoflife.natalchart.model.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Finds solar returns by secant iteration on the Sun's longitude, starting from the birthday
 * in the requested year.
 */
public class SolarReturnCalculator {

    private static final Logger log = LoggerFactory.getLogger(SolarReturnCalculator.class);

    static final double TOLERANCE_DEGREES = 1e-6;
    static final int MAX_ITERATIONS = 50;

    private final ChartCalculator calculator;

    public SolarReturnCalculator(ChartCalculator calculator) {
        this.calculator = calculator;
    }

    /** Solar return for {@code year} at the birth location. */
    public SolarReturn findReturn(ChartResult natal, int year) {
        BirthInput birth = natal.getBirthInput();
        return findReturn(natal, year, birth.latitude(), birth.longitude());
    }

    /** Solar return for {@code year}, relocated to the given place. */
    public SolarReturn findReturn(ChartResult natal, int year, double latitude, double longitude) {
        double target = natal.getBody(Body.SUN).getLongitude();
        Instant guess = anniversary(natal.getBirthInput().instant(), year);

        double[] solution = solve(calculator.getEphemeris(), target, AstroTime.julianDay(guess));
        Instant instant = AstroTime.fromJulianDay(solution[0]);
        log.debug("Solar return {} found at {} after {} iterations", year, instant, (int) solution[2]);

        BirthInput birth = natal.getBirthInput();
        String label = birth.hasLabel()
                ? String.format(Locale.US, "%s, solar return %d", birth.label(), year)
                : String.format(Locale.US, "Solar return %d", year);
        ChartResult chart = calculator.calculateChart(
                new BirthInput(instant, latitude, longitude, label), natal.getConfig());
        return new SolarReturn(year, instant, solution[1], chart);
    }

    /** Returns {jd, residual, iterations}. */
    static double[] solve(EphemerisProvider ephemeris, double target, double startJd) {
        double t0 = startJd;
        double t1 = startJd + 1.0;
        double f0 = offset(ephemeris, target, t0);
        double f1 = offset(ephemeris, target, t1);
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            if (Math.abs(f1) < TOLERANCE_DEGREES) {
                return new double[]{t1, f1, i};
            }
            if (f1 == f0) {
                break;
            }
            double t2 = t1 - f1 * (t1 - t0) / (f1 - f0);
            t0 = t1;
            f0 = f1;
            t1 = t2;
            f1 = offset(ephemeris, target, t1);
        }
        throw new ComputationTimeoutException(String.format(Locale.US,
                "Solar return search did not converge to %.0e degrees within %d iterations",
                TOLERANCE_DEGREES, MAX_ITERATIONS), CalculationStage.EPHEMERIS_RESOLVED);
    }

    private static double offset(EphemerisProvider ephemeris, double target, double jd) {
        double sun = ephemeris.positionAt(AstroTime.fromJulianDay(jd), Body.SUN).longitude();
        return AngleMath.signedDifference(target, sun);
    }

    /** Same UTC month, day and time in {@code year}; 29 February becomes 28 February. */
    static Instant anniversary(Instant birth, int year) {
        return ZonedDateTime.ofInstant(birth, ZoneOffset.UTC).withYear(year).toInstant();
    }
}
