package io.github.yok.elliot.core.baseline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.elliot.core.error.InsufficientRangeException;
import io.github.yok.elliot.core.error.SingularFitException;
import io.github.yok.elliot.core.linearalgebra.EjmlLeastSquaresBackend;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;
import org.junit.jupiter.api.Test;

class BaselineEstimatorTest {

    private final BaselineEstimator estimator =
            new BaselineEstimator(new EjmlLeastSquaresBackend());

    private static Spectrum spectrum(DoubleUnaryOperator f) {
        double[] e = new double[21];
        double[] a = new double[21];
        for (int i = 0; i < e.length; i++) {
            e[i] = 1.5 + 0.1 * i;
            a[i] = f.applyAsDouble(e[i]);
        }
        return new Spectrum(e, a);
    }

    @Test
    void estimate_shouldRecoverLinearBackground() {
        Spectrum raw = spectrum(e -> 0.3 * e - 0.2);

        BaselineModel baseline =
                estimator.estimate(raw, BaselineMode.LINEAR, EnergyRange.of(1.5, 2.0));

        assertEquals(BaselineMode.LINEAR, baseline.getMode());
        assertEquals(0.3, baseline.getSlope(), 1e-10);
        assertEquals(-0.2, baseline.getIntercept(), 1e-10);
        for (double v : baseline.subtractFrom(raw).getAbsorption()) {
            assertEquals(0.0, v, 1e-10);
        }
    }

    @Test
    void estimate_shouldRecoverRayleighCoefficientThroughOrigin() {
        Spectrum raw = spectrum(e -> 0.01 * e * e * e * e);

        BaselineModel baseline =
                estimator.estimate(raw, BaselineMode.RAYLEIGH, EnergyRange.of(1.5, 1.7));

        assertEquals(0.01, baseline.getCoefficient(), 1e-12);
        assertEquals(0.01 * 16.0, baseline.valueAt(2.0), 1e-12);
        assertEquals(0.0, baseline.valueAt(0.0), 0.0);
    }

    @Test
    void estimate_shouldReturnZeroFunctionWithoutRange() {
        BaselineModel baseline = estimator.estimate(spectrum(e -> e), BaselineMode.NONE, null);

        assertTrue(baseline.isZero());
        assertSame(BaselineMode.NONE, baseline.getMode());
    }

    @Test
    void estimate_shouldFailWhenLinearRangeHoldsOnePoint() {
        InsufficientRangeException e = assertThrows(InsufficientRangeException.class,
                () -> estimator.estimate(spectrum(x -> x), BaselineMode.LINEAR,
                        EnergyRange.of(1.52, 1.65)));

        assertEquals(1, e.getPointCount());
        assertEquals(2, e.getRequiredCount());
    }

    @Test
    void estimate_shouldFailWhenRayleighRangeIsEmpty() {
        assertThrows(InsufficientRangeException.class, () -> estimator
                .estimate(spectrum(x -> x), BaselineMode.RAYLEIGH, EnergyRange.of(5.0, 6.0)));
    }

    @Test
    void estimate_shouldFailOnZeroEnergySpread() {
        Spectrum single = new Spectrum(new double[] {0.0, 1.0, 2.0}, new double[] {1.0, 2.0, 3.0});

        assertThrows(SingularFitException.class, () -> estimator.estimate(single,
                BaselineMode.RAYLEIGH, EnergyRange.of(-0.5, 0.5)));
    }

    @Test
    void estimate_shouldRequireRangeForLinearMode() {
        assertThrows(IllegalArgumentException.class,
                () -> estimator.estimate(spectrum(x -> x), BaselineMode.LINEAR, null));
    }

    @Test
    void subtractFrom_shouldBeNoOpForZeroBaselineButNotForNonZero() {
        Spectrum raw = spectrum(e -> 1.0 + e);

        BaselineModel zero = BaselineModel.none();
        Spectrum once = zero.subtractFrom(raw);
        assertArrayEquals(raw.getAbsorption(), zero.subtractFrom(once).getAbsorption(), 0.0);

        BaselineModel linear = BaselineModel.linear(0.1, 0.05, EnergyRange.of(1.5, 2.0));
        Spectrum subtractedOnce = linear.subtractFrom(raw);
        Spectrum subtractedTwice = linear.subtractFrom(subtractedOnce);
        assertFalse(Arrays.equals(subtractedOnce.getAbsorption(),
                subtractedTwice.getAbsorption()));
        assertNotEquals(subtractedOnce, subtractedTwice);
        assertArrayEquals(raw.getAbsorption(), spectrum(e -> 1.0 + e).getAbsorption(), 0.0);
    }

    @Test
    void fromFitmode_shouldMapModes() {
        assertSame(BaselineMode.NONE, BaselineMode.fromFitmode(0));
        assertSame(BaselineMode.LINEAR, BaselineMode.fromFitmode(1));
        assertSame(BaselineMode.RAYLEIGH, BaselineMode.fromFitmode(2));
        assertThrows(IllegalArgumentException.class, () -> BaselineMode.fromFitmode(3));
    }
}
