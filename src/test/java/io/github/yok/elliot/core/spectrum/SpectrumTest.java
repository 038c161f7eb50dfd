package io.github.yok.elliot.core.spectrum;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SpectrumTest {

    @Test
    void sortedOf_shouldSortDescendingWavelengthAxis() {
        double[] energies = {
                EnergyUnits.wavelengthToEnergy(400.0),
                EnergyUnits.wavelengthToEnergy(500.0),
                EnergyUnits.wavelengthToEnergy(600.0)};
        Spectrum s = Spectrum.sortedOf(energies, new double[] {3.0, 2.0, 1.0});

        assertEquals(EnergyUnits.wavelengthToEnergy(600.0), s.energyAt(0), 1e-12);
        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, s.getAbsorption(), 0.0);
    }

    @Test
    void constructor_shouldRejectNonMonotonicAxis() {
        assertThrows(IllegalArgumentException.class,
                () -> new Spectrum(new double[] {1.0, 1.0}, new double[] {0.0, 0.0}));
        assertThrows(IllegalArgumentException.class,
                () -> new Spectrum(new double[] {1.0, 2.0}, new double[] {0.0}));
        assertThrows(IllegalArgumentException.class,
                () -> new Spectrum(new double[] {1.0, 2.0}, new double[] {0.0, Double.NaN}));
    }

    @Test
    void restrict_shouldKeepInclusiveRange() {
        Spectrum s = new Spectrum(new double[] {1.0, 2.0, 3.0, 4.0},
                new double[] {10.0, 20.0, 30.0, 40.0});

        Spectrum r = s.restrict(EnergyRange.of(3.0, 2.0));

        assertArrayEquals(new double[] {2.0, 3.0}, r.getEnergies(), 0.0);
        assertEquals(2, s.countWithin(EnergyRange.of(2.0, 3.0)));
    }

    @Test
    void energyPercentile_shouldInterpolateLinearly() {
        Spectrum s = new Spectrum(new double[] {1.0, 2.0, 3.0, 4.0, 5.0}, new double[5]);

        assertEquals(1.4, s.energyPercentile(10.0), 1e-12);
        assertEquals(3.0, s.medianEnergy(), 1e-12);
        assertEquals(5.0, s.energyPercentile(100.0), 1e-12);
    }

    @Test
    void intersect_shouldReturnNullWhenDisjoint() {
        assertNull(EnergyRange.of(1.0, 2.0).intersect(EnergyRange.of(2.5, 3.0)));
        assertEquals(EnergyRange.of(1.5, 2.0),
                EnergyRange.of(1.0, 2.0).intersect(EnergyRange.of(1.5, 3.0)));
    }

    @Test
    void wavelengthToEnergy_shouldUsePlanckConstant() {
        assertEquals(1239.84193 / 500.0, EnergyUnits.wavelengthToEnergy(500.0), 1e-12);
        assertEquals(500.0, EnergyUnits.energyToWavelength(EnergyUnits.wavelengthToEnergy(500.0)),
                1e-9);
    }
}
