package io.github.yok.elliot.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.elliot.core.SyntheticSpectra;
import io.github.yok.elliot.core.error.InsufficientRangeException;
import io.github.yok.elliot.core.model.ElliotSpectralModel;
import io.github.yok.elliot.core.model.FitParameter;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.range.ParameterBounds;
import io.github.yok.elliot.core.range.RangeSelector;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StagedFitProcedureTest {

    private static final FittingParameters START =
            new FittingParameters(2.60, 0.052, 0.105, 9.5, 0.058, 0.21);

    private final StagedFitProcedure procedure = new StagedFitProcedure(
            new BoundedLeastSquaresOptimizer(new ElliotSpectralModel(), 2000, 20000, 1e-14, 1e-12),
            new RangeSelector());

    @Test
    void run_shouldFlagEgWhenTrueGapLiesOutsideBounds() {
        ParameterBounds bounds = ParameterBounds.defaults().with(FitParameter.EG, 2.0, 2.5);
        Spectrum data = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);

        StagedFitOutcome outcome = procedure.run(data, START, bounds, null, true, true);

        assertEquals(2.5, outcome.getParameters().getEg(), 2.5e-3);
        assertTrue(outcome.getBoundaryWarnings().contains("Eg"));
        assertFalse(outcome.getWarnings().isEmpty());
    }

    @Test
    void run_shouldExecutePreliminaryAndBothStagesInOrder() {
        ParameterBounds bounds = ParameterBounds.defaults().with(FitParameter.EG, 2.22, 3.02);
        Spectrum data = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);

        StagedFitOutcome outcome = procedure.run(data, START, bounds, null, true, true);

        List<String> names = new ArrayList<>();
        outcome.getStages().forEach(s -> names.add(s.getName()));
        assertEquals(List.of("予備", "段1", "段2"), names);
        assertTrue(outcome.getBoundaryWarnings().isEmpty());
        assertEquals(2.62, outcome.getParameters().getEg(), 2.62e-3);
        // 段 2 は Eg ± 0.5 eV に絞り込みます。
        assertTrue(outcome.getFittedSpectrum().minEnergy() >= 2.62 - 0.5 - 0.01);
        assertTrue(outcome.getFittedSpectrum().size() < data.size());
    }

    @Test
    void run_shouldFallBackToFullRangeWhenUserRangeIsTooNarrow() {
        ParameterBounds bounds = ParameterBounds.defaults().with(FitParameter.EG, 2.22, 3.02);
        Spectrum data = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);

        StagedFitOutcome outcome =
                procedure.run(data, START, bounds, EnergyRange.of(2.50, 2.52), false, false);

        assertEquals(1, outcome.getStages().size());
        assertEquals(data.size(), outcome.getStages().get(0).getPointCount());
        assertEquals(data, outcome.getFittedSpectrum());
        assertFalse(outcome.getWarnings().isEmpty());
    }

    @Test
    void run_shouldRestrictStageOneToUserRange() {
        ParameterBounds bounds = ParameterBounds.defaults().with(FitParameter.EG, 2.22, 3.02);
        Spectrum data = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);
        EnergyRange userRange = EnergyRange.of(2.2, 3.0);

        StagedFitOutcome outcome = procedure.run(data, START, bounds, userRange, false, false);

        assertEquals(data.countWithin(userRange), outcome.getStages().get(0).getPointCount());
        assertTrue(outcome.getFittedSpectrum().minEnergy() >= 2.2);
        assertTrue(outcome.getFittedSpectrum().maxEnergy() <= 3.0);
    }

    @Test
    void run_shouldNarrowStageTwoAroundStageOneGapWithinUserRange() {
        RangeSelector narrow = new RangeSelector(RangeSelector.DEFAULT_THRESHOLD_FRACTION,
                RangeSelector.DEFAULT_MINIMUM_THRESHOLD, RangeSelector.DEFAULT_EG_BOUND_HALF_WIDTH,
                0.3);
        StagedFitProcedure narrowProcedure = new StagedFitProcedure(
                new BoundedLeastSquaresOptimizer(new ElliotSpectralModel(), 2000, 20000, 1e-14,
                        1e-12),
                narrow);
        ParameterBounds bounds = ParameterBounds.defaults().with(FitParameter.EG, 2.22, 3.02);
        Spectrum data = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);
        EnergyRange userRange = EnergyRange.of(2.45, 3.1);

        StagedFitOutcome outcome =
                narrowProcedure.run(data, START, bounds, userRange, false, true);

        assertEquals(2, outcome.getStages().size());
        double stageOneEg = outcome.getStages().get(0).getResult().getParameters().getEg();
        Spectrum expected = narrow.narrowRange(data, stageOneEg).restrict(userRange);
        assertEquals(expected, outcome.getFittedSpectrum());
        assertEquals(expected.size(), outcome.getStages().get(1).getPointCount());
        assertEquals(2.45, outcome.getStages().get(1).getRange().getLower(), 0.0);
        assertEquals(stageOneEg + 0.3, outcome.getStages().get(1).getRange().getUpper(), 1e-12);
    }

    @Test
    void run_shouldFailWhenSpectrumIsTooSmall() {
        Spectrum tiny = new Spectrum(new double[] {2.0, 2.1, 2.2, 2.3, 2.4, 2.5, 2.6},
                new double[7]);

        assertThrows(InsufficientRangeException.class, () -> procedure.run(tiny, START,
                ParameterBounds.defaults().with(FitParameter.EG, 2.0, 2.8), null, true, true));
    }

    @Test
    void saturatedParameters_shouldCheckBothBoundsWithRelativeTolerance() {
        ParameterBounds bounds = ParameterBounds.defaults();
        FittingParameters atBounds = new FittingParameters(5.0, 0.01, 0.25, 10000.0 * (1 - 5e-4),
                0.5, 0.2);

        assertEquals(Set.of("Eb", "ucvsq"),
                procedure.saturatedParameters(atBounds, bounds));
    }
}
