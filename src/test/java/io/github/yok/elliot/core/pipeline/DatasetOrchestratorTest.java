package io.github.yok.elliot.core.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.elliot.core.SyntheticSpectra;
import io.github.yok.elliot.core.baseline.BaselineEstimator;
import io.github.yok.elliot.core.baseline.BaselineMode;
import io.github.yok.elliot.core.linearalgebra.EjmlLeastSquaresBackend;
import io.github.yok.elliot.core.metrics.DerivedMetricsCalculator;
import io.github.yok.elliot.core.model.ElliotSpectralModel;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.range.RangeSelector;
import io.github.yok.elliot.core.solver.BoundedLeastSquaresOptimizer;
import io.github.yok.elliot.core.solver.StagedFitProcedure;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.List;
import org.junit.jupiter.api.Test;

class DatasetOrchestratorTest {

    private final DatasetOrchestrator orchestrator = new DatasetOrchestrator(pipeline());

    private static DatasetFitPipeline pipeline() {
        ElliotSpectralModel model = new ElliotSpectralModel();
        EjmlLeastSquaresBackend backend = new EjmlLeastSquaresBackend();
        RangeSelector selector = new RangeSelector();
        StagedFitProcedure staged = new StagedFitProcedure(
                new BoundedLeastSquaresOptimizer(model, 2000, 20000, 1e-14, 1e-12), selector);
        return new DatasetFitPipeline(new BaselineEstimator(backend), selector, staged, model,
                new DerivedMetricsCalculator(backend));
    }

    private static FitSettings linearBaselineSettings(int parallelism) {
        return FitSettings.builder().baselineMode(BaselineMode.LINEAR)
                .baselineRange(EnergyRange.of(2.0, 2.2)).initialEg(2.6)
                .parallelism(parallelism).build();
    }

    /**
     * 合成スペクトルに 1 次式の背景を足したデータです。
     */
    private static Spectrum withLinearBackground() {
        Spectrum clean = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);
        double[] e = clean.getEnergies();
        double[] a = clean.getAbsorption();
        for (int i = 0; i < e.length; i++) {
            a[i] += 0.05 * e[i] + 0.1;
        }
        return new Spectrum(e, a);
    }

    @Test
    void analyze_shouldContinueAfterFailedDataset() {
        Spectrum good = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);
        // ベースライン範囲 [2.0, 2.2] に 1 点しかありません。
        Spectrum sparse = new Spectrum(new double[] {2.1, 2.5, 2.6, 2.7, 2.8, 2.9},
                new double[] {0.0, 1.0, 2.0, 3.0, 4.0, 5.0});
        List<DatasetRequest> requests = List.of(new DatasetRequest("sparse", sparse),
                new DatasetRequest("good", good));

        AnalysisReport report = orchestrator.analyze(requests, linearBaselineSettings(1));

        assertEquals(2, report.getOutcomes().size());
        DatasetOutcome failed = report.getOutcomes().get(0);
        assertFalse(failed.isSuccess());
        assertEquals("sparse", failed.getDatasetName());
        assertEquals("InsufficientRangeException", failed.getErrorType());
        assertNull(failed.getResult());

        DatasetOutcome ok = report.getOutcomes().get(1);
        assertTrue(ok.isSuccess());
        assertEquals(1, report.successCount());
        assertEquals(1, report.failureCount());
    }

    @Test
    void analyze_shouldRecoverParametersAndSampleCurvesOnOriginalGrid() {
        Spectrum data = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);
        FitSettings settings = FitSettings.builder().initialEg(2.6).build();

        AnalysisReport report =
                orchestrator.analyze(List.of(new DatasetRequest("synthetic", data)), settings);

        FitResult r = report.getOutcomes().get(0).getResult();
        assertNotNull(r);
        assertTrue(r.getRSquared() >= 0.999, "R²=" + r.getRSquared());
        FittingParameters truth = SyntheticSpectra.TRUE_PARAMETERS;
        FittingParameters p = r.getParameters();
        assertEquals(truth.getEg(), p.getEg(), 1e-3 * truth.getEg());
        assertEquals(truth.getEb(), p.getEb(), 1e-3 * truth.getEb());
        assertEquals(truth.getGamma(), p.getGamma(), 1e-3 * truth.getGamma());
        assertEquals(truth.getUcvsq(), p.getUcvsq(), 1e-3 * truth.getUcvsq());
        assertEquals(truth.getMhcnp(), p.getMhcnp(), 1e-3 * truth.getMhcnp());
        assertEquals(truth.getQ(), p.getQ(), 1e-3 * truth.getQ());
        assertEquals(data.size(), r.getTotal().length);
        assertEquals(data.size(), r.getExciton().length);
        assertEquals(data.size(), r.getBand().length);
        assertEquals(data.size(), r.getBaseline().length);
        assertTrue(r.getBoundaryWarnings().isEmpty());
        assertNull(r.getQWarning());
        assertEquals(3.0 - 2.0 * r.getParameters().getQ(), r.getDeff(), 1e-12);
        for (int i = 0; i < data.size(); i++) {
            assertEquals(data.absorptionAt(i), r.getTotal()[i], 1e-3 * data.maxAbsorption());
            assertEquals(0.0, r.getBaseline()[i], 0.0);
        }
    }

    @Test
    void analyze_shouldKeepInputOrderWhenRunningInParallel() {
        Spectrum good = SyntheticSpectra.elliot(SyntheticSpectra.TRUE_PARAMETERS);
        Spectrum sparse = new Spectrum(new double[] {2.1, 2.5, 2.6}, new double[] {0.0, 1.0, 2.0});
        List<DatasetRequest> requests = List.of(new DatasetRequest("a", good),
                new DatasetRequest("b", sparse), new DatasetRequest("c", good));

        AnalysisReport report = orchestrator.analyze(requests, linearBaselineSettings(3));

        assertEquals("a", report.getOutcomes().get(0).getDatasetName());
        assertEquals("b", report.getOutcomes().get(1).getDatasetName());
        assertEquals("c", report.getOutcomes().get(2).getDatasetName());
        assertTrue(report.getOutcomes().get(0).isSuccess());
        assertFalse(report.getOutcomes().get(1).isSuccess());
        assertTrue(report.getOutcomes().get(2).isSuccess());
        assertEquals(2, report.successfulResults().size());
    }

    @Test
    void analyze_shouldRemoveLinearBackgroundBeforeFitting() {
        Spectrum data = withLinearBackground();

        AnalysisReport report = orchestrator
                .analyze(List.of(new DatasetRequest("background", data)), linearBaselineSettings(1));

        FitResult r = report.getOutcomes().get(0).getResult();
        assertNotNull(r);
        for (int i = 0; i < data.size(); i++) {
            assertEquals(r.getRaw()[i] - r.getBaseline()[i], r.getCleaned()[i], 1e-12);
        }
    }
}
