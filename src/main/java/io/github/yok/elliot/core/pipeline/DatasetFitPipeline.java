package io.github.yok.elliot.core.pipeline;

import com.google.common.collect.ImmutableList;
import io.github.yok.elliot.core.baseline.BaselineEstimator;
import io.github.yok.elliot.core.baseline.BaselineModel;
import io.github.yok.elliot.core.metrics.DerivedMetrics;
import io.github.yok.elliot.core.metrics.DerivedMetricsCalculator;
import io.github.yok.elliot.core.metrics.UrbachTail;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.model.SpectralComponents;
import io.github.yok.elliot.core.model.SpectralModel;
import io.github.yok.elliot.core.range.ParameterBounds;
import io.github.yok.elliot.core.range.RangeSelector;
import io.github.yok.elliot.core.solver.StagedFitOutcome;
import io.github.yok.elliot.core.solver.StagedFitProcedure;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 1 データセットに対し、ベースライン除去、初期 Eg と境界の決定、段階的フィッティング、派生量の計算を順に行うクラスです。
 */
@Slf4j
@RequiredArgsConstructor
public final class DatasetFitPipeline {

    private final BaselineEstimator baselineEstimator;

    private final RangeSelector rangeSelector;

    private final StagedFitProcedure stagedFitProcedure;

    private final SpectralModel model;

    private final DerivedMetricsCalculator metricsCalculator;

    /**
     * 1 データセットを解析します。
     *
     * @param request データセットです
     * @param settings 設定値です
     * @param warmStart 直前のデータセットの結果です（使わない場合は null）
     * @return 解析結果です
     * @throws io.github.yok.elliot.core.error.SpectrumFitException 解析に失敗した場合に発生します
     * @throws IllegalArgumentException 入力が不正な場合に発生します
     */
    public FitResult fit(DatasetRequest request, FitSettings settings,
            FittingParameters warmStart) {
        if (request == null || settings == null) {
            throw new IllegalArgumentException("request/settings は null 不可です");
        }
        Spectrum raw = request.getRaw();
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("データセットが空です: " + request.getName());
        }

        // 1) ベースライン除去
        BaselineModel baseline = baselineEstimator.estimate(raw, settings.getBaselineMode(),
                settings.getBaselineRange());
        Spectrum cleaned = baseline.subtractFrom(raw);

        // 2) 初期 Eg と境界
        double detectedEg = rangeSelector.detectBandGap(cleaned);
        double initialEg = rangeSelector.chooseInitialBandGap(settings.getInitialEg(), detectedEg,
                cleaned.energySpan());
        ParameterBounds bounds = rangeSelector.computeBounds(initialEg, settings.getBounds());
        FittingParameters base = warmStart != null ? warmStart : settings.getStartPoint();
        FittingParameters start = base.withEg(initialEg);

        // 3) 段階的フィッティング
        StagedFitOutcome outcome = stagedFitProcedure.run(cleaned, start, bounds,
                settings.getFitRange(), settings.isPreliminaryEnabled(),
                settings.isAutoRangeEnabled());
        FittingParameters fitted = outcome.getParameters();

        // 4) 元のエネルギー軸上の各成分と派生量
        double[] energies = raw.getEnergies();
        SpectralComponents components = model.evaluateComponents(fitted, energies);
        DerivedMetrics metrics =
                metricsCalculator.compute(fitted, outcome.getFittedSpectrum(), outcome.getSse());
        UrbachTail tail = metrics.getUrbachTail();

        ImmutableList.Builder<String> warnings =
                ImmutableList.<String>builder().addAll(outcome.getWarnings());
        if (metrics.getRSquared() < 0.0) {
            warnings.add("R² が負です。フィッティング結果は平均値より悪い近似です");
        }

        Spectrum fittedSpectrum = outcome.getFittedSpectrum();
        FitResult result = FitResult.builder().datasetName(request.getName()).parameters(fitted)
                .ebGroundState(metrics.getEbGroundState()).deff(metrics.getDeff())
                .rSquared(metrics.getRSquared()).urbachEnergy(metrics.getUrbachEnergy())
                .urbachSlope(tail == null ? null : tail.getSlope())
                .urbachIntercept(tail == null ? null : tail.getIntercept()).sse(outcome.getSse())
                .converged(outcome.isConverged()).boundaryWarnings(outcome.getBoundaryWarnings())
                .qWarning(metrics.getQWarning()).warnings(warnings.build()).energies(energies)
                .raw(raw.getAbsorption()).baseline(baseline.sample(energies))
                .cleaned(cleaned.getAbsorption()).exciton(components.getExciton())
                .band(components.getBand()).total(components.getTotal())
                .fitRangeLower(fittedSpectrum.minEnergy()).fitRangeUpper(fittedSpectrum.maxEnergy())
                .build();

        log.info("データセット {} の解析が終了しました。{}、R²={}", request.getName(), fitted.describe(),
                String.format(Locale.ROOT, "%.5f", metrics.getRSquared()));
        return result;
    }
}
