package io.github.yok.elliot.core.solver;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.elliot.core.error.InsufficientRangeException;
import io.github.yok.elliot.core.model.FitParameter;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.range.ParameterBounds;
import io.github.yok.elliot.core.range.RangeSelector;
import io.github.yok.elliot.core.solver.StagedFitOutcome.StageSummary;
import io.github.yok.elliot.core.solver.SpectrumOptimizer.OptimizationResult;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 予備フィット、全範囲フィット（段 1）、バンドギャップ近傍フィット（段 2）を順に実行し、 最後に境界への張り付きを判定するクラスです。
 *
 * <p>
 * 各段は前の段の結果を初期値として同じ {@link SpectrumOptimizer} を呼び出します。境界はすべての段で共通です。
 * </p>
 */
@Slf4j
@Getter
public final class StagedFitProcedure {

    /**
     * 境界への張り付きを判定する相対幅の既定値です。
     */
    public static final double DEFAULT_SATURATION_EPSILON = 1e-3;

    /**
     * 段 1・段 2 に必要な最小点数の既定値です。
     */
    public static final int DEFAULT_MINIMUM_FIT_POINTS = 10;

    /**
     * 予備フィットに用いる百分位の下端です。
     */
    private static final double PRELIMINARY_LOWER_PERCENTILE = 10.0;

    /**
     * 予備フィットに用いる百分位の上端です。
     */
    private static final double PRELIMINARY_UPPER_PERCENTILE = 90.0;

    /**
     * 最適化器です。
     */
    private final SpectrumOptimizer optimizer;

    /**
     * 段 2 の範囲を決める選択器です。
     */
    private final RangeSelector rangeSelector;

    /**
     * 境界への張り付きを判定する相対幅です。
     */
    private final double saturationEpsilon;

    /**
     * 段 1・段 2 に必要な最小点数です。
     */
    private final int minimumFitPoints;

    /**
     * 既定値で生成します。
     *
     * @param optimizer 最適化器です
     * @param rangeSelector 範囲選択器です
     */
    public StagedFitProcedure(SpectrumOptimizer optimizer, RangeSelector rangeSelector) {
        this(optimizer, rangeSelector, DEFAULT_SATURATION_EPSILON, DEFAULT_MINIMUM_FIT_POINTS);
    }

    /**
     * 生成します。
     *
     * @param optimizer 最適化器です（null 不可）
     * @param rangeSelector 範囲選択器です（null 不可）
     * @param saturationEpsilon 張り付き判定の相対幅です（0 以上）
     * @param minimumFitPoints 最小点数です（パラメータ数以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public StagedFitProcedure(SpectrumOptimizer optimizer, RangeSelector rangeSelector,
            double saturationEpsilon, int minimumFitPoints) {
        if (optimizer == null || rangeSelector == null) {
            throw new IllegalArgumentException("optimizer/rangeSelector は null 不可です");
        }
        if (!(saturationEpsilon >= 0.0)) {
            throw new IllegalArgumentException("saturationEpsilon は 0 以上が必要です: " + saturationEpsilon);
        }
        if (minimumFitPoints < FittingParameters.COUNT) {
            throw new IllegalArgumentException(
                    "minimumFitPoints は " + FittingParameters.COUNT + " 以上が必要です: " + minimumFitPoints);
        }
        this.optimizer = optimizer;
        this.rangeSelector = rangeSelector;
        this.saturationEpsilon = saturationEpsilon;
        this.minimumFitPoints = minimumFitPoints;
    }

    /**
     * 段階的フィッティングを実行します。
     *
     * @param cleaned ベースライン除去後のスペクトル（全範囲）です
     * @param start 初期パラメータです
     * @param bounds 箱型制約です
     * @param userFitRange 利用者指定のフィッティング範囲です（未指定は null）
     * @param preliminaryEnabled 予備フィットを行うかどうかです
     * @param autoRangeEnabled 段 2 を行うかどうかです
     * @return 結果です
     * @throws InsufficientRangeException 全範囲でも点数が足りない場合に発生します
     * @throws io.github.yok.elliot.core.error.OptimizationException 目的関数が有限値でなくなった場合に発生します
     */
    public StagedFitOutcome run(Spectrum cleaned, FittingParameters start, ParameterBounds bounds,
            EnergyRange userFitRange, boolean preliminaryEnabled, boolean autoRangeEnabled) {
        Preconditions.checkNotNull(cleaned, "スペクトルが null です。");
        Preconditions.checkNotNull(start, "初期パラメータが null です。");
        Preconditions.checkNotNull(bounds, "境界が null です。");

        ImmutableList.Builder<StageSummary> stages = ImmutableList.builder();
        ImmutableList.Builder<String> warnings = ImmutableList.builder();

        // 段 1 の対象範囲
        Spectrum stage1Data = cleaned;
        EnergyRange stage1Range = cleaned.isEmpty() ? null : cleaned.energySpan();
        boolean userRangeApplied = false;
        if (userFitRange != null) {
            Spectrum restricted = cleaned.restrict(userFitRange);
            if (restricted.size() >= minimumFitPoints) {
                stage1Data = restricted;
                stage1Range = userFitRange;
                userRangeApplied = true;
            } else {
                String msg = String.format(Locale.ROOT,
                        "フィッティング範囲 [%.3f, %.3f] eV の点数が %d 点しかないため全範囲を使用します",
                        userFitRange.getLower(), userFitRange.getUpper(), restricted.size());
                log.warn(msg);
                warnings.add(msg);
            }
        }
        if (stage1Data.size() < minimumFitPoints) {
            throw new InsufficientRangeException("フィッティングに使える点が足りません", stage1Data.size(),
                    minimumFitPoints);
        }

        FittingParameters current = bounds.clip(start);

        // 予備フィット
        if (preliminaryEnabled) {
            EnergyRange preliminaryRange =
                    EnergyRange.of(stage1Data.energyPercentile(PRELIMINARY_LOWER_PERCENTILE),
                            stage1Data.energyPercentile(PRELIMINARY_UPPER_PERCENTILE));
            Spectrum preliminaryData = stage1Data.restrict(preliminaryRange);
            if (preliminaryData.size() >= FittingParameters.COUNT) {
                OptimizationResult preliminary =
                        runStage("予備", preliminaryData, preliminaryRange, current, bounds, stages);
                current = preliminary.getParameters();
            } else {
                String msg = "予備フィットの範囲の点数が足りないため省略します: " + preliminaryData.size();
                log.warn(msg);
                warnings.add(msg);
            }
        }

        // 段 1
        OptimizationResult last = runStage("段1", stage1Data, stage1Range, current, bounds, stages);
        Spectrum lastData = stage1Data;

        // 段 2
        if (autoRangeEnabled) {
            double eg = last.getParameters().getEg();
            Spectrum focused = rangeSelector.narrowRange(cleaned, eg);
            EnergyRange focus = rangeSelector.focusWindow(eg);
            if (userRangeApplied) {
                focused = focused.restrict(userFitRange);
                focus = focus.intersect(userFitRange);
            }
            if (focused.size() > minimumFitPoints) {
                last = runStage("段2", focused, focus, last.getParameters(), bounds, stages);
                lastData = focused;
            } else {
                String msg = String.format(Locale.ROOT,
                        "Eg=%.3f eV 近傍の点数が足りないため、バンドギャップ近傍フィッティングを省略します", eg);
                log.warn(msg);
                warnings.add(msg);
            }
        }

        if (!last.isConverged()) {
            warnings.add("最適化が反復上限に達しました（未収束）");
        }

        ImmutableSet<String> saturated = saturatedParameters(last.getParameters(), bounds);
        if (!saturated.isEmpty()) {
            String msg = "境界に張り付いたパラメータがあります: " + String.join(", ", saturated);
            log.warn(msg);
            warnings.add(msg);
        }

        log.info("段階的フィッティングが終了しました。SSE={}、収束={}、{}", String.format(Locale.ROOT, "%.5e",
                last.getSse()), last.isConverged(), last.getParameters().describe());
        return new StagedFitOutcome(last.getParameters(), last.getSse(), last.isConverged(),
                lastData, stages.build(), saturated, warnings.build());
    }

    /**
     * 境界に張り付いたパラメータ名を返します。
     *
     * <p>
     * 判定条件は {@code |p - bound| ≤ ε·max(|bound|, 1)} で、下限・上限の両方を調べます。
     * </p>
     *
     * @param parameters パラメータです
     * @param bounds 境界です
     * @return パラメータ名の集合です（列挙順）
     */
    public ImmutableSet<String> saturatedParameters(FittingParameters parameters,
            ParameterBounds bounds) {
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        for (FitParameter p : FitParameter.values()) {
            double value = parameters.get(p);
            if (isNear(value, bounds.lowerOf(p)) || isNear(value, bounds.upperOf(p))) {
                names.add(p.getLabel());
            }
        }
        return names.build();
    }

    private boolean isNear(double value, double bound) {
        return Math.abs(value - bound) <= saturationEpsilon * Math.max(Math.abs(bound), 1.0);
    }

    private OptimizationResult runStage(String name, Spectrum data, EnergyRange range,
            FittingParameters start, ParameterBounds bounds,
            ImmutableList.Builder<StageSummary> stages) {
        log.info("{}のフィッティングを開始します。範囲=[{}, {}] eV、点数={}", name,
                String.format(Locale.ROOT, "%.3f", range.getLower()),
                String.format(Locale.ROOT, "%.3f", range.getUpper()), data.size());
        OptimizationResult result = optimizer.fit(data, start, bounds);
        stages.add(new StageSummary(name, range, data.size(), result));
        log.info("{}の結果: SSE={}、反復回数={}、{}", name,
                String.format(Locale.ROOT, "%.5e", result.getSse()), result.getIterations(),
                result.getParameters().describe());
        return result;
    }
}
