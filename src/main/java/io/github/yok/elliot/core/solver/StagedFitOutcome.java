package io.github.yok.elliot.core.solver;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import lombok.Value;

/**
 * 段階的フィッティングの結果です。
 */
@Value
public class StagedFitOutcome {

    /**
     * 最終段のパラメータです。
     */
    FittingParameters parameters;

    /**
     * 最終段の二乗誤差和です（最終段で用いたスペクトル上の値）。
     */
    double sse;

    /**
     * 最終段が収束したかどうかです。
     */
    boolean converged;

    /**
     * 最終段で用いたスペクトルです。R² と Urbach 裾の計算に用います。
     */
    Spectrum fittedSpectrum;

    /**
     * 実行した段の記録です（実行順）。
     */
    ImmutableList<StageSummary> stages;

    /**
     * 境界に張り付いたパラメータ名です。
     */
    ImmutableSet<String> boundaryWarnings;

    /**
     * 致命的でない注意事項です。
     */
    ImmutableList<String> warnings;

    /**
     * 1 段分の記録です。
     */
    @Value
    public static class StageSummary {

        /**
         * 段の名前です。
         */
        String name;

        /**
         * 対象としたエネルギー範囲です。
         */
        EnergyRange range;

        /**
         * 対象の点数です。
         */
        int pointCount;

        /**
         * 最適化結果です。
         */
        SpectrumOptimizer.OptimizationResult result;
    }
}
