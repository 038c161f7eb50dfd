package io.github.yok.elliot.core.solver;

import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.range.ParameterBounds;
import io.github.yok.elliot.core.spectrum.Spectrum;
import lombok.Value;

/**
 * ベースライン除去後のスペクトルに対し、モデル曲線との二乗誤差和（SSE）を 箱型制約のもとで最小化するインタフェースです。
 *
 * <pre>
 *   SSE(p) = Σ_i [ model(p, E_i) - α_i ]^2
 * </pre>
 */
public interface SpectrumOptimizer {

    /**
     * SSE を最小化するパラメータを探索します。
     *
     * @param cleaned ベースライン除去後のスペクトルです
     * @param start 初期パラメータです（境界外の成分は境界内に射影してから開始します）
     * @param bounds 箱型制約です
     * @return 最適化結果です（反復上限に達した場合は converged=false）
     * @throws io.github.yok.elliot.core.error.InsufficientRangeException 点数が足りない場合に発生します
     * @throws io.github.yok.elliot.core.error.OptimizationException 目的関数が有限値でなくなった場合に発生します
     */
    OptimizationResult fit(Spectrum cleaned, FittingParameters start, ParameterBounds bounds);

    /**
     * 最適化結果を表すクラスです。
     */
    @Value
    class OptimizationResult {

        /**
         * 最適化後のパラメータです。
         */
        FittingParameters parameters;

        /**
         * 最適化後の二乗誤差和です。
         */
        double sse;

        /**
         * 実行した反復回数です。
         */
        int iterations;

        /**
         * 目的関数の評価回数です。
         */
        int evaluations;

        /**
         * 収束判定を満たしたかどうかです（反復上限で打ち切った場合は false）。
         */
        boolean converged;
    }
}
