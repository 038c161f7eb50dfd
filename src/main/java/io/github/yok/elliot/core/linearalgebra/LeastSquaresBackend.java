package io.github.yok.elliot.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 線形最小二乗問題 {@code min ||A x - y||^2} を解くバックエンドを表すインタフェースです。
 *
 * <p>
 * ベースライン（1次式・E^4）と Urbach 裾の直線当てはめで共通に使います。 使用するライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface LeastSquaresBackend {

    /**
     * 計画行列 A と観測値 y から最小二乗解を求めます。
     *
     * @param design 計画行列 A（行 = データ点、列 = 係数）です
     * @param target 観測値 y です（長さは A の行数）
     * @return 最小二乗解です
     * @throws IllegalArgumentException 次元が一致しない場合に発生します
     * @throws io.github.yok.elliot.core.error.SingularFitException 問題が退化している場合に発生します
     */
    LeastSquaresSolution solve(DMatrixRMaj design, double[] target);

    /**
     * 最小二乗解（係数と残差二乗和）を保持するクラスです。
     */
    @Value
    class LeastSquaresSolution {

        /**
         * 係数ベクトルです（A の列の順）。
         */
        double[] coefficients;

        /**
         * 残差二乗和です。
         */
        double residualSumOfSquares;
    }
}
