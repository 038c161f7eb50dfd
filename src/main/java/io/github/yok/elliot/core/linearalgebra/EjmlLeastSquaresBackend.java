package io.github.yok.elliot.core.linearalgebra;

import io.github.yok.elliot.core.error.SingularFitException;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * EJML（QR 分解）を用いて線形最小二乗問題を解くクラスです。
 */
public final class EjmlLeastSquaresBackend implements LeastSquaresBackend {

    /**
     * 解の品質（条件数の逆数に相当）がこれ未満なら退化とみなす閾値です。
     */
    private static final double MIN_QUALITY = 1e-12;

    /**
     * 計画行列 A と観測値 y から最小二乗解を求めます。
     *
     * @param design 計画行列 A です
     * @param target 観測値 y です
     * @return 最小二乗解です
     * @throws IllegalArgumentException 引数が null、または次元が一致しない場合に発生します
     * @throws SingularFitException 行数が列数未満、または A が退化している場合に発生します
     */
    @Override
    public LeastSquaresSolution solve(DMatrixRMaj design, double[] target) {
        if (design == null || target == null) {
            throw new IllegalArgumentException("design/target は null 不可です");
        }
        int rows = design.numRows;
        int cols = design.numCols;
        if (rows != target.length) {
            throw new IllegalArgumentException(
                    "計画行列の行数と観測値の長さが一致しません: " + rows + " != " + target.length);
        }
        if (cols == 0) {
            throw new IllegalArgumentException("計画行列の列数は 1 以上が必要です");
        }
        if (rows < cols) {
            throw new SingularFitException("データ点数が係数の数より少ないため解が定まりません: 点数=" + rows
                    + ", 係数=" + cols);
        }

        // setA が A を書き換える実装もあるため、コピーを渡します。
        DMatrixRMaj a = design.copy();
        DMatrixRMaj y = new DMatrixRMaj(rows, 1, true, target);
        DMatrixRMaj x = new DMatrixRMaj(cols, 1);

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(rows, cols);
        if (!solver.setA(a)) {
            throw new SingularFitException("最小二乗問題の分解に失敗しました（EJML）");
        }
        if (solver.quality() < MIN_QUALITY) {
            throw new SingularFitException("計画行列が退化しています: quality=" + solver.quality());
        }
        solver.solve(y, x);

        double[] coefficients = new double[cols];
        for (int j = 0; j < cols; j++) {
            coefficients[j] = x.get(j, 0);
        }

        // 残差二乗和は元の A で計算します。
        double rss = 0.0;
        for (int i = 0; i < rows; i++) {
            double fitted = 0.0;
            for (int j = 0; j < cols; j++) {
                fitted += design.get(i, j) * coefficients[j];
            }
            double r = target[i] - fitted;
            rss += r * r;
        }

        return new LeastSquaresSolution(coefficients, rss);
    }
}
