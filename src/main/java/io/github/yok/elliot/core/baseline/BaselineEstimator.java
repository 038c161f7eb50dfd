package io.github.yok.elliot.core.baseline;

import io.github.yok.elliot.core.error.InsufficientRangeException;
import io.github.yok.elliot.core.error.SingularFitException;
import io.github.yok.elliot.core.linearalgebra.LeastSquaresBackend;
import io.github.yok.elliot.core.linearalgebra.LeastSquaresBackend.LeastSquaresSolution;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 利用者が選んだエネルギー範囲の生データに、通常の最小二乗法でベースラインを当てはめるクラスです。
 *
 * <ul>
 * <li>LINEAR: α ≈ a·E + b（範囲内に 2 点以上が必要）</li>
 * <li>RAYLEIGH: α ≈ c·E^4（原点を通る 1 係数、範囲内に 1 点以上が必要）</li>
 * <li>NONE: 0 関数（範囲は不要）</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public final class BaselineEstimator {

    /**
     * 線形最小二乗のバックエンドです。
     */
    private final LeastSquaresBackend leastSquares;

    /**
     * ベースラインを当てはめます。
     *
     * @param raw 生スペクトルです
     * @param mode ベースラインの関数形です
     * @param range 当てはめ範囲です（NONE の場合は null 可）
     * @return ベースラインです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws InsufficientRangeException 範囲内の点数が足りない場合に発生します
     * @throws SingularFitException 範囲内のエネルギーに広がりがない場合に発生します
     */
    public BaselineModel estimate(Spectrum raw, BaselineMode mode, EnergyRange range) {
        if (raw == null) {
            throw new IllegalArgumentException("raw は null 不可です");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode は null 不可です");
        }
        if (mode == BaselineMode.NONE) {
            return BaselineModel.none();
        }
        if (range == null) {
            throw new IllegalArgumentException(
                    "ベースライン範囲は必須です（fitmode=" + mode.getFitmode() + "）");
        }

        Spectrum selected = raw.restrict(range);
        double[] e = selected.getEnergies();
        double[] a = selected.getAbsorption();

        BaselineModel baseline;
        if (mode == BaselineMode.LINEAR) {
            baseline = fitLinear(e, a, range);
        } else {
            baseline = fitRayleigh(e, a, range);
        }

        log.info("ベースラインを当てはめました。形={}、範囲=[{}, {}] eV、点数={}、{}", mode.getDisplayName(),
                fmt3(range.getLower()), fmt3(range.getUpper()), e.length, describe(baseline));
        return baseline;
    }

    /**
     * 1次式 a·E + b を当てはめます。
     */
    private BaselineModel fitLinear(double[] e, double[] a, EnergyRange range) {
        if (e.length < 2) {
            throw new InsufficientRangeException("1次ベースラインの範囲に含まれる点が足りません", e.length, 2);
        }
        // 昇順なので先頭と末尾の差が広がりです。
        if (!(e[e.length - 1] - e[0] > 0.0)) {
            throw new SingularFitException("ベースライン範囲内のエネルギーに広がりがありません: E=" + e[0]);
        }

        DMatrixRMaj design = new DMatrixRMaj(e.length, 2);
        for (int i = 0; i < e.length; i++) {
            design.set(i, 0, e[i]);
            design.set(i, 1, 1.0);
        }
        LeastSquaresSolution solution = leastSquares.solve(design, a);
        double[] c = solution.getCoefficients();
        return BaselineModel.linear(c[0], c[1], range);
    }

    /**
     * 原点を通る c·E^4 を当てはめます。
     */
    private BaselineModel fitRayleigh(double[] e, double[] a, EnergyRange range) {
        if (e.length < 1) {
            throw new InsufficientRangeException("E^4 ベースラインの範囲に含まれる点が足りません", e.length, 1);
        }

        DMatrixRMaj design = new DMatrixRMaj(e.length, 1);
        double sumE8 = 0.0;
        for (int i = 0; i < e.length; i++) {
            double e4 = e[i] * e[i] * e[i] * e[i];
            design.set(i, 0, e4);
            sumE8 += e4 * e4;
        }
        if (!(sumE8 > 0.0)) {
            throw new SingularFitException("E^4 ベースラインの計画行列が 0 です（E=0 のみ）");
        }
        LeastSquaresSolution solution = leastSquares.solve(design, a);
        return BaselineModel.rayleigh(solution.getCoefficients()[0], range);
    }

    private static String describe(BaselineModel baseline) {
        if (baseline.getMode() == BaselineMode.LINEAR) {
            return "傾き=" + fmt5(baseline.getSlope()) + "、切片=" + fmt5(baseline.getIntercept());
        }
        return "係数=" + String.format(Locale.ROOT, "%.5e", baseline.getCoefficient());
    }

    private static String fmt3(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
