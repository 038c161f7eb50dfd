package io.github.yok.elliot.core.metrics;

import io.github.yok.elliot.core.error.SingularFitException;
import io.github.yok.elliot.core.linearalgebra.LeastSquaresBackend;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * フィッティング結果から基底状態束縛エネルギー、有効次元、R²、Urbach エネルギーを求めるクラスです。
 */
@Slf4j
@Getter
public final class DerivedMetricsCalculator {

    /**
     * q が 1 に近いと判定する幅の既定値です。
     */
    public static final double DEFAULT_Q_EPSILON = 1e-2;

    /**
     * Urbach 裾の当てはめに必要な点数の既定値です。
     */
    public static final int DEFAULT_MINIMUM_URBACH_POINTS = 3;

    /**
     * Urbach 裾の直線当てはめに用いるバックエンドです。
     */
    private final LeastSquaresBackend leastSquares;

    /**
     * q が 1 に近いと判定する幅です。
     */
    private final double qEpsilon;

    /**
     * Urbach 裾の当てはめに必要な点数です。
     */
    private final int minimumUrbachPoints;

    /**
     * 既定値で生成します。
     *
     * @param leastSquares 線形最小二乗のバックエンドです
     */
    public DerivedMetricsCalculator(LeastSquaresBackend leastSquares) {
        this(leastSquares, DEFAULT_Q_EPSILON, DEFAULT_MINIMUM_URBACH_POINTS);
    }

    /**
     * 生成します。
     *
     * @param leastSquares 線形最小二乗のバックエンドです（null 不可）
     * @param qEpsilon q が 1 に近いと判定する幅です（正の値）
     * @param minimumUrbachPoints Urbach 裾に必要な点数です（2 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public DerivedMetricsCalculator(LeastSquaresBackend leastSquares, double qEpsilon,
            int minimumUrbachPoints) {
        if (leastSquares == null) {
            throw new IllegalArgumentException("leastSquares は null 不可です");
        }
        if (!(qEpsilon > 0.0)) {
            throw new IllegalArgumentException("qEpsilon は正の値が必要です: " + qEpsilon);
        }
        if (minimumUrbachPoints < 2) {
            throw new IllegalArgumentException(
                    "minimumUrbachPoints は 2 以上が必要です: " + minimumUrbachPoints);
        }
        this.leastSquares = leastSquares;
        this.qEpsilon = qEpsilon;
        this.minimumUrbachPoints = minimumUrbachPoints;
    }

    /**
     * 派生量を求めます。
     *
     * @param parameters フィッティング後のパラメータです
     * @param fitted 最終段で用いたスペクトル（ベースライン除去後）です
     * @param sse そのスペクトル上の二乗誤差和です
     * @return 派生量です
     */
    public DerivedMetrics compute(FittingParameters parameters, Spectrum fitted, double sse) {
        if (parameters == null || fitted == null) {
            throw new IllegalArgumentException("parameters/fitted は null 不可です");
        }

        Double ebGroundState = null;
        String qWarning = null;
        double oneMinusQ = 1.0 - parameters.getQ();
        if (Math.abs(oneMinusQ) <= qEpsilon) {
            qWarning = String.format(Locale.ROOT,
                    "q=%.4f が 1 に近いため Eb_GroundState = Eb/(1-q)^2 は発散します（|1-q| ≤ %.3g）",
                    parameters.getQ(), qEpsilon);
            log.warn(qWarning);
        } else {
            ebGroundState = parameters.getEb() / (oneMinusQ * oneMinusQ);
        }

        double deff = 3.0 - 2.0 * parameters.getQ();
        double rSquared = rSquared(fitted, sse);
        UrbachTail tail = fitUrbachTail(fitted, parameters.getEg());

        return new DerivedMetrics(ebGroundState, deff, rSquared, tail, qWarning);
    }

    /**
     * R² = 1 - SSE/SST を返します。SST が 0 の場合は 0 を返します。
     *
     * @param fitted スペクトルです
     * @param sse 二乗誤差和です
     * @return R² です
     */
    static double rSquared(Spectrum fitted, double sse) {
        int n = fitted.size();
        if (n == 0) {
            return 0.0;
        }
        double mean = 0.0;
        for (int i = 0; i < n; i++) {
            mean += fitted.absorptionAt(i);
        }
        mean /= n;
        double sst = 0.0;
        for (int i = 0; i < n; i++) {
            double d = fitted.absorptionAt(i) - mean;
            sst += d * d;
        }
        if (!(sst > 0.0)) {
            return 0.0;
        }
        return 1.0 - sse / sst;
    }

    /**
     * E &lt; Eg かつ α &gt; 0 の点に ln(α) = slope·E + intercept を当てはめます。
     *
     * @param fitted スペクトルです
     * @param eg バンドギャップ（eV）です
     * @return Urbach 裾です（点が足りない、または傾きが正でない場合は null）
     */
    UrbachTail fitUrbachTail(Spectrum fitted, double eg) {
        Spectrum tail = fitted.filter(e -> e < eg);
        int count = 0;
        for (int i = 0; i < tail.size(); i++) {
            if (tail.absorptionAt(i) > 0.0) {
                count++;
            }
        }
        if (count < minimumUrbachPoints) {
            log.debug("Urbach 裾の点数が足りないため省略します。点数={}", count);
            return null;
        }

        DMatrixRMaj design = new DMatrixRMaj(count, 2);
        double[] target = new double[count];
        int row = 0;
        for (int i = 0; i < tail.size(); i++) {
            double a = tail.absorptionAt(i);
            if (a > 0.0) {
                design.set(row, 0, tail.energyAt(i));
                design.set(row, 1, 1.0);
                target[row] = Math.log(a);
                row++;
            }
        }

        double[] c;
        try {
            c = leastSquares.solve(design, target).getCoefficients();
        } catch (SingularFitException e) {
            log.debug("Urbach 裾の当てはめが特異なため省略します: {}", e.getMessage());
            return null;
        }
        if (!(c[0] > 0.0) || !Double.isFinite(c[1])) {
            log.debug("Urbach 裾の傾きが正でないため省略します。傾き={}", c[0]);
            return null;
        }
        UrbachTail result = new UrbachTail(c[0], c[1], count);
        log.info("Urbach エネルギー={} meV（点数={}）",
                String.format(Locale.ROOT, "%.2f", result.getEnergy() * 1000.0), count);
        return result;
    }
}
