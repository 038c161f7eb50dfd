package io.github.yok.elliot.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.elliot.core.error.InsufficientRangeException;
import io.github.yok.elliot.core.error.OptimizationException;
import io.github.yok.elliot.core.model.FitParameter;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.model.SpectralModel;
import io.github.yok.elliot.core.range.ParameterBounds;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.MultivariateMatrixFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/**
 * Levenberg-Marquardt 法（Apache Commons Math）で SSE を最小化するクラスです。
 *
 * <p>
 * 試行点はすべて {@code ParameterValidator} で箱型制約内に射影し、 ヤコビアンは境界をまたがない向きの前進差分で求めます。
 * ヤコビアン計算時のモデル評価は最良点の記録に含めません。
 * 反復回数・評価回数の上限に達した場合は、それまでに評価した中で SSE が最小の点を converged=false で返します。
 * </p>
 */
@Slf4j
@Getter
public final class BoundedLeastSquaresOptimizer implements SpectrumOptimizer {

    /**
     * 差分ステップの相対幅です。
     */
    private static final double RELATIVE_DIFFERENCE_STEP = 1e-7;

    /**
     * 差分ステップの基準値の下限です（値が 0 付近のパラメータ用）。
     */
    private static final double MIN_DIFFERENCE_SCALE = 1e-2;

    /**
     * 目的関数を評価するモデルです。
     */
    private final SpectralModel model;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * 最大評価回数です。
     */
    private final int maxEvaluations;

    /**
     * コストの相対許容誤差です。
     */
    private final double costRelativeTolerance;

    /**
     * パラメータの相対許容誤差です。
     */
    private final double parameterRelativeTolerance;

    /**
     * 最適化器を生成します。
     *
     * @param model モデルです（null 不可）
     * @param maxIterations 最大反復回数です（1 以上）
     * @param maxEvaluations 最大評価回数です（1 以上）
     * @param costRelativeTolerance コストの相対許容誤差です（正の値）
     * @param parameterRelativeTolerance パラメータの相対許容誤差です（正の値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BoundedLeastSquaresOptimizer(SpectralModel model, int maxIterations,
            int maxEvaluations, double costRelativeTolerance, double parameterRelativeTolerance) {
        if (model == null) {
            throw new IllegalArgumentException("model は null 不可です");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations は 1 以上が必要です: " + maxIterations);
        }
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("maxEvaluations は 1 以上が必要です: " + maxEvaluations);
        }
        if (!(costRelativeTolerance > 0.0)) {
            throw new IllegalArgumentException(
                    "costRelativeTolerance は正の値が必要です: " + costRelativeTolerance);
        }
        if (!(parameterRelativeTolerance > 0.0)) {
            throw new IllegalArgumentException(
                    "parameterRelativeTolerance は正の値が必要です: " + parameterRelativeTolerance);
        }
        this.model = model;
        this.maxIterations = maxIterations;
        this.maxEvaluations = maxEvaluations;
        this.costRelativeTolerance = costRelativeTolerance;
        this.parameterRelativeTolerance = parameterRelativeTolerance;
    }

    /**
     * SSE を最小化するパラメータを探索します。
     *
     * @param cleaned ベースライン除去後のスペクトルです
     * @param start 初期パラメータです
     * @param bounds 箱型制約です
     * @return 最適化結果です
     */
    @Override
    public OptimizationResult fit(Spectrum cleaned, FittingParameters start,
            ParameterBounds bounds) {
        Preconditions.checkNotNull(cleaned, "スペクトルが null です。");
        Preconditions.checkNotNull(start, "初期パラメータが null です。");
        Preconditions.checkNotNull(bounds, "境界が null です。");
        if (cleaned.size() < FittingParameters.COUNT) {
            throw new InsufficientRangeException("フィッティング範囲に含まれる点が足りません", cleaned.size(),
                    FittingParameters.COUNT);
        }

        final double[] energies = cleaned.getEnergies();
        final double[] target = cleaned.getAbsorption();
        final double[] startPoint = bounds.clip(start.toArray());

        BestPointTracker tracker = new BestPointTracker();

        // 試行点の残差だけが必要な評価ではヤコビアンを計算しないよう、遅延評価にします。
        LeastSquaresProblem problem = new LeastSquaresBuilder().start(startPoint)
                .model(valueFunction(energies, target, tracker),
                        jacobianFunction(energies, bounds, tracker))
                .target(target)
                .parameterValidator(p -> new ArrayRealVector(bounds.clip(p.toArray()), false))
                .lazyEvaluation(true).maxIterations(maxIterations).maxEvaluations(maxEvaluations)
                .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(costRelativeTolerance)
                .withParameterRelativeTolerance(parameterRelativeTolerance);

        log.debug("最適化を開始します。点数={}、範囲=[{}, {}] eV、初期値={}", energies.length,
                fmt3(energies[0]), fmt3(energies[energies.length - 1]),
                FittingParameters.fromArray(startPoint).describe());

        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
            double[] point = bounds.clip(optimum.getPoint().toArray());
            RealVector residuals = optimum.getResiduals();
            double sse = residuals.dotProduct(residuals);
            requireFinite(sse, point);

            log.debug("最適化が収束しました。反復回数={}、評価回数={}、SSE={}", optimum.getIterations(),
                    optimum.getEvaluations(), fmtE(sse));
            return new OptimizationResult(FittingParameters.fromArray(point), sse,
                    optimum.getIterations(), optimum.getEvaluations(), true);

        } catch (MaxCountExceededException e) {
            // 反復・評価の上限到達は致命的ではありません。最良点を未収束として返します。
            String cap = tracker.iterations >= maxIterations ? "反復回数" : "評価回数";
            log.warn("最適化が{}の上限に達したため打ち切ります（未収束）。反復回数={}/{}、最大評価回数={}、最良SSE={}",
                    cap, tracker.iterations, maxIterations, maxEvaluations, fmtE(tracker.bestSse));
            return tracker.toResult(false);

        } catch (ConvergenceException e) {
            // コストがこれ以上減らせない（完全一致に近い）状態です。最良点を収束として扱います。
            log.debug("コストがこれ以上減少しないため終了します。最良SSE={}、理由={}", fmtE(tracker.bestSse),
                    e.getMessage());
            return tracker.toResult(true);
        }
    }

    /**
     * モデル値を返す関数を作ります。評価のたびに最良点を記録します。
     *
     * @param energies エネルギーです
     * @param target 観測値です
     * @param tracker 最良点の記録先です
     * @return 関数です
     */
    private MultivariateVectorFunction valueFunction(double[] energies, double[] target,
            BestPointTracker tracker) {
        return p -> {
            double[] value = evaluateChecked(p, energies);
            tracker.offer(p, sse(value, target));
            return value;
        };
    }

    /**
     * ヤコビアンを前進差分で返す関数を作ります。
     *
     * <p>
     * 差分の向きは、試行点が境界の外に出ないように選びます。
     * </p>
     *
     * @param energies エネルギーです
     * @param bounds 箱型制約です
     * @param tracker 反復回数の記録先です
     * @return 関数です
     */
    private MultivariateMatrixFunction jacobianFunction(double[] energies, ParameterBounds bounds,
            BestPointTracker tracker) {
        final double[] lower = bounds.lowerArray();
        final double[] upper = bounds.upperArray();

        return p -> {
            // Levenberg-Marquardt はヤコビアンを 1 反復につき 1 回だけ要求します。
            tracker.iterations++;
            double[] value = evaluateChecked(p, energies);
            int m = energies.length;
            int n = p.length;
            double[][] jacobian = new double[m][n];
            for (int j = 0; j < n; j++) {
                double h = RELATIVE_DIFFERENCE_STEP * Math.max(Math.abs(p[j]), MIN_DIFFERENCE_SCALE);
                // 上限を越える場合は後退差分にします。
                if (p[j] + h > upper[j] && p[j] - h >= lower[j]) {
                    h = -h;
                }
                double[] shifted = p.clone();
                shifted[j] += h;
                double[] shiftedValue = evaluateChecked(shifted, energies);
                for (int i = 0; i < m; i++) {
                    jacobian[i][j] = (shiftedValue[i] - value[i]) / h;
                }
            }
            return jacobian;
        };
    }

    /**
     * モデルを評価し、有限値であることを検査します。
     */
    private double[] evaluateChecked(double[] p, double[] energies) {
        FittingParameters parameters;
        try {
            parameters = FittingParameters.fromArray(p);
        } catch (IllegalArgumentException e) {
            throw new OptimizationException("パラメータが有限値でなくなりました", e);
        }
        double[] value = model.evaluate(parameters, energies);
        for (int i = 0; i < value.length; i++) {
            if (!Double.isFinite(value[i])) {
                throw new OptimizationException("モデル値が有限値ではありません: E=" + energies[i] + ", "
                        + parameters.describe());
            }
        }
        return value;
    }

    private static double sse(double[] value, double[] target) {
        double s = 0.0;
        for (int i = 0; i < value.length; i++) {
            double r = value[i] - target[i];
            s += r * r;
        }
        return s;
    }

    private static void requireFinite(double sse, double[] point) {
        if (!Double.isFinite(sse)) {
            throw new OptimizationException("SSE が有限値ではありません: " + sse);
        }
        for (FitParameter p : FitParameter.values()) {
            if (!Double.isFinite(point[p.index()])) {
                throw new OptimizationException(p.getLabel() + " が有限値ではありません");
            }
        }
    }

    private static String fmt3(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    private static String fmtE(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }

    /**
     * 評価済みの点のうち SSE が最小の点を記録します。
     *
     * <p>
     * 1 回の {@link #fit} 呼び出しの中だけで使い、呼び出し間で共有しません。
     * </p>
     */
    private static final class BestPointTracker {

        private double[] bestPoint;

        private double bestSse = Double.POSITIVE_INFINITY;

        private int evaluations;

        private int iterations;

        void offer(double[] point, double sse) {
            evaluations++;
            if (sse < bestSse) {
                bestSse = sse;
                bestPoint = point.clone();
            }
        }

        OptimizationResult toResult(boolean converged) {
            if (bestPoint == null) {
                throw new OptimizationException("評価済みの点がありません");
            }
            return new OptimizationResult(FittingParameters.fromArray(bestPoint), bestSse,
                    iterations, evaluations, converged);
        }
    }
}
