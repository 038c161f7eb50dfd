package io.github.yok.elliot.core.range;

import io.github.yok.elliot.core.model.FitParameter;
import io.github.yok.elliot.core.model.FittingParameters;
import java.util.Arrays;
import java.util.Locale;

/**
 * 6 パラメータそれぞれの下限・上限（箱型制約）を保持する不変クラスです。
 */
public final class ParameterBounds {

    /**
     * 既定の下限（Eg, Eb, Gamma, ucvsq, mhcnp, q）です。Eg は実行時に初期値 ±0.4 eV で置き換えます。
     */
    private static final double[] DEFAULT_LOWER = {1.00, 0.01, 0.00, 0.010, 0.000, 0.0};

    /**
     * 既定の上限（Eg, Eb, Gamma, ucvsq, mhcnp, q）です。q の上限 1.5 は Deff = 3 - 2q ≥ 0 に対応します。
     */
    private static final double[] DEFAULT_UPPER = {10.0, 2.0, 0.50, 10000.0, 0.999, 1.5};

    /**
     * 下限です。
     */
    private final double[] lower;

    /**
     * 上限です。
     */
    private final double[] upper;

    /**
     * 境界を生成します。
     *
     * @param lower 下限（長さ 6）です
     * @param upper 上限（長さ 6）です
     * @throws IllegalArgumentException 長さが不正、有限値でない、または下限が上限を超える場合に発生します
     */
    public ParameterBounds(double[] lower, double[] upper) {
        if (lower == null || upper == null || lower.length != FittingParameters.COUNT
                || upper.length != FittingParameters.COUNT) {
            throw new IllegalArgumentException("lower/upper は長さ " + FittingParameters.COUNT + " が必要です");
        }
        for (FitParameter p : FitParameter.values()) {
            double lo = lower[p.index()];
            double hi = upper[p.index()];
            if (!Double.isFinite(lo) || !Double.isFinite(hi)) {
                throw new IllegalArgumentException(p.getLabel() + " の境界は有限値が必要です: [" + lo + ", " + hi + "]");
            }
            if (lo > hi) {
                throw new IllegalArgumentException(p.getLabel() + " の下限が上限を超えています: [" + lo + ", " + hi + "]");
            }
        }
        this.lower = lower.clone();
        this.upper = upper.clone();
    }

    /**
     * 既定の境界を返します。
     *
     * @return 既定の境界です
     */
    public static ParameterBounds defaults() {
        return new ParameterBounds(DEFAULT_LOWER, DEFAULT_UPPER);
    }

    /**
     * 指定パラメータの下限を返します。
     *
     * @param parameter パラメータです
     * @return 下限です
     */
    public double lowerOf(FitParameter parameter) {
        return lower[parameter.index()];
    }

    /**
     * 指定パラメータの上限を返します。
     *
     * @param parameter パラメータです
     * @return 上限です
     */
    public double upperOf(FitParameter parameter) {
        return upper[parameter.index()];
    }

    /**
     * 下限配列のコピーを返します。
     *
     * @return 下限です
     */
    public double[] lowerArray() {
        return lower.clone();
    }

    /**
     * 上限配列のコピーを返します。
     *
     * @return 上限です
     */
    public double[] upperArray() {
        return upper.clone();
    }

    /**
     * 1 パラメータの境界だけを差し替えた新しい境界を返します。
     *
     * @param parameter パラメータです
     * @param lo 新しい下限です
     * @param hi 新しい上限です
     * @return 新しい境界です
     */
    public ParameterBounds with(FitParameter parameter, double lo, double hi) {
        double[] l = lower.clone();
        double[] u = upper.clone();
        l[parameter.index()] = lo;
        u[parameter.index()] = hi;
        return new ParameterBounds(l, u);
    }

    /**
     * 配列の各成分を境界内に射影します。
     *
     * @param values パラメータ配列です（変更しません）
     * @return 射影後の新しい配列です
     */
    public double[] clip(double[] values) {
        double[] clipped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            clipped[i] = Math.min(upper[i], Math.max(lower[i], values[i]));
        }
        return clipped;
    }

    /**
     * パラメータを境界内に射影します。
     *
     * @param parameters パラメータです
     * @return 射影後のパラメータです
     */
    public FittingParameters clip(FittingParameters parameters) {
        return FittingParameters.fromArray(clip(parameters.toArray()));
    }

    /**
     * パラメータがすべて境界内にあるかを返します。
     *
     * @param parameters パラメータです
     * @return 境界内なら true です
     */
    public boolean contains(FittingParameters parameters) {
        double[] v = parameters.toArray();
        for (int i = 0; i < v.length; i++) {
            if (v[i] < lower[i] || v[i] > upper[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParameterBounds)) {
            return false;
        }
        ParameterBounds other = (ParameterBounds) o;
        return Arrays.equals(lower, other.lower) && Arrays.equals(upper, other.upper);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(lower) + Arrays.hashCode(upper);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ParameterBounds(");
        for (FitParameter p : FitParameter.values()) {
            if (p.index() > 0) {
                sb.append(", ");
            }
            sb.append(p.getLabel()).append("=[")
                    .append(String.format(Locale.ROOT, "%.4g", lower[p.index()])).append(", ")
                    .append(String.format(Locale.ROOT, "%.4g", upper[p.index()])).append(']');
        }
        return sb.append(')').toString();
    }
}
