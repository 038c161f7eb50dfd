package io.github.yok.elliot.core.baseline;

import io.github.yok.elliot.core.spectrum.EnergyRange;
import io.github.yok.elliot.core.spectrum.Spectrum;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 生データから差し引くベースライン関数を表す不変クラスです。
 *
 * <p>
 * 関数形は {@link BaselineMode} で決まります。
 * </p>
 * <ul>
 * <li>NONE: 0</li>
 * <li>LINEAR: slope·E + intercept</li>
 * <li>RAYLEIGH: coefficient·E^4</li>
 * </ul>
 *
 * <p>
 * {@link #subtractFrom(Spectrum)} は適用のたびに差し引くため、0 以外のベースラインを 2 回適用すると結果は変わります。
 * 差し引き済みかどうかは呼び出し側で管理します。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BaselineModel {

    /**
     * 関数形です。
     */
    BaselineMode mode;

    /**
     * 1次式の傾きです（LINEAR 以外は 0）。
     */
    double slope;

    /**
     * 1次式の切片です（LINEAR 以外は 0）。
     */
    double intercept;

    /**
     * E^4 の係数です（RAYLEIGH 以外は 0）。
     */
    double coefficient;

    /**
     * 当てはめに用いたエネルギー範囲です（NONE の場合は null）。
     */
    EnergyRange fittedRange;

    /**
     * 0 関数のベースラインを返します。
     *
     * @return ベースラインです
     */
    public static BaselineModel none() {
        return new BaselineModel(BaselineMode.NONE, 0.0, 0.0, 0.0, null);
    }

    /**
     * 1次式のベースラインを返します。
     *
     * @param slope 傾きです
     * @param intercept 切片です
     * @param fittedRange 当てはめ範囲です
     * @return ベースラインです
     */
    public static BaselineModel linear(double slope, double intercept, EnergyRange fittedRange) {
        return new BaselineModel(BaselineMode.LINEAR, slope, intercept, 0.0, fittedRange);
    }

    /**
     * E^4 のベースラインを返します。
     *
     * @param coefficient E^4 の係数です
     * @param fittedRange 当てはめ範囲です
     * @return ベースラインです
     */
    public static BaselineModel rayleigh(double coefficient, EnergyRange fittedRange) {
        return new BaselineModel(BaselineMode.RAYLEIGH, 0.0, 0.0, coefficient, fittedRange);
    }

    /**
     * エネルギー E でのベースライン値を返します。
     *
     * @param energy エネルギー（eV）です
     * @return ベースライン値です
     */
    public double valueAt(double energy) {
        switch (mode) {
            case LINEAR:
                return slope * energy + intercept;
            case RAYLEIGH:
                double e2 = energy * energy;
                return coefficient * e2 * e2;
            case NONE:
            default:
                return 0.0;
        }
    }

    /**
     * エネルギー格子上でベースラインを評価します。
     *
     * @param energies エネルギー（eV）です
     * @return ベースライン値の配列です
     */
    public double[] sample(double[] energies) {
        double[] values = new double[energies.length];
        for (int i = 0; i < energies.length; i++) {
            values[i] = valueAt(energies[i]);
        }
        return values;
    }

    /**
     * ベースラインが恒等的に 0 かどうかを返します。
     *
     * @return 0 関数の場合は true です
     */
    public boolean isZero() {
        switch (mode) {
            case LINEAR:
                return slope == 0.0 && intercept == 0.0;
            case RAYLEIGH:
                return coefficient == 0.0;
            case NONE:
            default:
                return true;
        }
    }

    /**
     * スペクトルからベースラインを差し引いた新しいスペクトルを返します（元のスペクトルは変更しません）。
     *
     * @param raw 差し引く前のスペクトルです
     * @return 差し引いた後の新しいスペクトルです
     */
    public Spectrum subtractFrom(Spectrum raw) {
        if (raw == null) {
            throw new IllegalArgumentException("raw は null 不可です");
        }
        double[] energies = raw.getEnergies();
        double[] cleaned = raw.getAbsorption();
        for (int i = 0; i < energies.length; i++) {
            cleaned[i] -= valueAt(energies[i]);
        }
        return raw.withAbsorption(cleaned);
    }
}
