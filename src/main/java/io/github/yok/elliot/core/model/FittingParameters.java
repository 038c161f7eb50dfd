package io.github.yok.elliot.core.model;

import java.util.Locale;
import lombok.Value;
import lombok.With;

/**
 * Elliot モデルの 6 パラメータ {Eg, Eb, Gamma, ucvsq, mhcnp, q} を保持する不変クラスです。
 *
 * <p>
 * 生成時には有限値であることのみを検査します。 物理的な範囲（非負、q の上限など）は {@code ParameterBounds} で与えます。
 * </p>
 */
@Value
@With
public class FittingParameters {

    /**
     * パラメータ数です。
     */
    public static final int COUNT = 6;

    /**
     * バンドギャップ Eg（eV）です。
     */
    double eg;

    /**
     * 励起子束縛エネルギー Eb（Rydberg、eV）です。
     */
    double eb;

    /**
     * 線幅 Gamma（eV）です。
     */
    double gamma;

    /**
     * 遷移双極子モーメント二乗の係数 ucvsq です。
     */
    double ucvsq;

    /**
     * バンド連続帯の形状パラメータ mhcnp です。
     */
    double mhcnp;

    /**
     * 分数次元パラメータ q です（0: bulk, 0.5〜0.6: 準2次元, 1.5: 強い閉じ込め）。
     */
    double q;

    /**
     * パラメータを生成します。
     *
     * @param eg バンドギャップ（eV）です
     * @param eb 励起子束縛エネルギー（eV）です
     * @param gamma 線幅（eV）です
     * @param ucvsq 遷移双極子係数です
     * @param mhcnp 形状パラメータです
     * @param q 分数次元パラメータです
     * @throws IllegalArgumentException 有限値でない値が含まれる場合に発生します
     */
    public FittingParameters(double eg, double eb, double gamma, double ucvsq, double mhcnp,
            double q) {
        double[] values = {eg, eb, gamma, ucvsq, mhcnp, q};
        for (FitParameter p : FitParameter.values()) {
            if (!Double.isFinite(values[p.index()])) {
                throw new IllegalArgumentException(
                        p.getLabel() + " は有限値が必要です: " + values[p.index()]);
            }
        }
        this.eg = eg;
        this.eb = eb;
        this.gamma = gamma;
        this.ucvsq = ucvsq;
        this.mhcnp = mhcnp;
        this.q = q;
    }

    /**
     * 既定の初期値（Eg=2.62 eV, Eb=50 meV, Gamma=100 meV, ucvsq=10, mhcnp=0.060, q=0.2）を返します。
     *
     * @return 既定の初期値です
     */
    public static FittingParameters defaults() {
        return new FittingParameters(2.62, 0.050, 0.100, 10.0, 0.060, 0.2);
    }

    /**
     * 配列（Eg, Eb, Gamma, ucvsq, mhcnp, q の順）からパラメータを生成します。
     *
     * @param values 長さ 6 の配列です
     * @return パラメータです
     */
    public static FittingParameters fromArray(double[] values) {
        if (values == null || values.length != COUNT) {
            throw new IllegalArgumentException("パラメータ配列の長さは " + COUNT + " が必要です");
        }
        return new FittingParameters(values[0], values[1], values[2], values[3], values[4],
                values[5]);
    }

    /**
     * パラメータを配列（Eg, Eb, Gamma, ucvsq, mhcnp, q の順）で返します。
     *
     * @return 長さ 6 の新しい配列です
     */
    public double[] toArray() {
        return new double[] {eg, eb, gamma, ucvsq, mhcnp, q};
    }

    /**
     * 指定したパラメータの値を返します。
     *
     * @param parameter パラメータ識別子です
     * @return 値です
     */
    public double get(FitParameter parameter) {
        return toArray()[parameter.index()];
    }

    /**
     * ログ出力用に、元の解析結果表示と同じ単位（Eb, Gamma は meV）で整形します。
     *
     * @return 整形文字列です
     */
    public String describe() {
        return String.format(Locale.ROOT,
                "Eg=%.3f eV, Eb(Rydberg)=%.3f meV, Gamma=%.3f meV, ucvsq=%.3f, mhcnp=%.3f, q=%.3f",
                eg, eb * 1000.0, gamma * 1000.0, ucvsq, mhcnp, q);
    }
}
