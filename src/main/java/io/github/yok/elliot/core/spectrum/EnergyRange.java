package io.github.yok.elliot.core.spectrum;

import lombok.Value;

/**
 * エネルギー軸上の閉区間 [lower, upper]（eV）です。
 *
 * <p>
 * UI 層でクリックから解決された境界エネルギーをそのまま受け取るための値です。 端点の大小は {@link #of(double, double)} で正規化されます。
 * </p>
 */
@Value
public class EnergyRange {

    /**
     * 下端（eV）です。
     */
    double lower;

    /**
     * 上端（eV）です。
     */
    double upper;

    /**
     * 2 つの端点から区間を生成します。端点の順序は問いません。
     *
     * @param a 端点1（eV）です
     * @param b 端点2（eV）です
     * @return 区間です
     * @throws IllegalArgumentException 端点が有限値でない場合に発生します
     */
    public static EnergyRange of(double a, double b) {
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            throw new IllegalArgumentException("区間の端点は有限値が必要です: " + a + ", " + b);
        }
        return (a <= b) ? new EnergyRange(a, b) : new EnergyRange(b, a);
    }

    /**
     * 中心と半幅から区間を生成します。
     *
     * @param center 中心（eV）です
     * @param halfWidth 半幅（eV、0 以上）です
     * @return 区間です
     */
    public static EnergyRange around(double center, double halfWidth) {
        if (!(halfWidth >= 0.0)) {
            throw new IllegalArgumentException("半幅は 0 以上が必要です: " + halfWidth);
        }
        return of(center - halfWidth, center + halfWidth);
    }

    /**
     * 値が区間に含まれるか（両端を含む）を返します。
     *
     * @param energy エネルギー（eV）です
     * @return 含まれる場合は true です
     */
    public boolean contains(double energy) {
        return energy >= lower && energy <= upper;
    }

    /**
     * 区間幅を返します。
     *
     * @return upper - lower です
     */
    public double width() {
        return upper - lower;
    }

    /**
     * 他の区間との共通部分を返します。
     *
     * @param other 他の区間です
     * @return 共通部分です（重ならない場合は null）
     */
    public EnergyRange intersect(EnergyRange other) {
        double lo = Math.max(lower, other.lower);
        double hi = Math.min(upper, other.upper);
        if (lo > hi) {
            return null;
        }
        return new EnergyRange(lo, hi);
    }
}
