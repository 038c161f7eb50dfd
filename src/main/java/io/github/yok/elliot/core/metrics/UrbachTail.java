package io.github.yok.elliot.core.metrics;

import lombok.Value;

/**
 * バンドギャップ以下の吸収裾に当てはめた直線 ln(α) = slope·E + intercept です。
 */
@Value
public class UrbachTail {

    /**
     * 傾き（1/eV）です。
     */
    double slope;

    /**
     * 切片です。
     */
    double intercept;

    /**
     * 当てはめに使った点数です。
     */
    int pointCount;

    /**
     * Urbach エネルギー 1/slope（eV）を返します。
     *
     * @return Urbach エネルギーです
     */
    public double getEnergy() {
        return 1.0 / slope;
    }

    /**
     * 直線上の ln(α) を返します。
     *
     * @param energy エネルギー（eV）です
     * @return ln(α) です
     */
    public double lineAt(double energy) {
        return slope * energy + intercept;
    }
}
