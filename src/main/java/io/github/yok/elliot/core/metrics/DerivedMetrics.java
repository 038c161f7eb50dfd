package io.github.yok.elliot.core.metrics;

import lombok.Value;

/**
 * フィッティング後に求める派生量です。
 */
@Value
public class DerivedMetrics {

    /**
     * 基底状態の束縛エネルギー Eb/(1-q)^2（eV）です。q が 1 に近い場合は null です。
     */
    Double ebGroundState;

    /**
     * 有効次元 3 - 2q です。
     */
    double deff;

    /**
     * 決定係数です。負の値もそのまま保持します。
     */
    double rSquared;

    /**
     * Urbach 裾です。点が足りない場合は null です。
     */
    UrbachTail urbachTail;

    /**
     * q が 1 に近い場合の注意文です。該当しない場合は null です。
     */
    String qWarning;

    /**
     * Urbach エネルギー（eV）を返します。
     *
     * @return Urbach エネルギーです（求められない場合は null）
     */
    public Double getUrbachEnergy() {
        return urbachTail == null ? null : urbachTail.getEnergy();
    }
}
