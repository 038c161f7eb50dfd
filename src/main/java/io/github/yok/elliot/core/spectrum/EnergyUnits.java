package io.github.yok.elliot.core.spectrum;

/**
 * 波長（nm）と光子エネルギー（eV）の換算を行うユーティリティです。
 */
public final class EnergyUnits {

    /**
     * hc（eV·nm）です。E[eV] = HC_EV_NM / λ[nm] の関係に用います。
     */
    public static final double HC_EV_NM = 1239.84193;

    private EnergyUnits() {}

    /**
     * 波長（nm）をエネルギー（eV）に換算します。
     *
     * @param wavelengthNm 波長（nm、正の値）です
     * @return エネルギー（eV）です
     * @throws IllegalArgumentException 波長が正の有限値でない場合に発生します
     */
    public static double wavelengthToEnergy(double wavelengthNm) {
        if (!(wavelengthNm > 0.0) || !Double.isFinite(wavelengthNm)) {
            throw new IllegalArgumentException("波長は正の有限値が必要です: " + wavelengthNm);
        }
        return HC_EV_NM / wavelengthNm;
    }

    /**
     * エネルギー（eV）を波長（nm）に換算します。
     *
     * @param energyEv エネルギー（eV、正の値）です
     * @return 波長（nm）です
     */
    public static double energyToWavelength(double energyEv) {
        if (!(energyEv > 0.0) || !Double.isFinite(energyEv)) {
            throw new IllegalArgumentException("エネルギーは正の有限値が必要です: " + energyEv);
        }
        return HC_EV_NM / energyEv;
    }
}
