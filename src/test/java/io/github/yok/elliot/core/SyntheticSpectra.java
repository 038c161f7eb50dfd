package io.github.yok.elliot.core;

import io.github.yok.elliot.core.model.ElliotSpectralModel;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.spectrum.Spectrum;

/**
 * テスト用に Elliot モデルから合成スペクトルを作ります。
 */
public final class SyntheticSpectra {

    /**
     * 合成に用いる真のパラメータです。
     */
    public static final FittingParameters TRUE_PARAMETERS =
            new FittingParameters(2.62, 0.050, 0.100, 10.0, 0.060, 0.2);

    private SyntheticSpectra() {
    }

    /**
     * 等間隔のエネルギー格子を返します。
     *
     * @param from 下端（eV）です
     * @param to 上端（eV）です
     * @param count 点数です
     * @return 格子です
     */
    public static double[] grid(double from, double to, int count) {
        double[] e = new double[count];
        for (int i = 0; i < count; i++) {
            e[i] = from + (to - from) * i / (count - 1);
        }
        return e;
    }

    /**
     * 2.0〜3.2 eV の 121 点で、雑音なしの合成スペクトルを返します。
     *
     * @param parameters パラメータです
     * @return スペクトルです
     */
    public static Spectrum elliot(FittingParameters parameters) {
        double[] e = grid(2.0, 3.2, 121);
        return new Spectrum(e, new ElliotSpectralModel().evaluate(parameters, e));
    }
}
