package io.github.yok.elliot.core.model;

/**
 * パラメータとエネルギー格子から理論吸収スペクトルを合成するモデルのインタフェースです。
 *
 * <p>
 * 実装は決定的で副作用を持たず、各エネルギーの値は他の問い合わせ点に依存しません。
 * </p>
 */
public interface SpectralModel {

    /**
     * 合計吸収曲線を評価します。
     *
     * @param parameters モデルパラメータです
     * @param energies エネルギー（eV）です（順序・重複は任意）
     * @return 各エネルギーでの吸収値です
     */
    default double[] evaluate(FittingParameters parameters, double[] energies) {
        return evaluateComponents(parameters, energies).getTotal();
    }

    /**
     * 励起子成分・バンド成分・合計を評価します。
     *
     * @param parameters モデルパラメータです
     * @param energies エネルギー（eV）です
     * @return 成分ごとの曲線です
     */
    SpectralComponents evaluateComponents(FittingParameters parameters, double[] energies);
}
