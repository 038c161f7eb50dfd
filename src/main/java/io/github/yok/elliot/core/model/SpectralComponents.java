package io.github.yok.elliot.core.model;

import lombok.Value;

/**
 * モデル曲線を励起子成分とバンド成分に分けて保持するクラスです。
 *
 * <p>
 * いずれの成分も係数 {@code ucvsq * sqrt(Eb)} を掛けた後の値で、 {@code total = exciton + band} です。
 * </p>
 */
@Value
public class SpectralComponents {

    /**
     * 励起子成分です。
     */
    double[] exciton;

    /**
     * バンド間（連続帯）成分です。
     */
    double[] band;

    /**
     * 合計曲線です。
     */
    double[] total;
}
