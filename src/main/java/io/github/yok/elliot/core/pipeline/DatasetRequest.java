package io.github.yok.elliot.core.pipeline;

import io.github.yok.elliot.core.spectrum.Spectrum;
import lombok.Value;

/**
 * 解析対象の 1 データセット（入力表の 1 列）です。
 */
@Value
public class DatasetRequest {

    /**
     * データセット名です。
     */
    String name;

    /**
     * 生スペクトルです。
     */
    Spectrum raw;
}
