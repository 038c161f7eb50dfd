package io.github.yok.elliot.out;

import io.github.yok.elliot.core.pipeline.AnalysisReport;

/**
 * 解析結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 解析結果を出力します。
     *
     * @param report 全データセットの処理結果です
     * @param runName 出力ファイル名に用いる解析名（通常は入力ファイル名の拡張子を除いた部分）です
     */
    void write(AnalysisReport report, String runName);
}
