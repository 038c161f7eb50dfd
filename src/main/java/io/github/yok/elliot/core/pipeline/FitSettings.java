package io.github.yok.elliot.core.pipeline;

import io.github.yok.elliot.core.baseline.BaselineMode;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.range.ParameterBounds;
import io.github.yok.elliot.core.spectrum.EnergyRange;
import lombok.Builder;
import lombok.Value;

/**
 * 1 回の解析に用いる設定値です。
 *
 * <p>
 * 構成層で作られ、解析の呼び出し時に渡されます。実行中に変更されることはありません。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class FitSettings {

    /**
     * ベースラインの関数形です。
     */
    @Builder.Default
    BaselineMode baselineMode = BaselineMode.NONE;

    /**
     * ベースラインの当てはめ範囲です（NONE の場合は null 可）。
     */
    EnergyRange baselineRange;

    /**
     * フィッティング範囲です（未指定は null、全範囲を使用）。
     */
    EnergyRange fitRange;

    /**
     * バンドギャップ近傍フィッティング（段 2）を行うかどうかです。
     */
    @Builder.Default
    boolean autoRangeEnabled = true;

    /**
     * 予備フィットを行うかどうかです。
     */
    @Builder.Default
    boolean preliminaryEnabled = true;

    /**
     * 直前のデータセットの結果を次の初期値に用いるかどうかです。
     */
    @Builder.Default
    boolean warmStart = false;

    /**
     * 規格化オフセットです。計算には影響しません。
     */
    @Builder.Default
    double deltaE = 0.2;

    /**
     * 利用者指定の初期 Eg（eV）です（未指定は null、自動検出値を使用）。
     */
    Double initialEg;

    /**
     * 初期パラメータです。Eg は初期 Eg の決定結果で置き換えます。
     */
    @Builder.Default
    FittingParameters startPoint = FittingParameters.defaults();

    /**
     * 既定の境界です。Eg は初期 Eg から求めた範囲で置き換えます。
     */
    @Builder.Default
    ParameterBounds bounds = ParameterBounds.defaults();

    /**
     * データセットを並列に処理するスレッド数です（1 以下は逐次）。
     */
    @Builder.Default
    int parallelism = 1;
}
