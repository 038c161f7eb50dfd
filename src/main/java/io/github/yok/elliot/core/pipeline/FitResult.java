package io.github.yok.elliot.core.pipeline;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.elliot.core.model.FittingParameters;
import lombok.Builder;
import lombok.Value;

/**
 * 1 データセットの解析結果です。
 *
 * <p>
 * 曲線はすべて元のエネルギー軸（昇順）上の値です。生成後に変更しません。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class FitResult {

    /**
     * データセット名です。
     */
    String datasetName;

    /**
     * フィッティング後のパラメータです。
     */
    FittingParameters parameters;

    /**
     * 基底状態の束縛エネルギー（eV）です。q が 1 に近い場合は null です。
     */
    Double ebGroundState;

    /**
     * 有効次元です。
     */
    double deff;

    /**
     * 決定係数です。
     */
    double rSquared;

    /**
     * Urbach エネルギー（eV）です。求められない場合は null です。
     */
    Double urbachEnergy;

    /**
     * Urbach 裾の傾き（1/eV）です。
     */
    Double urbachSlope;

    /**
     * Urbach 裾の切片です。
     */
    Double urbachIntercept;

    /**
     * 最終段の二乗誤差和です。
     */
    double sse;

    /**
     * 最終段が収束したかどうかです。
     */
    boolean converged;

    /**
     * 境界に張り付いたパラメータ名です。
     */
    ImmutableSet<String> boundaryWarnings;

    /**
     * q が 1 に近い場合の注意文です。
     */
    String qWarning;

    /**
     * その他の注意事項です。
     */
    ImmutableList<String> warnings;

    /**
     * エネルギー（eV）です。
     */
    double[] energies;

    /**
     * 生の吸収値です。
     */
    double[] raw;

    /**
     * ベースラインです。
     */
    double[] baseline;

    /**
     * ベースライン除去後の吸収値です。
     */
    double[] cleaned;

    /**
     * 励起子成分です。
     */
    double[] exciton;

    /**
     * バンド間成分です。
     */
    double[] band;

    /**
     * 合計です。
     */
    double[] total;

    /**
     * 最終段のフィッティング範囲の下端（eV）です。
     */
    double fitRangeLower;

    /**
     * 最終段のフィッティング範囲の上端（eV）です。
     */
    double fitRangeUpper;
}
