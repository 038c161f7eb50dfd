package io.github.yok.elliot.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Elliot モデルの 6 パラメータを識別する列挙です。
 *
 * <p>
 * 宣言順は {@link FittingParameters#toArray()} の並び（Eg, Eb, Gamma, ucvsq, mhcnp, q）と一致します。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum FitParameter {

    /** バンドギャップ（eV）です。 */
    EG("Eg"),

    /** 励起子束縛エネルギー（Rydberg、eV）です。 */
    EB("Eb"),

    /** 線幅（eV）です。 */
    GAMMA("Gamma"),

    /** 遷移双極子モーメントの二乗に比例する係数です。 */
    UCVSQ("ucvsq"),

    /** バンド連続帯の形状（有効質量）パラメータです。 */
    MHCNP("mhcnp"),

    /** 分数次元パラメータです。 */
    Q("q");

    /**
     * 表示名（警告や CSV で用いる名前）です。
     */
    private final String label;

    /**
     * パラメータ配列内の位置を返します。
     *
     * @return インデックスです
     */
    public int index() {
        return ordinal();
    }
}
