package io.github.yok.elliot.core.baseline;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * ベースラインの関数形（fitmode）を表す列挙です。
 */
@Getter
@RequiredArgsConstructor
public enum BaselineMode {

    /** ベースラインなし（0 関数）です。fitmode=0 に対応します。 */
    NONE(0, "No baseline"),

    /** 1次式 a·E + b です。fitmode=1 に対応します。 */
    LINEAR(1, "Linear"),

    /** 原点を通る c·E^4（ナノ粒子による Rayleigh 散乱）です。fitmode=2 に対応します。 */
    RAYLEIGH(2, "Rayleigh scattering (E^4)");

    /**
     * 設定値 fitmode の数値です。
     */
    private final int fitmode;

    /**
     * 表示名です。
     */
    private final String displayName;

    /**
     * fitmode の数値から列挙値を返します。
     *
     * @param fitmode 0, 1, 2 のいずれかです
     * @return 対応する列挙値です
     * @throws IllegalArgumentException 未対応の fitmode の場合に発生します
     */
    public static BaselineMode fromFitmode(int fitmode) {
        for (BaselineMode mode : values()) {
            if (mode.fitmode == fitmode) {
                return mode;
            }
        }
        throw new IllegalArgumentException("fitmode は 0, 1, 2 のいずれかを指定してください: " + fitmode);
    }
}
