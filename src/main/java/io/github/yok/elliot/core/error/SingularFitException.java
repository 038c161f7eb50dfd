package io.github.yok.elliot.core.error;

/**
 * 最小二乗問題が退化している（範囲内のエネルギーに広がりがない等）場合のエラーです。
 */
public final class SingularFitException extends SpectrumFitException {

    private static final long serialVersionUID = 1L;

    /**
     * エラーを生成します。
     *
     * @param message エラーメッセージです
     */
    public SingularFitException(String message) {
        super(message);
    }
}
