package io.github.yok.elliot.core.error;

/**
 * スペクトルのフィッティング処理で発生するエラーの基底クラスです。
 *
 * <p>
 * データセット単位の処理を中断しますが、他のデータセットの処理には影響しません。
 * </p>
 */
public abstract class SpectrumFitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * エラーを生成します。
     *
     * @param message エラーメッセージです
     */
    protected SpectrumFitException(String message) {
        super(message);
    }

    /**
     * 原因付きのエラーを生成します。
     *
     * @param message エラーメッセージです
     * @param cause 原因です
     */
    protected SpectrumFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
