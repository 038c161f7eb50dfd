package io.github.yok.elliot.core.error;

/**
 * 最適化中に目的関数が有限値でなくなった場合など、続行できない数値エラーです。
 *
 * <p>
 * 反復回数の上限到達（未収束）はこのエラーではなく、結果のフラグで表します。
 * </p>
 */
public final class OptimizationException extends SpectrumFitException {

    private static final long serialVersionUID = 1L;

    /**
     * エラーを生成します。
     *
     * @param message エラーメッセージです
     */
    public OptimizationException(String message) {
        super(message);
    }

    /**
     * 原因付きのエラーを生成します。
     *
     * @param message エラーメッセージです
     * @param cause 原因です
     */
    public OptimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
