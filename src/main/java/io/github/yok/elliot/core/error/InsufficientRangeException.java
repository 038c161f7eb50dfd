package io.github.yok.elliot.core.error;

import lombok.Getter;

/**
 * ベースライン範囲またはフィッティング範囲に含まれる点数が足りない場合のエラーです。
 *
 * <p>
 * 利用者が範囲を選び直せば解消するため、再試行は行いません。
 * </p>
 */
@Getter
public final class InsufficientRangeException extends SpectrumFitException {

    private static final long serialVersionUID = 1L;

    /**
     * 範囲内の点数です。
     */
    private final int pointCount;

    /**
     * 必要な最小点数です。
     */
    private final int requiredCount;

    /**
     * エラーを生成します。
     *
     * @param message エラーメッセージです
     * @param pointCount 範囲内の点数です
     * @param requiredCount 必要な最小点数です
     */
    public InsufficientRangeException(String message, int pointCount, int requiredCount) {
        super(message + " (点数=" + pointCount + ", 必要数=" + requiredCount + ")");
        this.pointCount = pointCount;
        this.requiredCount = requiredCount;
    }
}
