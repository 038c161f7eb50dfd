package io.github.yok.elliot.core.pipeline;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 1 データセットの処理結果です。成功時は {@link FitResult}、失敗時はエラーの種類とメッセージを持ちます。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DatasetOutcome {

    /**
     * データセット名です。
     */
    String datasetName;

    /**
     * 解析結果です（失敗時は null）。
     */
    FitResult result;

    /**
     * エラーの種類（例外クラスの単純名）です（成功時は null）。
     */
    String errorType;

    /**
     * エラーメッセージです（成功時は null）。
     */
    String errorMessage;

    /**
     * 成功した結果を作ります。
     *
     * @param result 解析結果です
     * @return 処理結果です
     */
    public static DatasetOutcome success(FitResult result) {
        return new DatasetOutcome(result.getDatasetName(), result, null, null);
    }

    /**
     * 失敗した結果を作ります。
     *
     * @param datasetName データセット名です
     * @param error 発生した例外です
     * @return 処理結果です
     */
    public static DatasetOutcome failure(String datasetName, RuntimeException error) {
        return new DatasetOutcome(datasetName, null, error.getClass().getSimpleName(),
                error.getMessage());
    }

    /**
     * 成功したかどうかを返します。
     *
     * @return 成功なら true です
     */
    public boolean isSuccess() {
        return result != null;
    }
}
