package io.github.yok.elliot.core.pipeline;

import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * 全データセットの処理結果（入力順）です。
 */
@Value
public class AnalysisReport {

    /**
     * 処理結果です。
     */
    ImmutableList<DatasetOutcome> outcomes;

    /**
     * 成功したデータセット数を返します。
     *
     * @return 件数です
     */
    public int successCount() {
        return (int) outcomes.stream().filter(DatasetOutcome::isSuccess).count();
    }

    /**
     * 失敗したデータセット数を返します。
     *
     * @return 件数です
     */
    public int failureCount() {
        return outcomes.size() - successCount();
    }

    /**
     * 成功した結果だけを返します。
     *
     * @return 解析結果です
     */
    public ImmutableList<FitResult> successfulResults() {
        return outcomes.stream().filter(DatasetOutcome::isSuccess).map(DatasetOutcome::getResult)
                .collect(ImmutableList.toImmutableList());
    }
}
