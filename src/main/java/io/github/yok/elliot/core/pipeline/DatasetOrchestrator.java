package io.github.yok.elliot.core.pipeline;

import com.google.common.collect.ImmutableList;
import io.github.yok.elliot.core.error.SpectrumFitException;
import io.github.yok.elliot.core.model.FittingParameters;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 複数のデータセットをそれぞれ独立に解析し、結果を入力順にまとめるクラスです。
 *
 * <p>
 * あるデータセットの失敗は、そのデータセットの結果として記録し、他のデータセットの処理は続けます。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class DatasetOrchestrator {

    private final DatasetFitPipeline pipeline;

    /**
     * すべてのデータセットを解析します。
     *
     * @param datasets データセットです
     * @param settings 設定値です
     * @return 処理結果です（入力順）
     */
    public AnalysisReport analyze(List<DatasetRequest> datasets, FitSettings settings) {
        if (datasets == null || settings == null) {
            throw new IllegalArgumentException("datasets/settings は null 不可です");
        }
        ImmutableList<DatasetOutcome> outcomes;
        if (settings.getParallelism() > 1 && datasets.size() > 1) {
            if (settings.isWarmStart()) {
                log.warn("並列実行では warm-start を使用しません。");
            }
            outcomes = analyzeInParallel(datasets, settings);
        } else {
            outcomes = analyzeSequentially(datasets, settings);
        }
        AnalysisReport report = new AnalysisReport(outcomes);
        log.info("全データセットの解析が終了しました。成功={}、失敗={}", report.successCount(),
                report.failureCount());
        return report;
    }

    private ImmutableList<DatasetOutcome> analyzeSequentially(List<DatasetRequest> datasets,
            FitSettings settings) {
        ImmutableList.Builder<DatasetOutcome> outcomes = ImmutableList.builder();
        FittingParameters previous = null;
        for (DatasetRequest request : datasets) {
            DatasetOutcome outcome =
                    analyzeOne(request, settings, settings.isWarmStart() ? previous : null);
            if (outcome.isSuccess()) {
                previous = outcome.getResult().getParameters();
            }
            outcomes.add(outcome);
        }
        return outcomes.build();
    }

    private ImmutableList<DatasetOutcome> analyzeInParallel(List<DatasetRequest> datasets,
            FitSettings settings) {
        ExecutorService executor = Executors.newFixedThreadPool(settings.getParallelism());
        try {
            List<Future<DatasetOutcome>> futures = new ArrayList<>(datasets.size());
            for (DatasetRequest request : datasets) {
                futures.add(executor.submit(() -> analyzeOne(request, settings, null)));
            }
            ImmutableList.Builder<DatasetOutcome> outcomes = ImmutableList.builder();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), datasets.get(i)));
            }
            return outcomes.build();
        } finally {
            executor.shutdownNow();
        }
    }

    private static DatasetOutcome await(Future<DatasetOutcome> future, DatasetRequest request) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("解析の待機中に割り込まれました: " + request.getName(), e);
        } catch (ExecutionException e) {
            // analyzeOne が捕捉しない例外（プログラム誤り）はそのまま伝播します。
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("解析に失敗しました: " + request.getName(), cause);
        }
    }

    /**
     * 1 データセットを解析し、失敗を処理結果に変換します。
     */
    private DatasetOutcome analyzeOne(DatasetRequest request, FitSettings settings,
            FittingParameters warmStart) {
        String name = request == null ? null : request.getName();
        try {
            return DatasetOutcome.success(pipeline.fit(request, settings, warmStart));
        } catch (SpectrumFitException | IllegalArgumentException e) {
            log.error("データセット {} の解析に失敗しました: {}", name, e.getMessage());
            return DatasetOutcome.failure(name, e);
        }
    }
}
