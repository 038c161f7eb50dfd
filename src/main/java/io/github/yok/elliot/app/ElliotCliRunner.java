package io.github.yok.elliot.app;

import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.pipeline.AnalysisReport;
import io.github.yok.elliot.core.pipeline.DatasetOrchestrator;
import io.github.yok.elliot.core.pipeline.DatasetOutcome;
import io.github.yok.elliot.core.pipeline.DatasetRequest;
import io.github.yok.elliot.core.pipeline.FitResult;
import io.github.yok.elliot.core.pipeline.FitSettings;
import io.github.yok.elliot.in.SpectrumTableReader;
import io.github.yok.elliot.out.ResultWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で elliot-fitter を実行するクラスです。
 *
 * <p>
 * 入力表の各データセットに Elliot モデルを当てはめ、結果を表示して CSV に出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class ElliotCliRunner implements CommandLineRunner {

    /**
     * elliot-fitter の設定値（elliot.*）です。
     */
    private final ElliotProperties properties;

    /**
     * 解析設定です。
     */
    private final FitSettings settings;

    /**
     * スペクトル表の読み込みロジックです。
     */
    private final SpectrumTableReader reader;

    /**
     * 全データセットの解析ロジックです。
     */
    private final DatasetOrchestrator orchestrator;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== elliot-fitter start: fit absorption spectra ===");
        System.out.print(properties.toMultilineString());

        Path input = Paths.get(properties.getInput().getFile());
        if (!Files.isRegularFile(input)) {
            throw new IllegalStateException("input.file が見つかりません: " + input);
        }

        List<DatasetRequest> datasets = reader.read(input, properties.getInput().getDatasets());
        System.out.println("入力: " + input + "（データセット数=" + datasets.size() + "）");

        AnalysisReport report = orchestrator.analyze(datasets, settings);

        for (DatasetOutcome outcome : report.getOutcomes()) {
            System.out.println("=== " + outcome.getDatasetName() + " ===");
            if (!outcome.isSuccess()) {
                System.out.println("エラー: " + outcome.getErrorType() + ": " + outcome.getErrorMessage());
                continue;
            }
            printResult(outcome.getResult());
        }

        String runName = stemOf(input);
        resultWriter.write(report, runName);
        System.out.println("出力: " + properties.getOutput().getDir() + "（成功=" + report.successCount()
                + ", 失敗=" + report.failureCount() + "）");
    }

    /**
     * 1 データセットの結果を表示します。
     *
     * @param r 解析結果です
     */
    private static void printResult(FitResult r) {
        FittingParameters p = r.getParameters();
        System.out.println("結果: Eg=" + fmt3(p.getEg()) + " eV, Eb (Rydberg)="
                + fmt3(p.getEb() * 1000.0) + " meV, gamma=" + fmt3(p.getGamma() * 1000.0) + " meV");
        System.out.println("結果: ucvsq=" + fmt3(p.getUcvsq()) + ", mhcnp=" + fmt3(p.getMhcnp())
                + ", q=" + fmt3(p.getQ()));
        String ebGs = r.getEbGroundState() == null ? "N/A"
                : fmt3(r.getEbGroundState() * 1000.0) + " meV";
        System.out.println("結果: Eb_GroundState=" + ebGs + ", Deff=" + fmt3(r.getDeff())
                + ", R²=" + fmt5(r.getRSquared()) + ", converged=" + r.isConverged());
        if (r.getUrbachEnergy() != null) {
            System.out.println("結果: Urbach energy=" + fmt3(r.getUrbachEnergy() * 1000.0) + " meV");
        }
        if (!r.getBoundaryWarnings().isEmpty()) {
            System.out.println("警告: 境界に張り付いたパラメータ=" + r.getBoundaryWarnings());
        }
        if (r.getQWarning() != null) {
            System.out.println("警告: " + r.getQWarning());
        }
    }

    private static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String fmt3(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
