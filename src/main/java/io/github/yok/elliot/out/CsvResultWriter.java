package io.github.yok.elliot.out;

import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.pipeline.AnalysisReport;
import io.github.yok.elliot.core.pipeline.DatasetOutcome;
import io.github.yok.elliot.core.pipeline.FitResult;
import io.github.yok.elliot.core.spectrum.EnergyUnits;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 解析結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います。
 * </p>
 *
 * <ul>
 * <li>{@code elliot_curve_<データセット名>.csv}（エネルギー軸上の各曲線、成功したデータセットのみ）</li>
 * <li>{@code elliot_summary_<解析名>.csv}（データセットごとに 1 行、失敗したデータセットはエラー列のみ）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "elliot";

    private static final String[] CURVE_HEADER = {"energy_eV", "wavelength_nm", "raw", "baseline",
            "cleaned", "exciton", "band", "total"};

    private static final String[] SUMMARY_HEADER = {"dataset", "Eg_eV", "Eb_Rydberg_meV",
            "Eb_GroundState_meV", "Gamma_meV", "ucvsq", "mhcnp", "q", "Deff", "R2",
            "Urbach_energy_meV", "Urbach_slope", "Urbach_intercept", "SSE", "fit_range_lower_eV",
            "fit_range_upper_eV", "converged", "boundary_warnings", "q_warning", "warnings",
            "error"};

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 解析結果を出力します。
     *
     * @param report 全データセットの処理結果です
     * @param runName 解析名です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(AnalysisReport report, String runName) {
        if (report == null) {
            throw new IllegalArgumentException("report は null 不可です");
        }
        if (runName == null || runName.isEmpty()) {
            throw new IllegalArgumentException("runName は必須です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) データセットごとの曲線
            for (FitResult result : report.successfulResults()) {
                writeCurveCsv(result);
            }

            // 2) 要約
            writeSummaryCsv(report, runName);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * エネルギー軸上の各曲線を出力します。
     *
     * @param result 解析結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeCurveCsv(FitResult result) throws IOException {
        Path file = outputDir.resolve(buildFileName("curve", result.getDatasetName()));

        double[] e = result.getEnergies();
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(CURVE_HEADER).build().print(w)) {

            for (int i = 0; i < e.length; i++) {
                pr.printRecord(e[i], EnergyUnits.energyToWavelength(e[i]), result.getRaw()[i],
                        result.getBaseline()[i], result.getCleaned()[i], result.getExciton()[i],
                        result.getBand()[i], result.getTotal()[i]);
            }
        }
    }

    /**
     * 要約を出力します。Eb, Gamma, Urbach エネルギーは meV、Urbach 直線の傾きは 1/eV で出力します。
     *
     * @param report 全データセットの処理結果です
     * @param runName 解析名です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSummaryCsv(AnalysisReport report, String runName) throws IOException {
        Path file = outputDir.resolve(buildFileName("summary", runName));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(SUMMARY_HEADER).build().print(w)) {

            for (DatasetOutcome outcome : report.getOutcomes()) {
                if (!outcome.isSuccess()) {
                    Object[] row = new Object[SUMMARY_HEADER.length];
                    row[0] = outcome.getDatasetName();
                    row[row.length - 1] = outcome.getErrorType() + ": " + outcome.getErrorMessage();
                    pr.printRecord(row);
                    continue;
                }
                FitResult r = outcome.getResult();
                FittingParameters p = r.getParameters();
                pr.printRecord(r.getDatasetName(), p.getEg(), p.getEb() * 1000.0,
                        toMilli(r.getEbGroundState()), p.getGamma() * 1000.0, p.getUcvsq(),
                        p.getMhcnp(), p.getQ(), r.getDeff(), r.getRSquared(),
                        toMilli(r.getUrbachEnergy()), r.getUrbachSlope(), r.getUrbachIntercept(),
                        r.getSse(), r.getFitRangeLower(),
                        r.getFitRangeUpper(), r.isConverged(),
                        String.join(";", r.getBoundaryWarnings()), r.getQWarning(),
                        String.join(";", r.getWarnings()), null);
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * @param kind 種類（curve/summary）です
     * @param name データセット名または解析名です
     * @return ファイル名です
     */
    private static String buildFileName(String kind, String name) {
        return FILE_HEAD + "_" + kind + "_" + sanitize(name) + ".csv";
    }

    /**
     * ファイル名に使えない文字を {@code _} に置き換えます。
     */
    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._=-]", "_");
    }

    private static Double toMilli(Double v) {
        return v == null ? null : v * 1000.0;
    }
}
