package io.github.yok.elliot.in;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.github.yok.elliot.core.pipeline.DatasetRequest;
import io.github.yok.elliot.core.spectrum.EnergyUnits;
import io.github.yok.elliot.core.spectrum.Spectrum;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 多列の吸収スペクトル表を読み込み、列ごとの {@link DatasetRequest} に変換するクラスです。
 *
 * <p>
 * 拡張子が {@code .csv} の場合はカンマ区切り、それ以外は空白区切りとして読みます。 先頭の注釈行・見出し行は、最初の 2 列が数値の行が現れるまで読み飛ばします。
 * 1 列目は波長（nm）またはエネルギー（eV）、2 列目以降がそれぞれ 1 データセットです。
 * </p>
 */
@Slf4j
@Getter
public final class SpectrumTableReader {

    private static final Splitter WHITESPACE =
            Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

    /**
     * 1 列目が波長（nm）かどうかです。false の場合はエネルギー（eV）として扱います。
     */
    private final boolean wavelengthAxis;

    /**
     * 生成します。
     *
     * @param wavelengthAxis 1 列目が波長（nm）なら true です
     */
    public SpectrumTableReader(boolean wavelengthAxis) {
        this.wavelengthAxis = wavelengthAxis;
    }

    /**
     * すべてのデータセットを読み込みます。
     *
     * @param file 入力ファイルです
     * @return データセットです（列順）
     * @throws IllegalStateException 読み込みまたは解釈に失敗した場合に発生します
     */
    public List<DatasetRequest> read(Path file) {
        return read(file, List.of());
    }

    /**
     * 指定したデータセットを読み込みます。
     *
     * @param file 入力ファイルです
     * @param datasetNumbers 1 始まりのデータセット番号です（空の場合はすべて）
     * @return データセットです（指定順）
     * @throws IllegalArgumentException データセット番号が範囲外の場合に発生します
     * @throws IllegalStateException 読み込みまたは解釈に失敗した場合に発生します
     */
    public List<DatasetRequest> read(Path file, List<Integer> datasetNumbers) {
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }
        List<double[]> rows = readRows(file);
        if (rows.isEmpty()) {
            throw new IllegalStateException("数値データ行がありません: " + file);
        }
        int columns = rows.get(0).length;
        if (columns < 2) {
            throw new IllegalStateException("2 列以上（横軸 + データ）が必要です: " + file);
        }
        int datasetCount = columns - 1;

        List<Integer> selected = new ArrayList<>();
        if (datasetNumbers == null || datasetNumbers.isEmpty()) {
            for (int n = 1; n <= datasetCount; n++) {
                selected.add(n);
            }
        } else {
            for (Integer n : datasetNumbers) {
                if (n == null || n < 1 || n > datasetCount) {
                    throw new IllegalArgumentException(
                            "データセット番号は 1〜" + datasetCount + " で指定してください: " + n);
                }
                selected.add(n);
            }
        }

        double[] energies = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            double x = rows.get(i)[0];
            if (wavelengthAxis) {
                if (!(x > 0.0)) {
                    throw new IllegalStateException("波長は正の値が必要です: 行=" + (i + 1) + ", λ=" + x);
                }
                energies[i] = EnergyUnits.wavelengthToEnergy(x);
            } else {
                energies[i] = x;
            }
        }

        String stem = stemOf(file);
        ImmutableList.Builder<DatasetRequest> datasets = ImmutableList.builder();
        for (int n : selected) {
            double[] absorption = new double[rows.size()];
            for (int i = 0; i < rows.size(); i++) {
                absorption[i] = rows.get(i)[n];
            }
            Spectrum spectrum;
            try {
                spectrum = Spectrum.sortedOf(energies, absorption);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("データセット " + n + " を解釈できません: " + file, e);
            }
            datasets.add(new DatasetRequest(stem + "_" + n, spectrum));
        }

        log.info("スペクトル表を読み込みました。ファイル={}、点数={}、データセット数={}", file, rows.size(),
                selected.size());
        return datasets.build();
    }

    /**
     * 数値データ行を読み込みます。
     */
    private static List<double[]> readRows(Path file) {
        boolean csv = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<List<String>> records = csv ? parseCsv(reader) : parseWhitespace(reader);
            return toNumericRows(records, file);
        } catch (IOException e) {
            throw new IllegalStateException("入力ファイルの読み込みに失敗しました: " + file, e);
        }
    }

    private static List<List<String>> parseCsv(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setCommentMarker('#')
                .setIgnoreEmptyLines(true).setTrim(true).build();
        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                records.add(record.toList());
            }
        }
        return records;
    }

    private static List<List<String>> parseWhitespace(BufferedReader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            records.add(WHITESPACE.splitToList(trimmed));
        }
        return records;
    }

    /**
     * 最初の 2 列が数値の行から後を数値行として変換します。
     */
    private static List<double[]> toNumericRows(List<List<String>> records, Path file) {
        List<double[]> rows = new ArrayList<>();
        int columns = -1;
        for (int r = 0; r < records.size(); r++) {
            List<String> record = records.get(r);
            if (columns < 0) {
                if (record.size() < 2 || !isNumeric(record.get(0)) || !isNumeric(record.get(1))) {
                    log.debug("見出し行として読み飛ばします: {}", record);
                    continue;
                }
                columns = record.size();
            }
            if (record.size() < columns) {
                throw new IllegalStateException(
                        "列数が不足しています: " + file + " 行=" + (r + 1) + ", 列数=" + record.size());
            }
            double[] row = new double[columns];
            for (int c = 0; c < columns; c++) {
                try {
                    row[c] = Double.parseDouble(record.get(c));
                } catch (NumberFormatException e) {
                    throw new IllegalStateException("数値として解釈できません: " + file + " 行=" + (r + 1)
                            + ", 値=" + record.get(c), e);
                }
            }
            rows.add(row);
        }
        return rows;
    }

    private static boolean isNumeric(String s) {
        try {
            return Double.isFinite(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
