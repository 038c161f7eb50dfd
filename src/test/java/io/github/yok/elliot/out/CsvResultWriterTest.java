package io.github.yok.elliot.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.elliot.core.error.InsufficientRangeException;
import io.github.yok.elliot.core.model.FittingParameters;
import io.github.yok.elliot.core.pipeline.AnalysisReport;
import io.github.yok.elliot.core.pipeline.DatasetOutcome;
import io.github.yok.elliot.core.pipeline.FitResult;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path dir;

    private static FitResult result() {
        double[] e = {2.0, 2.5, 3.0};
        return FitResult.builder().datasetName("sample_1")
                .parameters(new FittingParameters(2.62, 0.05, 0.1, 10.0, 0.06, 0.2))
                .ebGroundState(0.078125).deff(2.6).rSquared(0.9995).urbachEnergy(null).sse(1e-6)
                .converged(true).boundaryWarnings(ImmutableSet.of("Eg", "q"))
                .warnings(ImmutableList.of()).energies(e).raw(new double[] {1, 2, 3})
                .baseline(new double[3]).cleaned(new double[] {1, 2, 3})
                .exciton(new double[] {0.5, 1, 1.5}).band(new double[] {0.5, 1, 1.5})
                .total(new double[] {1, 2, 3}).fitRangeLower(2.0).fitRangeUpper(3.0).build();
    }

    @Test
    void write_shouldCreateCurveAndSummaryFiles() throws IOException {
        AnalysisReport report = new AnalysisReport(ImmutableList.of(DatasetOutcome.success(result()),
                DatasetOutcome.failure("sample_2",
                        new InsufficientRangeException("点が足りません", 1, 2))));

        new CsvResultWriter(dir.toString()).write(report, "sample");

        List<String> curve = Files.readAllLines(dir.resolve("elliot_curve_sample_1.csv"),
                StandardCharsets.UTF_8);
        assertEquals(4, curve.size());
        assertEquals("energy_eV,wavelength_nm,raw,baseline,cleaned,exciton,band,total",
                curve.get(0));

        List<String> summary = Files.readAllLines(dir.resolve("elliot_summary_sample.csv"),
                StandardCharsets.UTF_8);
        assertEquals(3, summary.size());
        assertTrue(summary.get(0).startsWith("dataset,Eg_eV,Eb_Rydberg_meV"));
        assertTrue(summary.get(1).startsWith("sample_1,2.62,50.0,78.125,100.0"));
        assertTrue(summary.get(1).contains("Eg;q"));
        assertTrue(summary.get(2).startsWith("sample_2,"));
        assertTrue(summary.get(2).contains("InsufficientRangeException"));
        assertFalse(Files.exists(dir.resolve("elliot_curve_sample_2.csv")));
    }

    @Test
    void write_shouldPersistUrbachLineInSummary() throws IOException {
        FitResult withTail = result().toBuilder().urbachEnergy(0.04).urbachSlope(25.0)
                .urbachIntercept(-60.0).build();
        AnalysisReport report = new AnalysisReport(ImmutableList.of(
                DatasetOutcome.success(withTail), DatasetOutcome.success(result())));

        new CsvResultWriter(dir.toString()).write(report, "urbach");

        List<CSVRecord> rows = readSummary(dir.resolve("elliot_summary_urbach.csv"));
        assertEquals(2, rows.size());
        assertEquals(40.0, Double.parseDouble(rows.get(0).get("Urbach_energy_meV")), 1e-9);
        assertEquals(25.0, Double.parseDouble(rows.get(0).get("Urbach_slope")), 1e-12);
        assertEquals(-60.0, Double.parseDouble(rows.get(0).get("Urbach_intercept")), 1e-12);
        assertEquals("", rows.get(1).get("Urbach_slope"));
        assertEquals("", rows.get(1).get("Urbach_intercept"));
    }

    private static List<CSVRecord> readSummary(Path file) throws IOException {
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                .setSkipHeaderRecord(true).build();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(r)) {
            return parser.getRecords();
        }
    }

    @Test
    void constructor_shouldRequireDirectory() {
        assertThrows(IllegalArgumentException.class, () -> new CsvResultWriter(""));
    }
}
