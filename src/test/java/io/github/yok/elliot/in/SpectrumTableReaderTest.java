package io.github.yok.elliot.in;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.elliot.core.pipeline.DatasetRequest;
import io.github.yok.elliot.core.spectrum.EnergyUnits;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpectrumTableReaderTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void read_shouldConvertWavelengthAndSortAscendingEnergy() throws IOException {
        Path file = write("sample.csv",
                "# comment\nwavelength,a,b\n400,3.0,30\n500,2.0,20\n600,1.0,10\n");

        List<DatasetRequest> datasets = new SpectrumTableReader(true).read(file);

        assertEquals(2, datasets.size());
        assertEquals("sample_1", datasets.get(0).getName());
        assertEquals("sample_2", datasets.get(1).getName());
        assertEquals(EnergyUnits.wavelengthToEnergy(600.0), datasets.get(0).getRaw().energyAt(0),
                1e-12);
        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, datasets.get(0).getRaw().getAbsorption(),
                0.0);
        assertArrayEquals(new double[] {10.0, 20.0, 30.0},
                datasets.get(1).getRaw().getAbsorption(), 0.0);
    }

    @Test
    void read_shouldSplitWhitespaceTablesAndSelectDatasets() throws IOException {
        Path file = write("sample.txt", "E  a  b  c\n2.0\t0.1  1.1 2.1\n2.1 0.2 1.2 2.2\n\n");

        List<DatasetRequest> datasets = new SpectrumTableReader(false).read(file, List.of(3, 1));

        assertEquals(2, datasets.size());
        assertEquals("sample_3", datasets.get(0).getName());
        assertArrayEquals(new double[] {2.0, 2.1}, datasets.get(0).getRaw().getEnergies(), 0.0);
        assertArrayEquals(new double[] {2.1, 2.2}, datasets.get(0).getRaw().getAbsorption(), 0.0);
        assertArrayEquals(new double[] {0.1, 0.2}, datasets.get(1).getRaw().getAbsorption(), 0.0);
    }

    @Test
    void read_shouldRejectOutOfRangeDatasetNumber() throws IOException {
        Path file = write("sample.csv", "400,1.0\n500,2.0\n");

        assertThrows(IllegalArgumentException.class,
                () -> new SpectrumTableReader(true).read(file, List.of(2)));
    }

    @Test
    void read_shouldRejectNonNumericDataRow() throws IOException {
        Path file = write("sample.csv", "400,1.0\nabc,2.0\n");

        assertThrows(IllegalStateException.class, () -> new SpectrumTableReader(true).read(file));
    }

    @Test
    void read_shouldRejectMissingFile() {
        assertThrows(IllegalStateException.class,
                () -> new SpectrumTableReader(true).read(dir.resolve("missing.csv")));
    }
}
