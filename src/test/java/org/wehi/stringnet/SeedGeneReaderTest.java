package org.wehi.stringnet;

import org.apache.commons.io.FileUtils;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeedGeneReaderTest {

    private final File ACTUAL_PATH = new File("target/test-actual/SeedGeneReaderTest/");

    @AfterEach
    void cleanUp() throws IOException {
        FileUtils.deleteDirectory(ACTUAL_PATH);
    }

    /**
     * Writes a sheet whose first row holds the column names
     */
    static File writeSheet(File file, String[] header, String[]... rows) throws IOException {
        FileUtils.forceMkdirParent(file);
        try (XSSFWorkbook workbook = new XSSFWorkbook(); OutputStream out = FileUtils.openOutputStream(file)) {
            Sheet sheet = workbook.createSheet("genes");
            Row headerRow = sheet.createRow(0);
            for (int c = 0; c < header.length; c++) {
                headerRow.createCell(c).setCellValue(header[c]);
            }
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r + 1);
                for (int c = 0; c < rows[r].length; c++) {
                    if (rows[r][c] != null) {
                        row.createCell(c).setCellValue(rows[r][c]);
                    }
                }
            }
            workbook.write(out);
        }
        return file;
    }

    @Test
    void readsGeneColumn() throws IOException {
        writeSheet(new File(ACTUAL_PATH, "seeds.xlsx"),
                new String[]{"Protein", "Mouse_gene", "Fold_change"},
                new String[]{"P1", " Pten ", "2.1"},
                new String[]{"P2", null, "1.5"},
                new String[]{"P3", "Akt1", "0.4"},
                new String[]{"P4", "", "0.9"});

        List<String> genes = new SeedGeneReader(ACTUAL_PATH).readSeedGenes();
        assertEquals(Arrays.asList("Pten", "Akt1"), genes);
    }

    @Test
    void readsNamedColumn() throws IOException {
        File sheet = writeSheet(new File(ACTUAL_PATH, "seeds.xlsx"),
                new String[]{"Human_gene"},
                new String[]{"PTEN"});
        assertEquals(Arrays.asList("PTEN"), new SeedGeneReader(ACTUAL_PATH, "Human_gene").readGenes(sheet));
    }

    @Test
    void missingColumnIsReported() throws IOException {
        File sheet = writeSheet(new File(ACTUAL_PATH, "seeds.xlsx"),
                new String[]{"Gene"},
                new String[]{"Pten"});
        assertThrows(IllegalArgumentException.class, () -> new SeedGeneReader(ACTUAL_PATH).readGenes(sheet));
    }

    @Test
    void outputAndTempSheetsAreSkipped() throws IOException {
        String[] header = {"Mouse_gene"};
        writeSheet(new File(ACTUAL_PATH, "output-results.xlsx"), header, new String[]{"Mtor"});
        writeSheet(new File(ACTUAL_PATH, "temp.xlsx"), header, new String[]{"Mdm2"});
        writeSheet(new File(ACTUAL_PATH, "b-seeds.xlsx"), header, new String[]{"Tp53"});
        writeSheet(new File(ACTUAL_PATH, "a-seeds.xlsx"), header, new String[]{"Pten"});
        FileUtils.writeStringToFile(new File(ACTUAL_PATH, "notes.txt"), "Akt1", "UTF-8");

        SeedGeneReader reader = new SeedGeneReader(ACTUAL_PATH);
        assertEquals(Arrays.asList(new File(ACTUAL_PATH, "a-seeds.xlsx"), new File(ACTUAL_PATH, "b-seeds.xlsx")),
                reader.findSheets());
        assertEquals(Arrays.asList("Pten"), reader.readSeedGenes());
    }

    @Test
    void noSheetIsReported() throws IOException {
        FileUtils.forceMkdir(ACTUAL_PATH);
        assertThrows(FileNotFoundException.class, () -> new SeedGeneReader(ACTUAL_PATH).readSeedGenes());
        assertThrows(FileNotFoundException.class,
                () -> new SeedGeneReader(new File(ACTUAL_PATH, "missing")).readSeedGenes());
    }
}
