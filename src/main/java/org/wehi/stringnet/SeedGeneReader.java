package org.wehi.stringnet;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads the seed gene symbols from the .xlsx sheets in a directory.
 * Sheets whose name starts with "output" or "temp" are skipped.
 */
public class SeedGeneReader {

    public static final String DEFAULT_GENE_COLUMN = "Mouse_gene";

    private final File inputPath;
    private final String geneColumn;

    public SeedGeneReader(File inputPath, String geneColumn) {
        this.inputPath = inputPath;
        this.geneColumn = geneColumn;
    }

    public SeedGeneReader(File inputPath) {
        this(inputPath, DEFAULT_GENE_COLUMN);
    }

    /**
     * @return the seed sheets, sorted by file name
     */
    public List<File> findSheets() {
        File[] files = inputPath.listFiles((dir, name) -> name.endsWith(".xlsx")
                && !name.startsWith("output") && !name.startsWith("temp"));
        if (files == null) {
            return Collections.emptyList();
        }
        Arrays.sort(files);
        return Arrays.asList(files);
    }

    /**
     * Gene symbols of the first seed sheet
     * @throws FileNotFoundException if the directory holds no seed sheet
     */
    public List<String> readSeedGenes() throws IOException {
        List<File> sheets = findSheets();
        if (sheets.isEmpty()) {
            throw new FileNotFoundException("No seed gene sheet (*.xlsx) found in " + inputPath);
        }
        if (sheets.size() > 1) {
            System.err.println("Reading genes from " + sheets.get(0).getName() + ", ignoring "
                    + sheets.subList(1, sheets.size()));
        }
        return readGenes(sheets.get(0));
    }

    /**
     * Reads the gene column of the first worksheet. Values are trimmed, empty cells skipped.
     * @throws IllegalArgumentException if the header row has no such column
     */
    public List<String> readGenes(File sheetFile) throws IOException {
        DataFormatter formatter = new DataFormatter();
        List<String> genes = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(sheetFile, null, true)) {
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            int column = -1;
            if (header != null) {
                for (Cell cell : header) {
                    if (formatter.formatCellValue(cell).trim().equals(geneColumn)) {
                        column = cell.getColumnIndex();
                        break;
                    }
                }
            }
            if (column < 0) {
                throw new IllegalArgumentException("Column " + geneColumn + " not found in " + sheetFile);
            }

            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Cell cell = row.getCell(column);
                if (cell == null) {
                    continue;
                }
                String gene = formatter.formatCellValue(cell).trim();
                if (!gene.isEmpty()) {
                    genes.add(gene);
                }
            }
        }
        return genes;
    }
}
