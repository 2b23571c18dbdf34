package org.wehi.stringnet;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringFileLoaderTest {

    private final File ACTUAL_PATH = new File("target/test-actual/StringFileLoaderTest/");

    private Connection connection;
    private StringFileLoader loader;

    @BeforeEach
    void openDatabase() throws SQLException {
        connection = DriverManager.getConnection("jdbc:sqlite::memory:");
        StringSchema.createTables(connection);
        loader = new StringFileLoader(connection);
    }

    @AfterEach
    void closeDatabase() throws SQLException, IOException {
        connection.close();
        FileUtils.deleteDirectory(ACTUAL_PATH);
    }

    private static BufferedReader lines(String... lines) {
        return new BufferedReader(new StringReader(String.join("\n", lines) + "\n"));
    }

    private List<String> rows(String sql) throws SQLException {
        List<String> rows = new ArrayList<>();
        try (Statement stmt = connection.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            int columns = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                StringBuilder row = new StringBuilder();
                for (int i = 1; i <= columns; i++) {
                    row.append(i > 1 ? "|" : "").append(rs.getString(i));
                }
                rows.add(row.toString());
            }
        }
        return rows;
    }

    @Test
    void interactionLineYieldsLinkAndBothProteins() throws IOException, SQLException {
        int loaded = loader.load(lines(StringTestFiles.LINKS_HEADER,
                "9606.P1 9606.P2 0 0 0 0 0 0 0 550"), "links");

        assertEquals(1, loaded);
        assertEquals(List.of("P1|P2|550"), rows("SELECT * FROM pp_links"));
        assertEquals(List.of("P1|9606", "P2|9606"), rows("SELECT * FROM proteins ORDER BY ensembl_id"));
    }

    @Test
    void proteinsAreAddedOnce() throws IOException, SQLException {
        loader.load(lines(StringTestFiles.LINKS_HEADER,
                StringTestFiles.link("9606.P1", "9606.P2", 550),
                StringTestFiles.link("9606.P2", "9606.P1", 550),
                StringTestFiles.link("9606.P1", "9606.P3", 150)), "links");

        assertEquals(List.of("3"), rows("SELECT COUNT(*) FROM pp_links"));
        assertEquals(List.of("P1|9606", "P2|9606", "P3|9606"), rows("SELECT * FROM proteins ORDER BY ensembl_id"));
    }

    @Test
    void aliasLineYieldsAliasRow() throws IOException, SQLException {
        int loaded = loader.load(lines(StringTestFiles.ALIASES_HEADER,
                "9606.P1\talphaSymbol\tsourceX"), "aliases");

        assertEquals(1, loaded);
        assertEquals(List.of("P1|alphaSymbol|sourceX"), rows("SELECT * FROM p_aliases"));
        assertEquals(List.of("0"), rows("SELECT COUNT(*) FROM proteins"));
    }

    @Test
    void aliasesMaySpanSeveralTabsAndContainSpaces() throws IOException, SQLException {
        loader.load(lines(StringTestFiles.ALIASES_HEADER,
                "9606.P1\t\tphosphatase and tensin homolog\t\tUniProt_DE_RecName"), "aliases");

        assertEquals(List.of("P1|phosphatase and tensin homolog|UniProt_DE_RecName"), rows("SELECT * FROM p_aliases"));
    }

    @Test
    void sameAliasFromTwoSourcesIsKeptTwice() throws IOException, SQLException {
        loader.load(lines(StringTestFiles.ALIASES_HEADER,
                StringTestFiles.alias("9606.P1", "PTEN", "Ensembl_EntrezGene"),
                StringTestFiles.alias("9606.P1", "PTEN", "BioMart_HUGO")), "aliases");

        assertEquals(List.of("2"), rows("SELECT COUNT(*) FROM p_aliases"));
    }

    @Test
    void wrongColumnCountFails() {
        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> loader.load(lines(StringTestFiles.LINKS_HEADER,
                        StringTestFiles.link("9606.P1", "9606.P2", 550),
                        "9606.P1 9606.P3 550"), "links"));
        assertEquals(3, e.getLineNumber());
        assertEquals("links", e.getSource());
    }

    @Test
    void nonIntegerScoreFails() {
        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> loader.load(lines(StringTestFiles.LINKS_HEADER,
                        "9606.P1 9606.P2 0 0 0 0 0 0 0 high"), "links"));
        assertEquals(2, e.getLineNumber());
        assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @Test
    void identifierWithoutSpeciesFails() {
        assertThrows(MalformedRecordException.class,
                () -> loader.load(lines(StringTestFiles.ALIASES_HEADER,
                        StringTestFiles.alias("P1", "PTEN", "BioMart_HUGO")), "aliases"));
        assertThrows(MalformedRecordException.class,
                () -> loader.load(lines(StringTestFiles.LINKS_HEADER,
                        StringTestFiles.link("9606.P1.1", "9606.P2", 550)), "links"));
    }

    @Test
    void unknownHeaderFails() {
        assertThrows(UnrecognisedFormatException.class,
                () -> loader.load(lines("gene_id symbol", "1 PTEN"), "genes"));
    }

    @Test
    void emptyFileFails() {
        assertThrows(UnrecognisedFormatException.class,
                () -> loader.load(new BufferedReader(new StringReader("")), "empty"));
    }

    @Test
    void loadsGzipFiles() throws IOException, SQLException {
        StringTestFiles.writeMouseFiles(ACTUAL_PATH);

        loader.load(new File(ACTUAL_PATH, "10090.protein.links.detailed.v11.0.txt.gz"));
        loader.load(new File(ACTUAL_PATH, "10090.protein.aliases.v11.0.txt.gz"));

        assertEquals(List.of("10"), rows("SELECT COUNT(*) FROM pp_links"));
        assertEquals(List.of("5"), rows("SELECT COUNT(*) FROM proteins"));
        assertEquals(List.of("6"), rows("SELECT COUNT(*) FROM p_aliases"));
        assertEquals(List.of("C|E|950"), rows("SELECT * FROM pp_links WHERE ensembl_id_1 = 'C' AND ensembl_id_2 = 'E'"));
    }

    @Test
    void splitIdentifierSeparatesSpecies() throws MalformedRecordException {
        assertArrayEquals(new String[]{"10090", "ENSMUSP00000000001"},
                StringFileLoader.splitIdentifier("10090.ENSMUSP00000000001", "links", 2));
    }
}
