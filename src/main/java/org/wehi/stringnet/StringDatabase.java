package org.wehi.stringnet;

import java.io.File;
import java.io.FileNotFoundException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * An open connection to a STRING database previously built by StringDatabaseFactory
 */
public class StringDatabase implements AutoCloseable {

    private final File databaseFile;
    private final Connection connection;

    public StringDatabase(File databaseFile) throws FileNotFoundException, SQLException {
        if (!databaseFile.isFile()) {
            throw new FileNotFoundException("STRING database not found: " + databaseFile
                    + " (run mode CreateDB first)");
        }
        this.databaseFile = databaseFile;
        this.connection = connect(databaseFile);
    }

    /**
     * Opens a SQLite connection, creating the file if it does not exist
     */
    static Connection connect(File databaseFile) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + databaseFile.getPath());
    }

    public File getDatabaseFile() {
        return databaseFile;
    }

    public Connection getConnection() {
        return connection;
    }

    public long countRows(String table) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * Prints the number of rows in each table
     */
    public void printSummary() throws SQLException {
        System.out.println("STRING database: " + databaseFile);
        for (String table : new String[]{StringSchema.PROTEINS, StringSchema.LINKS, StringSchema.ALIASES}) {
            System.out.println(String.format("%-10s %,d rows", table, countRows(table)));
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
