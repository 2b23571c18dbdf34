package org.wehi.stringnet;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.time.StopWatch;

import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Builds a local STRING database from the STRING dump files of one or more species.
 * The database file only appears once every file has been loaded, so an existing file
 * always holds a complete build and is never touched again.
 */
public class StringDatabaseFactory {

    public static final String DEFAULT_VERSION = "11.0";

    private final File databaseFile;
    private final File dataDir;
    private final String version;
    private final StringDownloader downloader;

    /**
     * @param databaseFile the SQLite file to create, e.g. string.db
     * @param dataDir where dump files are looked for and downloaded to
     * @param version STRING release the file names refer to
     * @param downloader fetches the dump files not found in dataDir
     */
    public StringDatabaseFactory(File databaseFile, File dataDir, String version, StringDownloader downloader) {
        this.databaseFile = databaseFile;
        this.dataDir = dataDir;
        this.version = version;
        this.downloader = downloader;
    }

    public StringDatabaseFactory(File databaseFile, File dataDir) {
        this(databaseFile, dataDir, DEFAULT_VERSION, new StringDownloader());
    }

    public File getDatabaseFile() {
        return databaseFile;
    }

    /**
     * Lists the files a build of the given species is made from, links before aliases for every species.
     * @param speciesCodes NCBI taxonomy ids, empty for the all-species files
     */
    public List<SourceFile> sourceFiles(Collection<String> speciesCodes) {
        Collection<String> codes = speciesCodes;
        if (codes == null || codes.isEmpty()) {
            codes = Collections.singletonList("");
        }
        List<SourceFile> sources = new ArrayList<>();
        for (String code : codes) {
            for (StringFile stringFile : StringFile.values()) {
                sources.add(new SourceFile(stringFile.fileName(code.trim(), version), dataDir));
            }
        }
        return sources;
    }

    /**
     * Creates the database unless the database file already exists.
     * Files missing from the data directory are downloaded first.
     * @param speciesCodes NCBI taxonomy ids, empty for all species
     * @return false if the database already existed and nothing was done
     */
    public boolean createDB(Collection<String> speciesCodes) throws IOException, SQLException {
        if (databaseFile.exists()) {
            System.out.println("STRING database " + databaseFile + " already exists, nothing to do.");
            return false;
        }
        System.out.println("Creating STRING database...");
        StopWatch stopwatch = new StopWatch();
        stopwatch.start();

        List<SourceFile> sources = sourceFiles(speciesCodes);
        File partialDatabase = new File(databaseFile.getPath() + ".part");
        FileUtils.deleteQuietly(partialDatabase);
        if (databaseFile.getAbsoluteFile().getParentFile() != null) {
            FileUtils.forceMkdir(databaseFile.getAbsoluteFile().getParentFile());
        }

        boolean complete = false;
        try {
            try (Connection connection = StringDatabase.connect(partialDatabase)) {
                connection.setAutoCommit(false);
                StringSchema.createTables(connection);
                StringFileLoader loader = new StringFileLoader(connection);

                for (SourceFile source : sources) {
                    if (source.getState() == SourceFile.State.ABSENT) {
                        System.out.println("Downloading " + source.getFileName() + " ...");
                        downloader.fetch(source);
                        System.out.println(source.getFileName() + " downloaded.");
                    }
                    loader.load(source.getLocalFile());
                    source.markLoaded();
                }
                StringSchema.createIndices(connection);
                connection.commit();
            }
            FileUtils.moveFile(partialDatabase, databaseFile);
            complete = true;
        } finally {
            if (!complete) {
                FileUtils.deleteQuietly(partialDatabase);
                System.err.println("STRING database build failed, state of the source files: " + sources);
            }
        }

        stopwatch.stop();
        System.out.println("STRING database built successfully! (" + stopwatch + ")");
        return true;
    }
}
