package org.wehi.stringnet;

import java.io.File;

/**
 * A STRING dump file taking part in a database build, together with how far it got.
 * A file found complete in the data directory starts out FETCHED, anything else starts ABSENT.
 */
public class SourceFile {

    public enum State {
        ABSENT,
        FETCHING,
        FETCHED,
        LOADED
    }

    private final String fileName;
    private final File localFile;
    private State state;

    public SourceFile(String fileName, File dataDir) {
        this.fileName = fileName;
        this.localFile = new File(dataDir, fileName);
        this.state = localFile.isFile() ? State.FETCHED : State.ABSENT;
    }

    public String getFileName() {
        return fileName;
    }

    public File getLocalFile() {
        return localFile;
    }

    /**
     * @return the file a download is written to before it is complete
     */
    public File getPartFile() {
        return new File(localFile.getParentFile(), fileName + ".part");
    }

    public State getState() {
        return state;
    }

    void markFetching() {
        moveTo(State.ABSENT, State.FETCHING);
    }

    void markFetched() {
        moveTo(State.FETCHING, State.FETCHED);
    }

    void markFailed() {
        moveTo(State.FETCHING, State.ABSENT);
    }

    void markLoaded() {
        moveTo(State.FETCHED, State.LOADED);
    }

    private void moveTo(State expected, State next) {
        if (state != expected) {
            throw new IllegalStateException(fileName + " is " + state + ", expected " + expected + " before " + next);
        }
        state = next;
    }

    @Override
    public String toString() {
        return fileName + " [" + state + "]";
    }
}
