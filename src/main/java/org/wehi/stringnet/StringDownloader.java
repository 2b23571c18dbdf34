package org.wehi.stringnet;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLConnection;
import java.util.Arrays;

/**
 * Fetches STRING dump files from the STRING download server.
 * Species specific files live in a sub directory named after the file without its species prefix
 * and extension, e.g. protein.links.detailed.v11.0/10090.protein.links.detailed.v11.0.txt.gz
 */
public class StringDownloader {

    public static final String DEFAULT_BASE_URL = "https://stringdb-static.org/download/";
    private static final String USER_AGENT = "Mozilla/5.0";
    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Called after every chunk written. totalBytes is -1 when the server did not send a length.
     */
    public interface ProgressListener {
        void progress(String fileName, long bytesRead, long totalBytes);
    }

    private final String baseUrl;
    private final ProgressListener listener;

    public StringDownloader(String baseUrl, ProgressListener listener) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.listener = listener;
    }

    public StringDownloader(String baseUrl) {
        this(baseUrl, new ConsoleProgress());
    }

    public StringDownloader() {
        this(DEFAULT_BASE_URL);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @param fileName e.g. 10090.protein.aliases.v11.0.txt.gz or protein.aliases.v11.0.txt.gz
     */
    public URL resolveUrl(String fileName) throws MalformedURLException {
        String[] parts = fileName.split("\\.");
        String subPath = "";
        if (parts.length > 3 && !parts[0].isEmpty() && StringUtils.isNumeric(parts[0])) {
            subPath = StringUtils.join(Arrays.copyOfRange(parts, 1, parts.length - 2), ".") + "/";
        }
        return new URL(baseUrl + subPath + fileName);
    }

    /**
     * Downloads an ABSENT source file into its local location.
     * Bytes go to the part file first, which is moved into place only once the transfer is complete.
     * @throws DownloadException if the server refuses the file or the transfer breaks off
     */
    public void fetch(SourceFile source) throws IOException {
        URL url = resolveUrl(source.getFileName());
        FileUtils.deleteQuietly(source.getPartFile());
        source.markFetching();

        try {
            URLConnection connection = url.openConnection();
            connection.setRequestProperty("User-Agent", USER_AGENT);
            if (connection instanceof HttpURLConnection) {
                int status = ((HttpURLConnection) connection).getResponseCode();
                if (status != HttpURLConnection.HTTP_OK) {
                    throw new DownloadException(url, "server answered with status " + status);
                }
            }
            long totalBytes = connection.getContentLengthLong();
            long bytesRead = 0;

            try (InputStream in = connection.getInputStream();
                 OutputStream out = FileUtils.openOutputStream(source.getPartFile())) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int n;
                while ((n = in.read(buffer)) != -1) {
                    out.write(buffer, 0, n);
                    bytesRead += n;
                    listener.progress(source.getFileName(), bytesRead, totalBytes);
                }
            }
            if (totalBytes >= 0 && bytesRead != totalBytes) {
                throw new DownloadException(url, "received " + bytesRead + " of " + totalBytes + " bytes");
            }
            FileUtils.moveFile(source.getPartFile(), source.getLocalFile());
        } catch (DownloadException e) {
            abandon(source);
            throw e;
        } catch (IOException e) {
            abandon(source);
            throw new DownloadException(url, e);
        }
        source.markFetched();
    }

    private static void abandon(SourceFile source) {
        FileUtils.deleteQuietly(source.getPartFile());
        source.markFailed();
    }

    /**
     * Prints the percentage fetched, overwriting the same console line
     */
    public static class ConsoleProgress implements ProgressListener {

        private int lastPercent = -1;

        @Override
        public void progress(String fileName, long bytesRead, long totalBytes) {
            if (totalBytes <= 0) {
                System.out.print("\rDownload progress: " + FileUtils.byteCountToDisplaySize(bytesRead));
                return;
            }
            int percent = (int) (bytesRead * 100 / totalBytes);
            if (percent != lastPercent) {
                lastPercent = percent;
                System.out.print("\rDownload progress: " + percent + "%");
            }
            if (bytesRead >= totalBytes) {
                lastPercent = -1;
                System.out.println();
            }
        }
    }
}
