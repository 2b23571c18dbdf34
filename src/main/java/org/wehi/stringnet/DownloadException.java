package org.wehi.stringnet;

import java.io.IOException;
import java.net.URL;

/**
 * Thrown when a STRING file could not be fetched completely
 */
public class DownloadException extends IOException {

    private final URL url;

    public DownloadException(URL url, String message) {
        super("Could not download " + url + ": " + message);
        this.url = url;
    }

    public DownloadException(URL url, Throwable cause) {
        super("Could not download " + url + ": " + cause.getMessage(), cause);
        this.url = url;
    }

    public URL getUrl() {
        return url;
    }
}
