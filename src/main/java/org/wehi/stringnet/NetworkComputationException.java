package org.wehi.stringnet;

/**
 * Thrown when a network property can not be computed for a graph,
 * e.g. the graph has no nodes or a power iteration does not converge.
 */
public class NetworkComputationException extends RuntimeException {

    public NetworkComputationException(String message) {
        super(message);
    }

    public NetworkComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
