package org.wehi.stringnet;

import java.util.Objects;

/**
 * An ordered pair of protein ids, as stored in pp_links
 */
public final class NodePair {

    private final String first;
    private final String second;

    public NodePair(String first, String second) {
        this.first = Objects.requireNonNull(first);
        this.second = Objects.requireNonNull(second);
    }

    public String getFirst() {
        return first;
    }

    public String getSecond() {
        return second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodePair)) {
            return false;
        }
        NodePair other = (NodePair) o;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first + " " + second;
    }
}
