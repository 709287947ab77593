package stableid.tree;

import stableid.StableIdException;

/**
 * Thrown by a live-tree adapter when a node can no longer be read,
 * e.g. because the browser element went stale.
 */
public class TreeAccessException extends StableIdException {

    public TreeAccessException(String msg) {
        super(msg);
    }

    public TreeAccessException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
