package stableid;

/**
 * Unchecked base exception for failures raised by tree adapters and codecs.
 *
 * <p>Generation and resolution never let these escape for expected outcomes;
 * the resolver converts them into an error-status result at its boundary.
 */
public class StableIdException extends RuntimeException {

    public StableIdException(String msg) {
        super(msg);
    }

    public StableIdException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
