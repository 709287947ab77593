package stableid.codec;

import stableid.StableIdException;

/**
 * Malformed transport encoding. {@link #getPosition()} is the 0-based offset
 * in the input where parsing stopped.
 */
public class EidSyntaxException extends StableIdException {

    private final String input;
    private final int position;

    public EidSyntaxException(String message, String input, int position) {
        super(message + " at position " + position + " in \"" + input + "\"");
        this.input = input;
        this.position = position;
    }

    public String getInput() { return input; }

    public int getPosition() { return position; }
}
