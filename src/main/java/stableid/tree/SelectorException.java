package stableid.tree;

import stableid.StableIdException;

/**
 * Thrown by a {@link TreeNode} when a CSS query cannot be parsed or evaluated.
 */
public class SelectorException extends StableIdException {

    private final String selector;

    public SelectorException(String selector, Throwable cause) {
        super("Invalid CSS selector: " + selector, cause);
        this.selector = selector;
    }

    public String getSelector() { return selector; }
}
