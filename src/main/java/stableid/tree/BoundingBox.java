package stableid.tree;

/**
 * Live bounding rectangle of a node, in CSS pixels relative to the viewport.
 */
public record BoundingBox(double x, double y, double width, double height) {

    /** True when the box has no visible area. */
    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox{x=%.1f, y=%.1f, w=%.1f, h=%.1f}", x, y, width, height);
    }
}
