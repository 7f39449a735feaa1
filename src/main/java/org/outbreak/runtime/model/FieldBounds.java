package org.outbreak.runtime.model;

/**
 * The rectangular simulation field {@code [0, width] x [0, height]}.
 * Agents are reflected at its borders.
 *
 * @param width The field width in field units.
 * @param height The field height in field units.
 */
public record FieldBounds(double width, double height) {

    /**
     * @return The length of the field diagonal, the largest possible distance between two agents.
     */
    public double diagonal() {
        return Math.hypot(width, height);
    }

    /**
     * Checks whether a point lies inside the field, borders included.
     * @param x The horizontal coordinate.
     * @param y The vertical coordinate.
     * @return true if the point is inside the field.
     */
    public boolean contains(double x, double y) {
        return x >= 0 && x <= width && y >= 0 && y <= height;
    }
}
