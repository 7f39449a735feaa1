package org.outbreak.runtime.model;

/**
 * A position in the simulation field.
 * @param x The horizontal coordinate.
 * @param y The vertical coordinate.
 */
public record Point(double x, double y) {
}
