package com.bpmnnarrator.core.model;

/**
 * Rectangle of a diagram shape (BPMNDI {@code dc:Bounds}).
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 */
public record Bounds(
    double x,
    double y,
    double width,
    double height
) {
    /**
     * Returns the rectangle area.
     *
     * @return width times height
     */
    public double area() {
        return width * height;
    }

    /**
     * Returns the area shared with another rectangle.
     *
     * @param other the other rectangle
     * @return overlapping area, 0 when disjoint
     */
    public double intersectionArea(Bounds other) {
        double xOverlap = Math.max(0, Math.min(x + width, other.x + other.width) - Math.max(x, other.x));
        double yOverlap = Math.max(0, Math.min(y + height, other.y + other.height) - Math.max(y, other.y));
        return xOverlap * yOverlap;
    }

    /**
     * Returns whether the point lies inside or on the border of this rectangle.
     *
     * @param px point x
     * @param py point y
     * @return true if contained
     */
    public boolean contains(double px, double py) {
        return x <= px && px <= x + width && y <= py && py <= y + height;
    }

    /**
     * Returns whether another rectangle lies entirely inside this one.
     *
     * @param other the other rectangle
     * @return true if enclosed, borders included
     */
    public boolean encloses(Bounds other) {
        return contains(other.x, other.y) && contains(other.x + other.width, other.y + other.height);
    }

    /**
     * Returns the x coordinate of the centre.
     *
     * @return centre x
     */
    public double centerX() {
        return x + width / 2;
    }

    /**
     * Returns the y coordinate of the centre.
     *
     * @return centre y
     */
    public double centerY() {
        return y + height / 2;
    }
}
