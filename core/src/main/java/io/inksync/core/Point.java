// file: core/src/main/java/io/inksync/core/Point.java
package io.inksync.core;

/** Canvas coordinate, e.g. a live cursor position. */
public record Point(double x, double y) {

    public double distanceTo(Point other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
