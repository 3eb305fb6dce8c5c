// file: core/src/main/java/io/inksync/core/Bounds.java
package io.inksync.core;

/**
 * Axis-aligned bounding box of an element on the canvas.
 * <p>
 * Width and height are not validated here; the transform engine rejects
 * operations carrying negative or non-finite geometry.
 */
public record Bounds(double x, double y, double width, double height) {

    public double right() { return x + width; }

    public double bottom() { return y + height; }

    public double area() { return Math.max(0.0, width) * Math.max(0.0, height); }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(width) && Double.isFinite(height);
    }

    public double intersectionArea(Bounds other) {
        double w = Math.min(right(), other.right()) - Math.max(x, other.x);
        double h = Math.min(bottom(), other.bottom()) - Math.max(y, other.y);
        if (w <= 0.0 || h <= 0.0) return 0.0;
        return w * h;
    }

    /**
     * Intersection over union, in [0,1]. Symmetric by construction.
     */
    public double overlapRatio(Bounds other) {
        double inter = intersectionArea(other);
        if (inter == 0.0) return 0.0;
        double union = area() + other.area() - inter;
        return union <= 0.0 ? 0.0 : inter / union;
    }

    public boolean contains(Point p) {
        return p.x() >= x && p.x() <= right() && p.y() >= y && p.y() <= bottom();
    }

    public Bounds translate(double dx, double dy) {
        return new Bounds(x + dx, y + dy, width, height);
    }
}
