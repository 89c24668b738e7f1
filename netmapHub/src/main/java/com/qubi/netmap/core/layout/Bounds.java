package com.qubi.netmap.core.layout;

/**
 * Drawing area. Positions are kept at least {@code padding} away from every border.
 */
public record Bounds(
        double width,
        double height,
        double padding
) {
    public static final Bounds DEFAULT = new Bounds(1000, 700, 40);

    public Bounds {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Bounds must be positive: " + width + "x" + height);
        }
        if (padding < 0 || padding * 2 >= Math.min(width, height)) {
            throw new IllegalArgumentException("Invalid padding " + padding + " for " + width + "x" + height);
        }
    }

    public double centerX() { return width / 2; }
    public double centerY() { return height / 2; }
    public double innerWidth() { return width - 2 * padding; }
    public double innerHeight() { return height - 2 * padding; }

    public double clampX(double x) { return Math.max(padding, Math.min(width - padding, x)); }
    public double clampY(double y) { return Math.max(padding, Math.min(height - padding, y)); }
}
