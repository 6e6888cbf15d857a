package com.rapidnpe;

public class CellPlacement {
    private final char name;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final boolean rotated;

    public CellPlacement(char name, double x, double y, double width, double height, boolean rotated) {
        this.name = name;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.rotated = rotated;
    }

    public char getName() {
        return name;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public boolean isRotated() {
        return rotated;
    }

    // placements that only touch within the tolerance do not overlap
    public boolean overlaps(CellPlacement other, double tolerance) {
        return x + tolerance < other.x + other.width && other.x + tolerance < x + width
            && y + tolerance < other.y + other.height && other.y + tolerance < y + height;
    }

    @Override
    public String toString() {
        return String.format("%c: (%s, %s) %s x %s%s", name, x, y, width, height, rotated ? " rotated" : "");
    }
}
