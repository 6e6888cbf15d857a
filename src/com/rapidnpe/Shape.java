package com.rapidnpe;

/**
 * A candidate (width, height) of a slicing tree node.
 * For shapes of operator nodes, {@code rSelected} and {@code lSelected} are indices into the
 * shape curves of the right and left child that were combined into this shape.
 */
public class Shape {
    public static final int NO_CHILD_SHAPE = -1;

    private final double width;
    private final double height;
    private final int rSelected;
    private final int lSelected;

    public Shape(double width, double height, int rSelected, int lSelected) {
        this.width = width;
        this.height = height;
        this.rSelected = rSelected;
        this.lSelected = lSelected;
    }

    public static Shape leaf(double width, double height) {
        return new Shape(width, height, NO_CHILD_SHAPE, NO_CHILD_SHAPE);
    }

    public static Shape combine(CutDirection direction, Shape right, int rIdx, Shape left, int lIdx) {
        double width;
        double height;
        if (direction == CutDirection.VERTICAL) {
            width = right.width + left.width;
            height = right.height >= left.height ? right.height : left.height;
        } else {
            width = right.width >= left.width ? right.width : left.width;
            height = right.height + left.height;
        }
        return new Shape(width, height, rIdx, lIdx);
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getArea() {
        return width * height;
    }

    public int getRSelected() {
        return rSelected;
    }

    public int getLSelected() {
        return lSelected;
    }

    // exact comparison, no tolerance
    public boolean sameSize(Shape other) {
        return width == other.width && height == other.height;
    }

    public boolean dominates(Shape other) {
        return width <= other.width && height <= other.height;
    }

    @Override
    public String toString() {
        return String.format("(%s x %s)", width, height);
    }
}
