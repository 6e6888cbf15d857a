package com.rapidnpe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Cell {
    private final char name;
    private final double area;
    private final double aspectRatio; // height / width in the default orientation
    private final boolean fixed;

    public Cell(char name, double area, double aspectRatio, boolean fixed) {
        if (CutDirection.isOperatorSymbol(name)) {
            throw new IllegalArgumentException("Cell name is reserved for cut operators: " + name);
        }
        if (!(area > 0) || Double.isInfinite(area)) {
            throw new IllegalArgumentException("Area of cell " + name + " should be positive: " + area);
        }
        if (!(aspectRatio > 0) || Double.isInfinite(aspectRatio)) {
            throw new IllegalArgumentException("Aspect ratio of cell " + name + " should be positive: " + aspectRatio);
        }
        this.name = name;
        this.area = area;
        this.aspectRatio = aspectRatio;
        this.fixed = fixed;
    }

    public Cell(char name, double area, double aspectRatio) {
        this(name, area, aspectRatio, false);
    }

    public char getName() {
        return name;
    }

    public double getArea() {
        return area;
    }

    public double getAspectRatio() {
        return aspectRatio;
    }

    public boolean isFixed() {
        return fixed;
    }

    public double getHeight() {
        return Math.sqrt(aspectRatio * area);
    }

    public double getWidth() {
        return area / getHeight();
    }

    // a rotatable cell always gets both orientations, even a square one
    public List<Shape> getLeafShapes() {
        double height = getHeight();
        double width = area / height;

        List<Shape> shapes = new ArrayList<>();
        shapes.add(Shape.leaf(width, height));
        if (!fixed) {
            shapes.add(Shape.leaf(height, width));
        }
        return Collections.unmodifiableList(shapes);
    }

    @Override
    public String toString() {
        return String.format("%c(area=%s, aspectRatio=%s%s)", name, area, aspectRatio, fixed ? ", fixed" : "");
    }
}
