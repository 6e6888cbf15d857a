package com.rapidnpe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pareto frontier of the shapes a slicing tree node can take.
 *
 * <p>While a curve is being built, {@link #addShape(Shape)} keeps it free of dominated shapes.
 * After {@link #publish()} the order of shapes is frozen, so the indices stored in the
 * parent's shapes remain valid.
 */
public class ShapeCurve {
    private final List<Shape> shapes;
    private boolean published;

    public ShapeCurve() {
        shapes = new ArrayList<>();
        published = false;
    }

    public static ShapeCurve ofLeaf(Cell cell) {
        ShapeCurve curve = new ShapeCurve();
        // leaf orientations are kept as-is, swapped duplicates included
        curve.shapes.addAll(cell.getLeafShapes());
        curve.published = true;
        return curve;
    }

    /**
     * Inserts a shape unless an existing one is the same size or dominates it.
     * Existing shapes dominated by the new one are removed.
     *
     * @return true if the shape was inserted
     */
    public boolean addShape(Shape newShape) {
        assert !published: "shape curve is already published";

        int idx = 0;
        while (idx < shapes.size()) {
            Shape shape = shapes.get(idx);
            if (shape.sameSize(newShape)) {
                return false;
            } else if (shape.dominates(newShape)) {
                return false;
            } else if (newShape.dominates(shape)) {
                shapes.remove(idx);
            } else {
                idx++;
            }
        }
        shapes.add(newShape);
        return true;
    }

    public void publish() {
        published = true;
    }

    public boolean isPublished() {
        return published;
    }

    public Shape getShape(int idx) {
        return shapes.get(idx);
    }

    public List<Shape> getShapes() {
        return Collections.unmodifiableList(shapes);
    }

    public int size() {
        return shapes.size();
    }

    public boolean isEmpty() {
        return shapes.isEmpty();
    }

    // first shape wins on ties
    public int getMinAreaIdx() {
        assert !shapes.isEmpty(): "empty shape curve";
        int bestIdx = 0;
        double bestArea = shapes.get(0).getArea();
        for (int idx = 1; idx < shapes.size(); idx++) {
            double area = shapes.get(idx).getArea();
            if (area < bestArea) {
                bestIdx = idx;
                bestArea = area;
            }
        }
        return bestIdx;
    }

    @Override
    public String toString() {
        return shapes.toString();
    }
}
