package com.rapidnpe;

import java.util.Collections;
import java.util.List;

public class FloorplanResult {
    private final String npe;
    private final SlicingTree tree;
    private final List<CellPlacement> placements;

    public FloorplanResult(String npe, SlicingTree tree, List<CellPlacement> placements) {
        this.npe = npe;
        this.tree = tree;
        this.placements = Collections.unmodifiableList(placements);
    }

    public String getNpe() {
        return npe;
    }

    public SlicingTree getTree() {
        return tree;
    }

    public List<CellPlacement> getPlacements() {
        return placements;
    }

    public CellPlacement getPlacement(char name) {
        for (CellPlacement placement : placements) {
            if (placement.getName() == name) {
                return placement;
            }
        }
        return null;
    }

    public double getArea() {
        return tree.getRoot().getArea();
    }

    public double getWidth() {
        return tree.getRoot().getSelected().getWidth();
    }

    public double getHeight() {
        return tree.getRoot().getSelected().getHeight();
    }

    public double getAspectRatio() {
        return tree.getRoot().getAspectRatio();
    }

    public double getTotalCellArea() {
        double totalArea = 0.0;
        for (OperandNode operand : tree.getOperandNodes()) {
            totalArea += operand.getCell().getArea();
        }
        return totalArea;
    }

    public double getDeadSpaceRatio() {
        return 1.0 - getTotalCellArea() / getArea();
    }

    public String getSummary() {
        String summary = "";
        summary += String.format("Bounding box: %.4f x %.4f\n", getWidth(), getHeight());
        summary += String.format("Aspect ratio: %.4f\n", getAspectRatio());
        summary += String.format("Dead space: %.2f%%", getDeadSpaceRatio() * 100);
        return summary;
    }
}
