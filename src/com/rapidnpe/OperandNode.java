package com.rapidnpe;

public class OperandNode extends SlicingTreeNode {
    private final Cell cell;

    public OperandNode(int id, Cell cell) {
        super(id);
        this.cell = cell;
        this.shapeCurve = ShapeCurve.ofLeaf(cell);
        this.area = cell.getArea();
    }

    public Cell getCell() {
        return cell;
    }

    // the second leaf shape is the swapped orientation
    public boolean isRotated() {
        return !cell.isFixed() && selectedIdx == 1;
    }

    @Override
    public boolean isOperator() {
        return false;
    }

    @Override
    public char getSymbol() {
        return cell.getName();
    }
}
