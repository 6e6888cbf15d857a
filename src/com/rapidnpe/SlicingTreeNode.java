package com.rapidnpe;

/**
 * Node of a {@link SlicingTree}. Nodes refer to each other through their ids in the tree's
 * node arena; {@link #NONE} marks an absent link.
 */
public abstract class SlicingTreeNode {
    public static final int NONE = -1;

    protected final int id;
    protected int parent = NONE;

    protected ShapeCurve shapeCurve;
    protected int selectedIdx = Shape.NO_CHILD_SHAPE;
    protected double area = 0.0;

    protected SlicingTreeNode(int id) {
        this.id = id;
    }

    public abstract boolean isOperator();

    public abstract char getSymbol();

    public int getId() {
        return id;
    }

    public int getParent() {
        return parent;
    }

    void setParent(int parent) {
        this.parent = parent;
    }

    public boolean hasShapeCurve() {
        return shapeCurve != null;
    }

    public ShapeCurve getShapeCurve() {
        return shapeCurve;
    }

    void setShapeCurve(ShapeCurve shapeCurve) {
        this.shapeCurve = shapeCurve;
    }

    public int getSelectedIdx() {
        return selectedIdx;
    }

    void setSelectedIdx(int selectedIdx) {
        assert shapeCurve != null && selectedIdx >= 0 && selectedIdx < shapeCurve.size();
        this.selectedIdx = selectedIdx;
    }

    public Shape getSelected() {
        if (shapeCurve == null || selectedIdx == Shape.NO_CHILD_SHAPE) {
            return null;
        }
        return shapeCurve.getShape(selectedIdx);
    }

    public double getArea() {
        return area;
    }

    void setArea(double area) {
        this.area = area;
    }

    public double getAspectRatio() {
        Shape selected = getSelected();
        if (selected == null) {
            return 0.0;
        }
        return selected.getHeight() / selected.getWidth();
    }
}
