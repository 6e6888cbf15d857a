package com.rapidnpe;

public class OperatorNode extends SlicingTreeNode {
    private final CutDirection direction;
    private int left = NONE;
    private int right = NONE;

    public OperatorNode(int id, CutDirection direction) {
        super(id);
        this.direction = direction;
    }

    public CutDirection getDirection() {
        return direction;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    public boolean hasLeft() {
        return left != NONE;
    }

    public boolean hasRight() {
        return right != NONE;
    }

    public boolean isComplete() {
        return hasLeft() && hasRight();
    }

    /**
     * Fills the right slot if it is empty, the left slot otherwise.
     * @return true if the left slot was filled
     */
    boolean attachChild(int childId) {
        if (!hasRight()) {
            right = childId;
            return false;
        }
        assert !hasLeft(): "operator node " + id + " already has two children";
        left = childId;
        return true;
    }

    @Override
    public boolean isOperator() {
        return true;
    }

    @Override
    public char getSymbol() {
        return direction.getSymbol();
    }
}
