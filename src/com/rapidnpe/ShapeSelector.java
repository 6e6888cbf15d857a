package com.rapidnpe;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks down from the root's selected shape and fixes the shape and lower-left corner of every
 * node. A vertical cut places the right child beside the left one, a horizontal cut places it
 * above the left one.
 */
public class ShapeSelector {

    private ShapeSelector() {
    }

    public static List<CellPlacement> backPropagate(SlicingTree tree) {
        SlicingTreeNode root = tree.getRoot();
        if (root.getSelected() == null) {
            throw new IllegalStateException("Minimum area of slicing tree " + tree + " has not been computed");
        }

        List<CellPlacement> placements = new ArrayList<>();
        propagate(tree, root.getId(), root.getSelectedIdx(), 0.0, 0.0, placements);
        return placements;
    }

    private static void propagate(SlicingTree tree, int nodeId, int shapeIdx, double x, double y, List<CellPlacement> placements) {
        SlicingTreeNode node = tree.getNode(nodeId);
        node.setSelectedIdx(shapeIdx);
        Shape shape = node.getSelected();

        if (!node.isOperator()) {
            OperandNode operand = (OperandNode) node;
            placements.add(new CellPlacement(operand.getSymbol(), x, y, shape.getWidth(), shape.getHeight(), operand.isRotated()));
            return;
        }

        OperatorNode operator = (OperatorNode) node;
        SlicingTreeNode leftNode = tree.getNode(operator.getLeft());
        Shape leftShape = leftNode.getShapeCurve().getShape(shape.getLSelected());

        double rightX = x;
        double rightY = y;
        if (operator.getDirection() == CutDirection.VERTICAL) {
            rightX += leftShape.getWidth();
        } else {
            rightY += leftShape.getHeight();
        }

        propagate(tree, operator.getLeft(), shape.getLSelected(), x, y, placements);
        propagate(tree, operator.getRight(), shape.getRSelected(), rightX, rightY, placements);
    }
}
