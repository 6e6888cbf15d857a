package com.rapidnpe;

import com.rapidnpe.utils.HierarchicalLogger;

/**
 * Computes the shape curve of every operator node bottom-up and the minimum area each node can
 * reach. Results are memoized in the nodes, so evaluating a node again returns the same area and
 * selected shape.
 */
public class ShapeCurveEngine {
    private final HierarchicalLogger logger;

    public ShapeCurveEngine(HierarchicalLogger logger) {
        this.logger = logger;
    }

    public double computeMinArea(SlicingTree tree) {
        return computeMinArea(tree, SlicingTree.ROOT_ID);
    }

    public double computeMinArea(SlicingTree tree, int nodeId) {
        SlicingTreeNode node = tree.getNode(nodeId);

        if (!node.isOperator()) {
            // keep the orientation fixed by an earlier evaluation or back-propagation
            if (node.getSelectedIdx() != Shape.NO_CHILD_SHAPE) {
                return node.getArea();
            }
            ShapeCurve curve = node.getShapeCurve();
            int bestIdx = curve.getMinAreaIdx();
            node.setSelectedIdx(bestIdx);
            node.setArea(curve.getShape(bestIdx).getArea());
            return node.getArea();
        }

        OperatorNode operator = (OperatorNode) node;
        if (operator.hasShapeCurve()) {
            return operator.getArea();
        }

        SlicingTreeNode rightNode = tree.getNode(operator.getRight());
        SlicingTreeNode leftNode = tree.getNode(operator.getLeft());
        if (rightNode.isOperator()) {
            computeMinArea(tree, rightNode.getId());
        }
        if (leftNode.isOperator()) {
            computeMinArea(tree, leftNode.getId());
        }

        ShapeCurve curve = combine(operator.getDirection(), rightNode.getShapeCurve(), leftNode.getShapeCurve());
        curve.publish();
        operator.setShapeCurve(curve);

        int bestIdx = curve.getMinAreaIdx();
        operator.setSelectedIdx(bestIdx);
        operator.setArea(curve.getShape(bestIdx).getArea());

        logger.finer(String.format("Node %d (%c): %d shapes, min area %s with %s",
            nodeId, operator.getSymbol(), curve.size(), operator.getArea(), operator.getSelected()));
        return operator.getArea();
    }

    public static ShapeCurve combine(CutDirection direction, ShapeCurve rightCurve, ShapeCurve leftCurve) {
        ShapeCurve curve = new ShapeCurve();
        for (int i = 0; i < rightCurve.size(); i++) {
            for (int j = 0; j < leftCurve.size(); j++) {
                Shape newShape = Shape.combine(direction, rightCurve.getShape(i), i, leftCurve.getShape(j), j);
                curve.addShape(newShape);
            }
        }
        assert !curve.isEmpty(): "combined shape curve is empty";
        return curve;
    }
}
