package com.rapidnpe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binary slicing tree stored as an arena of nodes addressed by id.
 * The first allocated node is the root.
 */
public class SlicingTree {
    public static final int ROOT_ID = 0;

    private final List<SlicingTreeNode> nodes;
    private int operatorNum;
    private int operandNum;

    public SlicingTree() {
        nodes = new ArrayList<>();
        operatorNum = 0;
        operandNum = 0;
    }

    public int addOperator(CutDirection direction) {
        int nodeId = nodes.size();
        nodes.add(new OperatorNode(nodeId, direction));
        operatorNum++;
        return nodeId;
    }

    public int addOperand(Cell cell) {
        int nodeId = nodes.size();
        nodes.add(new OperandNode(nodeId, cell));
        operandNum++;
        return nodeId;
    }

    /**
     * Attaches a child to a parent operator, right slot first.
     * @return true if the parent's left slot was filled
     */
    public boolean attachChild(int parentId, int childId) {
        OperatorNode parentNode = getOperator(parentId);
        SlicingTreeNode childNode = getNode(childId);
        assert childNode.getParent() == SlicingTreeNode.NONE: "node " + childId + " already has a parent";

        boolean leftFilled = parentNode.attachChild(childId);
        childNode.setParent(parentId);
        return leftFilled;
    }

    public SlicingTreeNode getNode(int nodeId) {
        return nodes.get(nodeId);
    }

    public OperatorNode getOperator(int nodeId) {
        SlicingTreeNode node = nodes.get(nodeId);
        assert node.isOperator(): "node " + nodeId + " is not an operator";
        return (OperatorNode) node;
    }

    public SlicingTreeNode getRoot() {
        assert !nodes.isEmpty(): "empty slicing tree";
        return nodes.get(ROOT_ID);
    }

    public int getNodeNum() {
        return nodes.size();
    }

    public int getOperatorNum() {
        return operatorNum;
    }

    public int getOperandNum() {
        return operandNum;
    }

    public List<SlicingTreeNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<OperandNode> getOperandNodes() {
        List<OperandNode> operandNodes = new ArrayList<>();
        for (SlicingTreeNode node : nodes) {
            if (!node.isOperator()) {
                operandNodes.add((OperandNode) node);
            }
        }
        return operandNodes;
    }

    // every operator node has both children and every non-root node has a parent
    public boolean isFullBinaryTree() {
        if (nodes.isEmpty() || getRoot().getParent() != SlicingTreeNode.NONE) {
            return false;
        }
        for (SlicingTreeNode node : nodes) {
            if (node.getId() != ROOT_ID && node.getParent() == SlicingTreeNode.NONE) {
                return false;
            }
            if (node.isOperator() && !((OperatorNode) node).isComplete()) {
                return false;
            }
        }
        return operandNum == operatorNum + 1;
    }

    public String toExpression() {
        if (nodes.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        appendExpression(ROOT_ID, builder);
        return builder.toString();
    }

    private void appendExpression(int nodeId, StringBuilder builder) {
        SlicingTreeNode node = getNode(nodeId);
        if (node.isOperator()) {
            OperatorNode operator = (OperatorNode) node;
            appendExpression(operator.getLeft(), builder);
            appendExpression(operator.getRight(), builder);
        }
        builder.append(node.getSymbol());
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
