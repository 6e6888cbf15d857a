package com.rapidnpe;

import com.rapidnpe.utils.HierarchicalLogger;

/**
 * Builds a slicing tree by scanning a Normalized Polish Expression from its last symbol to its
 * first. Each operator becomes the new insertion point; once an insertion point has both
 * children, control returns to the nearest ancestor still missing one.
 */
public class SlicingTreeBuilder {
    private final HierarchicalLogger logger;
    private final CellLibrary cellLibrary;

    public SlicingTreeBuilder(HierarchicalLogger logger, CellLibrary cellLibrary) {
        this.logger = logger;
        this.cellLibrary = cellLibrary;
    }

    public BuildResult build(String npe) {
        String invalidReason = NPEValidator.validate(npe);
        if (invalidReason != null) {
            logger.fine("Reject expression " + npe + ": " + invalidReason);
            return BuildResult.failure(ErrorKind.INVALID_EXPRESSION, "Invalid NPE " + npe + ": " + invalidReason);
        }

        SlicingTree tree = new SlicingTree();
        int lastIdx = npe.length() - 1;

        // a single operand has no operator to serve as root
        if (lastIdx == 0) {
            Cell cell = cellLibrary.getCell(npe.charAt(0));
            if (cell == null) {
                return cellNotFound(npe, npe.charAt(0));
            }
            tree.addOperand(cell);
            return BuildResult.success(tree);
        }

        // the last symbol of a valid NPE with operands > 1 is an operator
        int current = tree.addOperator(CutDirection.fromSymbol(npe.charAt(lastIdx)));
        for (int i = lastIdx - 1; i >= 0; i--) {
            char symbol = npe.charAt(i);
            if (CutDirection.isOperatorSymbol(symbol)) {
                int operatorId = tree.addOperator(CutDirection.fromSymbol(symbol));
                tree.attachChild(current, operatorId);
                current = operatorId;
            } else {
                Cell cell = cellLibrary.getCell(symbol);
                if (cell == null) {
                    return cellNotFound(npe, symbol);
                }
                int operandId = tree.addOperand(cell);
                boolean leftFilled = tree.attachChild(current, operandId);
                if (leftFilled) {
                    while (current != SlicingTree.ROOT_ID && tree.getOperator(current).hasLeft()) {
                        current = tree.getNode(current).getParent();
                    }
                }
            }
        }

        assert tree.isFullBinaryTree(): "slicing tree of " + npe + " is not a full binary tree";
        logger.fine(String.format("Built slicing tree of %s with %d operands and %d operators",
            npe, tree.getOperandNum(), tree.getOperatorNum()));
        return BuildResult.success(tree);
    }

    private BuildResult cellNotFound(String npe, char name) {
        logger.fine("Cell " + name + " of expression " + npe + " not found in library");
        return BuildResult.failure(ErrorKind.CELL_NOT_FOUND, "Cell " + name + " of NPE " + npe + " not found in cell library");
    }
}
