package com.rapidnpe;

import java.util.Arrays;
import java.util.stream.Stream;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.rapidnpe.utils.HierarchicalLogger;

public class TestSlicingTreeBuilder {
    private SlicingTreeBuilder builder;

    @BeforeEach
    public void setup() {
        CellLibrary library = new CellLibrary();
        for (char name : "ABCDE123456789abcdefgijkl".toCharArray()) {
            library.addCell(new Cell(name, 4.0, 1.0));
        }
        builder = new SlicingTreeBuilder(HierarchicalLogger.createPseudoLogger("test"), library);
    }

    @ParameterizedTest
    @MethodSource
    public void testTreeShape(String npe) {
        BuildResult result = builder.build(npe);
        Assertions.assertTrue(result.isSuccess());

        SlicingTree tree = result.getTree();
        int operandNum = (npe.length() + 1) / 2;
        Assertions.assertEquals(operandNum, tree.getOperandNum());
        Assertions.assertEquals(operandNum - 1, tree.getOperatorNum());
        Assertions.assertEquals(npe.length(), tree.getNodeNum());
        Assertions.assertTrue(tree.isFullBinaryTree());
        Assertions.assertEquals(npe, tree.toExpression());
    }

    public static Stream<String> testTreeShape() {
        return Stream.of(
                "ABV",
                "ABVCH",
                "ABCVH",
                "ABHCDHV",
                "ABCDVHEVH",
                "12V3V4V5V6V7V8V9VaVbVcVdVeVfVgViVjVkVlV",
                "213546H7VHVa8V9HcVHgHibdHkVHfeHVlHVjHVH"
                );
    }

    @Test
    public void testChildSlots() {
        SlicingTree tree = builder.build("ABVCH").getTree();

        OperatorNode root = (OperatorNode) tree.getRoot();
        Assertions.assertEquals(CutDirection.HORIZONTAL, root.getDirection());
        Assertions.assertEquals('C', tree.getNode(root.getRight()).getSymbol());

        OperatorNode leftChild = tree.getOperator(root.getLeft());
        Assertions.assertEquals(CutDirection.VERTICAL, leftChild.getDirection());
        Assertions.assertEquals(root.getId(), leftChild.getParent());
        Assertions.assertEquals('A', tree.getNode(leftChild.getLeft()).getSymbol());
        Assertions.assertEquals('B', tree.getNode(leftChild.getRight()).getSymbol());
    }

    @Test
    public void testSingleOperand() {
        BuildResult result = builder.build("A");
        Assertions.assertTrue(result.isSuccess());

        SlicingTree tree = result.getTree();
        Assertions.assertFalse(tree.getRoot().isOperator());
        Assertions.assertEquals(1, tree.getOperandNum());
        Assertions.assertEquals(0, tree.getOperatorNum());
        Assertions.assertEquals("A", tree.toString());
    }

    @Test
    public void testInvalidExpression() {
        for (String npe : Arrays.asList("AAV", "AVV", "", "ABVH")) {
            BuildResult result = builder.build(npe);
            Assertions.assertFalse(result.isSuccess());
            Assertions.assertNull(result.getTree());
            Assertions.assertEquals(ErrorKind.INVALID_EXPRESSION, result.getErrorKind());
        }
    }

    @Test
    public void testCellNotFound() {
        BuildResult result = builder.build("AXV");
        Assertions.assertFalse(result.isSuccess());
        Assertions.assertNull(result.getTree());
        Assertions.assertEquals(ErrorKind.CELL_NOT_FOUND, result.getErrorKind());
        Assertions.assertTrue(result.getMessage().contains("X"));

        Assertions.assertEquals(ErrorKind.CELL_NOT_FOUND, builder.build("X").getErrorKind());
    }
}
