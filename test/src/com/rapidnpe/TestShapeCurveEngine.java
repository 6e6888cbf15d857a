package com.rapidnpe;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.rapidnpe.utils.HierarchicalLogger;

public class TestShapeCurveEngine {
    private HierarchicalLogger logger;
    private CellLibrary library;
    private ShapeCurveEngine engine;

    @BeforeEach
    public void setup() {
        logger = HierarchicalLogger.createPseudoLogger("test");
        library = new CellLibrary();
        library.addCell(new Cell('A', 2.0, 2.0));       // 1 x 2, rotatable
        library.addCell(new Cell('B', 8.0, 0.5, true)); // 4 x 2
        library.addCell(new Cell('C', 9.0, 1.0, true)); // 3 x 3
        engine = new ShapeCurveEngine(logger);
    }

    private SlicingTree build(String npe) {
        return new SlicingTreeBuilder(logger, library).build(npe).getTree();
    }

    @Test
    public void testVerticalCombination() {
        ShapeCurve right = ShapeCurve.ofLeaf(library.getCell('B'));
        ShapeCurve left = ShapeCurve.ofLeaf(library.getCell('A'));
        ShapeCurve curve = ShapeCurveEngine.combine(CutDirection.VERTICAL, right, left);

        // (4+2, max(2,1)) is dominated by (4+1, max(2,2))
        Assertions.assertEquals(1, curve.size());
        Shape shape = curve.getShape(0);
        Assertions.assertEquals(5.0, shape.getWidth());
        Assertions.assertEquals(2.0, shape.getHeight());
        Assertions.assertEquals(0, shape.getRSelected());
        Assertions.assertEquals(0, shape.getLSelected());
    }

    @Test
    public void testHorizontalCombination() {
        ShapeCurve right = ShapeCurve.ofLeaf(library.getCell('B'));
        ShapeCurve left = ShapeCurve.ofLeaf(library.getCell('A'));
        ShapeCurve curve = ShapeCurveEngine.combine(CutDirection.HORIZONTAL, right, left);

        // (4, 2+1) replaces (4, 2+2)
        Assertions.assertEquals(1, curve.size());
        Shape shape = curve.getShape(0);
        Assertions.assertEquals(4.0, shape.getWidth());
        Assertions.assertEquals(3.0, shape.getHeight());
        Assertions.assertEquals(1, shape.getLSelected());
    }

    @Test
    public void testComputeMinArea() {
        SlicingTree tree = build("ABHCV");
        double area = engine.computeMinArea(tree);

        // A rotated on top of B gives 4 x 3, C beside it gives 7 x 3
        Assertions.assertEquals(21.0, area);
        SlicingTreeNode root = tree.getRoot();
        Assertions.assertEquals(21.0, root.getArea());
        Assertions.assertEquals(7.0, root.getSelected().getWidth());
        Assertions.assertEquals(3.0 / 7.0, root.getAspectRatio(), 1e-12);
        for (SlicingTreeNode node : tree.getNodes()) {
            Assertions.assertTrue(node.hasShapeCurve());
        }
    }

    @Test
    public void testIdempotence() {
        SlicingTree tree = build("ABVCH");
        double firstArea = engine.computeMinArea(tree);
        Shape firstSelected = tree.getRoot().getSelected();

        double secondArea = engine.computeMinArea(tree);
        Assertions.assertEquals(firstArea, secondArea);
        Assertions.assertSame(firstSelected, tree.getRoot().getSelected());
    }

    @Test
    public void testSubtreeArea() {
        SlicingTree tree = build("ABVCH");
        OperatorNode root = (OperatorNode) tree.getRoot();
        double subtreeArea = engine.computeMinArea(tree, root.getLeft());
        Assertions.assertEquals(10.0, subtreeArea);
        Assertions.assertFalse(root.hasShapeCurve());

        double area = engine.computeMinArea(tree);
        Assertions.assertTrue(area >= subtreeArea);
        Assertions.assertTrue(Double.isFinite(area));
    }

    @Test
    public void testLeafKeepsBackPropagatedOrientation() {
        SlicingTree tree = build("ABH");
        engine.computeMinArea(tree);
        ShapeSelector.backPropagate(tree);

        OperatorNode root = (OperatorNode) tree.getRoot();
        OperandNode leafA = (OperandNode) tree.getNode(root.getLeft());
        Assertions.assertEquals(1, leafA.getSelectedIdx());
        Assertions.assertTrue(leafA.isRotated());

        Assertions.assertEquals(2.0, engine.computeMinArea(tree, leafA.getId()));
        Assertions.assertEquals(1, leafA.getSelectedIdx());
        Assertions.assertTrue(leafA.isRotated());
        Assertions.assertEquals(2.0, leafA.getSelected().getWidth());
    }

    @Test
    public void testSingleLeaf() {
        SlicingTree tree = build("A");
        Assertions.assertEquals(2.0, engine.computeMinArea(tree));
        Assertions.assertEquals(0, tree.getRoot().getSelectedIdx());
    }
}
