package com.rapidnpe;

import java.util.List;

import com.rapidnpe.utils.HierarchicalLogger;

/**
 * Cost function of a slicing floorplan: validates an NPE, builds its slicing tree, computes the
 * minimum bounding area and fixes the dimensions of every cell.
 *
 * <p>Every call builds a fresh tree, so one evaluator can be reused for many expressions
 * against the same cell library.
 */
public class FloorplanEvaluator {
    private final HierarchicalLogger logger;
    private final SlicingTreeBuilder treeBuilder;
    private final ShapeCurveEngine curveEngine;

    public FloorplanEvaluator(HierarchicalLogger logger, CellLibrary cellLibrary) {
        this.logger = logger;
        this.treeBuilder = new SlicingTreeBuilder(logger, cellLibrary);
        this.curveEngine = new ShapeCurveEngine(logger);
    }

    public static double cost(String npe, CellLibrary cellLibrary) {
        return new FloorplanEvaluator(HierarchicalLogger.createPseudoLogger("evaluator"), cellLibrary).cost(npe);
    }

    /**
     * @return the minimum area of the floorplan encoded by {@code npe}
     * @throws InvalidExpressionException if {@code npe} is not a Normalized Polish Expression
     * @throws CellNotFoundException if an operand has no cell in the library
     */
    public double cost(String npe) {
        SlicingTree tree = buildTree(npe);
        return curveEngine.computeMinArea(tree);
    }

    public FloorplanResult evaluate(String npe) {
        logger.fine("Evaluating NPE " + npe);
        SlicingTree tree = buildTree(npe);

        logger.newSubStep();
        double area = curveEngine.computeMinArea(tree);
        List<CellPlacement> placements = ShapeSelector.backPropagate(tree);
        logger.fine("Minimum area: " + area);

        logger.endSubStep();
        return new FloorplanResult(npe, tree, placements);
    }

    public SlicingTree buildTree(String npe) {
        BuildResult result = treeBuilder.build(npe);
        if (!result.isSuccess()) {
            throw FloorplanException.of(result);
        }
        return result.getTree();
    }
}
