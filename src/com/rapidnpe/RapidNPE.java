package com.rapidnpe;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Evaluates the slicing floorplans listed in a json run configuration and reports the cost of
 * each one.
 */
public class RapidNPE extends AbstractApplication {

    public enum RapidNPEStep {
        READ_CELL_LIBRARY,
        EVALUATION,
        WRITE_REPORT;

        public static RapidNPEStep[] getOrderedSteps() {
            return new RapidNPEStep[] {
                READ_CELL_LIBRARY, EVALUATION, WRITE_REPORT
            };
        }

        public static RapidNPEStep getLastStep() {
            return WRITE_REPORT;
        }
    };

    private List<FloorplanResult> floorplanResults;
    private FloorplanReportJson report;

    public RapidNPE(String jsonFilePath, Boolean enableLogger) throws IOException {
        super(jsonFilePath, enableLogger);
    }

    private void runEvaluation() {
        logger.infoHeader("Floorplan Evaluation");
        FloorplanEvaluator evaluator = new FloorplanEvaluator(logger, cellLibrary);

        floorplanResults = new ArrayList<>();
        report = new FloorplanReportJson();
        report.designName = designParams.getDesignName();
        report.cellNum = cellLibrary.getCellNum();
        report.totalCellArea = cellLibrary.getTotalCellArea();
        report.floorplans = new ArrayList<>();

        for (String npe : designParams.getNpes()) {
            FloorplanEntryJson entry = new FloorplanEntryJson();
            entry.npe = npe;

            try {
                FloorplanResult result = evaluator.evaluate(npe);
                floorplanResults.add(result);
                fillEntry(entry, result);

                logger.info("NPE: " + npe);
                logger.info("Cost: " + result.getArea());
                logger.newSubStep();
                logger.info(result.getSummary(), true);
                logger.endSubStep();

                if (report.bestArea == null || result.getArea() < report.bestArea) {
                    report.bestArea = result.getArea();
                    report.bestNpe = npe;
                }
            } catch (FloorplanException e) {
                logger.severe("Skip NPE " + npe + ": " + e.getMessage());
                entry.errorKind = e.getErrorKind().name();
                entry.errorMessage = e.getMessage();
            }
            report.floorplans.add(entry);
        }

        logger.info(String.format("Evaluated %d of %d expressions", floorplanResults.size(), designParams.getNpes().size()));
        if (report.bestNpe != null) {
            logger.info("Best NPE: " + report.bestNpe + " with area " + report.bestArea);
        }
    }

    private void fillEntry(FloorplanEntryJson entry, FloorplanResult result) {
        entry.area = result.getArea();
        entry.width = result.getWidth();
        entry.height = result.getHeight();
        entry.deadSpaceRatio = result.getDeadSpaceRatio();
        entry.placements = new ArrayList<>();
        for (CellPlacement placement : result.getPlacements()) {
            CellPlacementJson placementJson = new CellPlacementJson();
            placementJson.name = String.valueOf(placement.getName());
            placementJson.x = placement.getX();
            placementJson.y = placement.getY();
            placementJson.width = placement.getWidth();
            placementJson.height = placement.getHeight();
            placementJson.rotated = placement.isRotated();
            entry.placements.add(placementJson);
        }
    }

    private void writeReport() throws IOException {
        if (!designParams.isWriteReport()) {
            logger.info("Skip writing floorplan report");
            return;
        }
        logger.infoHeader("Write Report");
        Path reportPath = getReportPath();
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        Files.writeString(reportPath, gson.toJson(report), StandardCharsets.UTF_8);
        logger.info("Write floorplan report to " + reportPath);
    }

    public void run(RapidNPEStep endStep) throws IOException {
        logger.info("Start running RapidNPE");

        for (RapidNPEStep step : RapidNPEStep.getOrderedSteps()) {
            switch (step) {
                case READ_CELL_LIBRARY:
                    readCellLibrary();
                    break;

                case EVALUATION:
                    runEvaluation();
                    break;

                case WRITE_REPORT:
                    writeReport();
                    break;
            }

            if (step == endStep) {
                break;
            }
        }

        logger.info("Complete running RapidNPE");
    }

    public void run() throws IOException {
        run(RapidNPEStep.getLastStep());
    }

    public Path getReportPath() {
        return dirManager.resolve(designParams.getDesignName() + "_floorplan.json");
    }

    public List<FloorplanResult> getFloorplanResults() {
        return floorplanResults;
    }

    public FloorplanReportJson getReport() {
        return report;
    }

    public static void main(String[] args) throws IOException {
        String jsonFilePath = "workspace/json/example.json";
        if (args.length > 0) {
            jsonFilePath = args[0];
        }

        RapidNPE rapidNPE = new RapidNPE(jsonFilePath, true);
        rapidNPE.run();
    }
}
