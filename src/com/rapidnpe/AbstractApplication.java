package com.rapidnpe;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;

import com.rapidnpe.utils.DirectoryManager;
import com.rapidnpe.utils.HierarchicalLogger;

public class AbstractApplication {
    protected DesignParams designParams;
    protected DirectoryManager dirManager;
    protected HierarchicalLogger logger;

    protected CellLibrary cellLibrary;

    public AbstractApplication(String jsonFilePath, Boolean enableLogger) throws IOException {
        // read design parameters from json file
        Path jsonPath = Path.of(jsonFilePath).toAbsolutePath();
        designParams = new DesignParams(jsonPath);

        // setup directory manager
        dirManager = new DirectoryManager(designParams.getWorkDir());

        // setup logger
        setupLogger(enableLogger);
    }

    protected void setupLogger(Boolean enableLogger) throws IOException {
        if (enableLogger) {
            Path logFilePath = dirManager.resolve(designParams.getDesignName() + ".log");
            Level logLevel = designParams.isVerbose() ? Level.FINE : Level.INFO;
            logger = HierarchicalLogger.createLogger("application", logFilePath, true, logLevel);
        } else {
            logger = HierarchicalLogger.createPseudoLogger("application");
        }

        logger.info("Setup hierarchical logger for " + designParams.getDesignName() + " successfully");
        logger.info("Work directory: " + dirManager.getRootDir());
    }

    protected void readCellLibrary() throws IOException {
        logger.infoHeader("Read Cell Library");
        logger.info("Reading cell library: " + designParams.getCellLibraryPath());

        cellLibrary = CellLibraryReader.readCellLibrary(designParams.getCellLibraryPath());

        logger.newSubStep();
        logger.info("Num of cells: " + cellLibrary.getCellNum());
        logger.info(String.format("Total cell area: %.4f", cellLibrary.getTotalCellArea()));
        for (Cell cell : cellLibrary) {
            logger.fine(cell.toString());
        }
        logger.endSubStep();

        logger.info("Read cell library successfully");
    }

    public DesignParams getDesignParams() {
        return designParams;
    }

    public CellLibrary getCellLibrary() {
        return cellLibrary;
    }
}
