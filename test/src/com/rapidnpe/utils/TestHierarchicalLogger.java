package com.rapidnpe.utils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestHierarchicalLogger {

    @Test
    public void testPseudoLoggerDropsHandlers(@TempDir Path dir) throws Exception {
        Path logPath = dir.resolve("shared.log");
        HierarchicalLogger fileLogger = HierarchicalLogger.createLogger("shared", logPath, false, Level.INFO);
        Assertions.assertEquals(1, Logger.getLogger("shared").getHandlers().length);
        fileLogger.info("to file");

        HierarchicalLogger pseudoLogger = HierarchicalLogger.createPseudoLogger("shared");
        Assertions.assertEquals(0, Logger.getLogger("shared").getHandlers().length);
        pseudoLogger.info("nowhere");

        String log = Files.readString(logPath);
        Assertions.assertTrue(log.contains("INFO: to file"));
        Assertions.assertFalse(log.contains("nowhere"));
    }

    @Test
    public void testSubStepPrefix(@TempDir Path dir) throws Exception {
        Path logPath = dir.resolve("steps.log");
        HierarchicalLogger logger = HierarchicalLogger.createLogger("steps", logPath, false, Level.INFO);
        logger.info("top");
        logger.newSubStep();
        logger.info("nested");
        logger.fine("hidden");
        logger.endSubStep();
        HierarchicalLogger.createPseudoLogger("steps");

        String log = Files.readString(logPath);
        Assertions.assertTrue(log.contains("INFO: top\n"));
        Assertions.assertTrue(log.contains("INFO: # nested\n"));
        Assertions.assertFalse(log.contains("hidden"));
    }
}
