package com.rapidnpe.utils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Thin wrapper of {@link java.util.logging.Logger} that prefixes messages of nested steps with
 * one '#' per nesting level.
 */
public class HierarchicalLogger {
    public static class StepFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            return record.getLevel() + ": " + record.getMessage() + "\n";
        }
    }

    private static final int HEADER_LEN = 80;

    private final Logger logger;
    private int logHierDepth = 0;

    public HierarchicalLogger(String name) {
        logger = Logger.getLogger(name);
        logger.setUseParentHandlers(false);
    }

    public void setLevel(Level level) {
        logger.setLevel(level);
        for (Handler handler : logger.getHandlers()) {
            handler.setLevel(level);
        }
    }

    public void addHandler(Handler handler) {
        logger.addHandler(handler);
    }

    // handlers attached to the shared logger of the same name by earlier calls
    private void removeHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    public void log(Level level, String msg) {
        if (!logger.isLoggable(level)) {
            return;
        }
        if (logHierDepth > 0) {
            msg = "#".repeat(logHierDepth) + " " + msg;
        }
        logger.log(level, msg);
    }

    public void severe(String msg) {
        log(Level.SEVERE, msg);
    }

    public void info(String msg) {
        log(Level.INFO, msg);
    }

    // continuation lines are aligned below the first one
    public void info(String msg, boolean autoIndent) {
        if (autoIndent && msg.indexOf('\n') != -1) {
            String indent = " ".repeat("INFO: ".length() + (logHierDepth > 0 ? logHierDepth + 1 : 0));
            msg = msg.replace("\n", "\n" + indent);
        }
        log(Level.INFO, msg);
    }

    public void fine(String msg) {
        log(Level.FINE, msg);
    }

    public void finer(String msg) {
        log(Level.FINER, msg);
    }

    public void newSubStep() {
        logHierDepth++;
    }

    public void endSubStep() {
        if (logHierDepth > 0) {
            logHierDepth--;
        }
    }

    public void infoHeader(String headerName) {
        int blankSpace = Math.max(HEADER_LEN - 4 - headerName.length(), 0);
        int frontBlankSpace = blankSpace / 2;
        String separatorStr = "=".repeat(HEADER_LEN);
        String nameStr = "==" + " ".repeat(frontBlankSpace) + headerName + " ".repeat(blankSpace - frontBlankSpace) + "==";

        info("");
        info(separatorStr);
        info(nameStr);
        info(separatorStr);
    }

    public static HierarchicalLogger createLogger(String logName, Path logFilePath, boolean enableConsole, Level level) throws IOException {
        HierarchicalLogger logger = new HierarchicalLogger(logName);
        logger.removeHandlers();

        if (logFilePath != null) {
            FileHandler fileHandler = new FileHandler(logFilePath.toString(), false);
            fileHandler.setFormatter(new StepFormatter());
            logger.addHandler(fileHandler);
        }

        if (enableConsole) {
            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setFormatter(new StepFormatter());
            logger.addHandler(consoleHandler);
        }
        logger.setLevel(level);

        return logger;
    }

    // logger without handlers, for library callers and tests
    public static HierarchicalLogger createPseudoLogger(String logName) {
        HierarchicalLogger logger = new HierarchicalLogger(logName);
        logger.removeHandlers();
        logger.setLevel(Level.INFO);
        return logger;
    }
}
