package com.rapidnpe;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a cell library from text, one cell per line: {@code name area aspectRatio [fixed]}.
 * Cells without the fixed field may be rotated. Lines starting with '#' that are not a cell record
 * are comments.
 */
public class CellLibraryReader {

    private CellLibraryReader() {
    }

    public static CellLibrary readCellLibrary(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readCellLibrary(reader, path.toString());
        }
    }

    public static CellLibrary readCellLibrary(Reader reader, String sourceName) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        CellLibrary library = new CellLibrary();

        String line;
        int lineNum = 0;
        while ((line = br.readLine()) != null) {
            lineNum++;
            line = line.trim();
            if (line.isEmpty()) continue;

            Cell cell;
            try {
                cell = parseCell(line);
            } catch (IllegalArgumentException e) {
                // '#' is a valid cell name, so only unparsable '#' lines are comments
                if (line.startsWith("#")) continue;
                throw new IOException(String.format("Malformed cell record at %s:%d: %s", sourceName, lineNum, e.getMessage()), e);
            }

            try {
                library.addCell(cell);
            } catch (IllegalArgumentException e) {
                throw new IOException(String.format("Malformed cell record at %s:%d: %s", sourceName, lineNum, e.getMessage()), e);
            }
        }
        return library;
    }

    static Cell parseCell(String line) {
        String[] fields = line.split("\\s+");
        if (fields.length < 3 || fields.length > 4) {
            throw new IllegalArgumentException("expected 'name area aspectRatio [fixed]' but got '" + line + "'");
        }
        if (fields[0].length() != 1) {
            throw new IllegalArgumentException("cell name should be a single character: " + fields[0]);
        }

        char name = fields[0].charAt(0);
        double area = Double.parseDouble(fields[1]);
        double aspectRatio = Double.parseDouble(fields[2]);
        boolean fixed = false;
        if (fields.length == 4) {
            fixed = parseFixed(fields[3]);
        }
        return new Cell(name, area, aspectRatio, fixed);
    }

    private static boolean parseFixed(String field) {
        switch (field.toLowerCase()) {
            case "true":
            case "1":
                return true;
            case "false":
            case "0":
                return false;
            default:
                throw new IllegalArgumentException("invalid fixed flag: " + field);
        }
    }
}
