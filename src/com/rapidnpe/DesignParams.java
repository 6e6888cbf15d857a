package com.rapidnpe;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

public class DesignParams {
    private String designName;
    private Path cellLibraryPath;
    private List<String> npes;
    private Path workDir;

    private Boolean verbose = false;
    private Boolean writeReport = true;

    private static class ParamsJson {
        public String designName;
        public String cellLibraryPath;
        public List<String> npes;
        public String workDir;
        public Boolean verbose;
        public Boolean writeReport;
    }

    public DesignParams(Path jsonFilePath) throws IOException {
        Gson gson = new GsonBuilder().create();
        ParamsJson params;
        try (Reader reader = Files.newBufferedReader(jsonFilePath, StandardCharsets.UTF_8)) {
            params = gson.fromJson(reader, ParamsJson.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed json file " + jsonFilePath + ": " + e.getMessage(), e);
        }
        if (params == null) {
            throw new IllegalArgumentException("Empty json file: " + jsonFilePath);
        }

        // paths in the json file are relative to the file itself
        Path baseDir = jsonFilePath.toAbsolutePath().getParent();

        if (params.designName == null || params.designName.isEmpty()) {
            throw new IllegalArgumentException("designName not found in json file: " + jsonFilePath);
        }
        designName = params.designName;

        if (params.cellLibraryPath == null) {
            throw new IllegalArgumentException("cellLibraryPath not found in json file: " + jsonFilePath);
        }
        cellLibraryPath = baseDir.resolve(params.cellLibraryPath).normalize();

        if (params.npes == null || params.npes.isEmpty()) {
            throw new IllegalArgumentException("npes not found in json file: " + jsonFilePath);
        }
        npes = new ArrayList<>();
        for (String npe : params.npes) {
            if (npe == null) {
                throw new IllegalArgumentException("null entry in npes of json file: " + jsonFilePath);
            }
            npes.add(npe.trim());
        }

        if (params.workDir != null) {
            workDir = baseDir.resolve(params.workDir).resolve(designName).normalize();
        } else {
            workDir = Path.of("workspace").toAbsolutePath().resolve(designName);
        }

        if (params.verbose != null) {
            verbose = params.verbose;
        }

        if (params.writeReport != null) {
            writeReport = params.writeReport;
        }
    }

    // getters
    public String getDesignName() {
        return designName;
    }

    public Path getCellLibraryPath() {
        return cellLibraryPath;
    }

    public List<String> getNpes() {
        return Collections.unmodifiableList(npes);
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Boolean isVerbose() {
        return verbose;
    }

    public Boolean isWriteReport() {
        return writeReport;
    }
}
