package com.rapidnpe.utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class DirectoryManager {

    private final Path rootDir;

    public DirectoryManager(Path rootDir) throws IOException {
        this.rootDir = rootDir.toAbsolutePath();
        Files.createDirectories(this.rootDir);
    }

    public Path getRootDir() {
        return rootDir;
    }

    public Path resolve(String fileName) {
        return rootDir.resolve(fileName);
    }
}
