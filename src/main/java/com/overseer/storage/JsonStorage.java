package com.overseer.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads and writes ordered JSON lists on disk.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static <T> List<T> readJsonList(Path path, Class<T[]> clazz) throws IOException {
        if (path == null || !Files.exists(path)) {
            return Collections.emptyList();
        }
        T[] items = mapper.readValue(path.toFile(), clazz);
        if (items == null || items.length == 0) {
            return Collections.emptyList();
        }
        return new ArrayList<>(Arrays.asList(items));
    }

    /**
     * Write through a sibling temp file so a crash mid-write never leaves a truncated list.
     */
    public static void writeJsonList(Path path, List<?> data) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), data);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
