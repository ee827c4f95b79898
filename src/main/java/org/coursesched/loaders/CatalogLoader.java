package org.coursesched.loaders;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.exceptions.CatalogLoadException;
import org.coursesched.utils.FileUtils;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@UtilityClass
public class CatalogLoader {
    private static final String ERROR_TEXT = "Failed to parse file ";
    private static final String JSON_EXTENSION = ".json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Loads a single catalog file, or every {@code fileNameStart*.json} file of a directory in name order.
     */
    public static List<JsonNode> loadRecords(Path path, String fileNameStart) {
        if (!Files.isDirectory(path)) {
            return parseCatalogFile(path.toFile());
        }

        final var fileList = FileUtils.getFilteredFilesFromDirectory(path, fileNameStart, CatalogLoader::catalogFileFilter);
        if (fileList.isEmpty()) {
            throw new CatalogLoadException("No catalog files starting with '" + fileNameStart + "' in " + path.toAbsolutePath());
        }
        final var result = new ArrayList<JsonNode>();
        for (final var file : fileList) {
            result.addAll(parseCatalogFile(file));
        }
        return result;
    }

    public static List<JsonNode> parseCatalogFile(File file) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(file);
        } catch (Exception e) {
            log.error(ERROR_TEXT + file.getAbsolutePath(), e);
            throw new CatalogLoadException(ERROR_TEXT + file.getAbsolutePath(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CatalogLoadException(ERROR_TEXT + file.getAbsolutePath() + ": expected an array of section records");
        }

        final var result = new ArrayList<JsonNode>(root.size());
        root.forEach(result::add);
        log.info("Loaded {} section records from {}", result.size(), file.getName());
        return result;
    }

    private static boolean catalogFileFilter(File file, String fileNameStart) {
        return file.isFile() && file.getName().startsWith(fileNameStart) && file.getName().endsWith(JSON_EXTENSION);
    }
}
