package org.coursesched.utils;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.stream.Stream;

@Slf4j
@UtilityClass
public class FileUtils {
    public static List<File> getFilteredFilesFromDirectory(Path directoryPath, String fileNameStart, BiPredicate<File, String> filter) {
        return Stream
                .of(Objects
                        .requireNonNull(directoryPath
                                .toFile()
                                .listFiles()))
                .filter(f -> filter.test(f, fileNameStart))
                .sorted(Comparator.comparing(File::getName))
                .toList();
    }

    public static Path ensureDirectory(Path directoryPath) throws IOException {
        if (!Files.isDirectory(directoryPath)) {
            log.info("Creating directory " + directoryPath.toAbsolutePath());
            Files.createDirectories(directoryPath);
        }
        return directoryPath;
    }

    public static void ensureParentDirectory(Path filePath) throws IOException {
        final var parent = filePath.toAbsolutePath().getParent();
        if (parent != null) ensureDirectory(parent);
    }
}
