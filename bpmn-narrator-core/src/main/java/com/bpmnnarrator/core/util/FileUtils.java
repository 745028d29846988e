package com.bpmnnarrator.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    /**
     * Extensions accepted as BPMN input, without dot.
     */
    public static final Set<String> BPMN_EXTENSIONS = Set.of("bpmn", "xml");

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists the BPMN files directly inside a directory, sorted by file name.
     *
     * <p>Only {@code .bpmn} files are listed; {@code .xml} files in a folder are usually not
     * diagrams.
     *
     * @param directory directory to list
     * @return sorted list of {@code .bpmn} files
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> findBpmnFiles(Path directory) throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> "bpmn".equals(getExtension(path).toLowerCase(Locale.ROOT)))
                .sorted()
                .toList();
        }
    }

    /**
     * Checks whether a path has a BPMN input extension ({@code .bpmn} or {@code .xml}).
     *
     * @param path path to check
     * @return true for an accepted extension, case-insensitive
     */
    public static boolean isBpmnFile(Path path) {
        return BPMN_EXTENSIONS.contains(getExtension(path).toLowerCase(Locale.ROOT));
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return file name without extension
     */
    public static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Derives an output file name from an input path.
     *
     * @param input input file
     * @param extension output extension, with or without leading dot
     * @return stem of the input with the new extension
     */
    public static String outputFileName(Path input, String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return ext.isEmpty() ? stem(input) : stem(input) + "." + ext;
    }
}
