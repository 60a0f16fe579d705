package com.example.demo.pdfform.fill;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Output naming shared by the inspect and fill commands.
 */
public final class OutputPaths {
    public static final String FILLED_SUFFIX = "_filled.pdf";
    public static final String FLAT_SUFFIX = "_flat.pdf";
    public static final String TEMPLATE_SUFFIX = "_template.json";

    private OutputPaths() {
    }

    /**
     * Explicit file wins; otherwise {@code <dir>/<base><suffix>}; otherwise {@code <base><suffix>}
     * in the working directory.
     */
    public static Path resolve(Path explicitFile, Path outputDir, String baseName, String suffix) {
        if (explicitFile != null) {
            return explicitFile;
        }
        if (outputDir != null) {
            return outputDir.resolve(baseName + suffix);
        }
        return Paths.get(baseName + suffix);
    }

    /**
     * Interpret a single user-supplied output argument: an existing directory, or anything
     * without a file extension, is a directory; the rest is a file path.
     */
    public static Path resolveArgument(String output, String baseName, String suffix) {
        if (output == null || output.isBlank()) {
            return resolve(null, null, baseName, suffix);
        }
        Path path = Paths.get(output);
        if (isDirectoryArgument(output)) {
            return resolve(null, path, baseName, suffix);
        }
        return resolve(path, null, baseName, suffix);
    }

    /**
     * True when {@code output} names a directory: an existing one, or a path without a file extension.
     */
    public static boolean isDirectoryArgument(String output) {
        Path path = Paths.get(output);
        return Files.isDirectory(path) || !hasExtension(path);
    }

    public static String baseName(Path file) {
        return baseName(file.getFileName().toString());
    }

    public static String baseName(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String name = slash >= 0 ? fileName.substring(slash + 1) : fileName;
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * {@code a/b_filled.pdf -> a/b_filled_flat.pdf}
     */
    public static Path flattenedSibling(Path filled) {
        return filled.resolveSibling(baseName(filled) + FLAT_SUFFIX);
    }

    public static void ensureParentDirectory(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static boolean hasExtension(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1;
    }
}
