package com.texclean.files;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * The cleaned copy of the input tree. Paths passed in are relative and portable.
 */
public class OutputTree {
    private final Path inputRoot;
    private final Path outputRoot;
    private final PathConvention pathConvention;

    public OutputTree(Path inputRoot, Path outputRoot, PathConvention pathConvention) {
        this.inputRoot = inputRoot;
        this.outputRoot = outputRoot;
        this.pathConvention = pathConvention;
    }

    public static Path defaultOutputFolder(Path inputFolder) {
        Path absolute = inputFolder.toAbsolutePath().normalize();
        return absolute.resolveSibling(absolute.getFileName() + "_arXiv");
    }

    /** Deletes any previous output and creates an empty output folder. */
    public void recreate() throws IOException {
        if (Files.exists(outputRoot)) {
            try (Stream<Path> walk = Files.walk(outputRoot)) {
                for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(path);
                }
            }
        }
        Files.createDirectories(outputRoot);
    }

    public Path write(String relativePath, String content) throws IOException {
        Path target = output(relativePath);
        createParent(target);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }

    public Path copy(String relativePath) throws IOException {
        Path target = output(relativePath);
        createParent(target);
        Files.copy(input(relativePath), target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    public Path input(String relativePath) {
        return pathConvention.resolve(inputRoot, relativePath);
    }

    public Path output(String relativePath) {
        return pathConvention.resolve(outputRoot, relativePath);
    }

    private static void createParent(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
    }
}
