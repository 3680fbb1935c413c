package com.texclean.files;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;

/**
 * How the host file system separates path components. LaTeX references always use {@code /}, so every
 * file name handed to the engine is first brought into that portable form.
 */
public record PathConvention(String separator) {
    public static final String PORTABLE_SEPARATOR = "/";
    public static final PathConvention UNIX = new PathConvention("/");
    public static final PathConvention WINDOWS = new PathConvention("\\");

    public PathConvention {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
    }

    public static PathConvention of(FileSystem fileSystem) {
        return new PathConvention(fileSystem.getSeparator());
    }

    public static PathConvention system() {
        return of(FileSystems.getDefault());
    }

    public String toPortable(String path) {
        String portable = separator.equals(PORTABLE_SEPARATOR) ? path : path.replace(separator, PORTABLE_SEPARATOR);
        while (portable.startsWith("./")) {
            portable = portable.substring(2);
        }
        return portable;
    }

    public String toPortable(Path path) {
        return toPortable(path.toString());
    }

    public Path resolve(Path root, String portablePath) {
        return root.resolve(portablePath.replace(PORTABLE_SEPARATOR, separator));
    }
}
