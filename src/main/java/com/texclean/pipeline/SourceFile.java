package com.texclean.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * A TeX file of the input tree, identified by its relative path. Its body is replaced stage by stage.
 */
public final class SourceFile {
    private final String path;
    private String body;

    public SourceFile(String path, String body) {
        this.path = Objects.requireNonNull(path, "path");
        this.body = Objects.requireNonNull(body, "body");
    }

    public static SourceFile ofLines(String path, List<String> lines) {
        return new SourceFile(path, String.join("", lines));
    }

    public String path() {
        return path;
    }

    public String body() {
        return body;
    }

    public void replaceBody(String body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public String toString() {
        return "SourceFile{" + path + ", " + body.length() + " chars}";
    }
}
