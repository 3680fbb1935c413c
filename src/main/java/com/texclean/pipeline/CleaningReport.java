package com.texclean.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CleaningReport(
        String inputFolder,
        String outputFolder,
        List<String> texFilesKept,
        List<String> texFilesPruned,
        List<String> otherFilesCopied,
        Map<String, String> figuresCopied,
        List<FileDiagnostic> diagnostics,
        Instant startedAt,
        Instant finishedAt) {

    public record FileDiagnostic(String file, String failure, String message) {
    }
}
