package com.texclean.files;

import java.nio.file.Path;
import java.util.List;

/**
 * Downsamples the raster images inside a PDF with ghostscript.
 */
public class PdfCompressor {
    private final ExternalCommandRunner runner;

    public PdfCompressor(ExternalCommandRunner runner) {
        this.runner = runner;
    }

    public CommandResult compress(Path input, Path output, int resolutionDpi) {
        return runner.run(command(input, output, resolutionDpi));
    }

    static List<String> command(Path input, Path output, int resolutionDpi) {
        return List.of(
                "gs",
                "-sDEVICE=pdfwrite",
                "-dCompatibilityLevel=1.4",
                "-dNOPAUSE",
                "-dQUIET",
                "-dBATCH",
                "-dDownsampleColorImages=true",
                "-dColorImageResolution=" + resolutionDpi,
                "-dColorImageDownsampleThreshold=1.0",
                "-dAutoRotatePages=/None",
                "-sOutputFile=" + output,
                input.toString());
    }
}
