package com.texclean.files;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies a referenced figure into the output tree, resizing raster images and recompressing PDFs when asked.
 * Per-file sizes from the allowlist take precedence over the defaults.
 */
public class FigureProcessor {
    private static final Logger log = LoggerFactory.getLogger(FigureProcessor.class);

    private final ImageResizer imageResizer;
    private final PdfCompressor pdfCompressor;
    private final Settings settings;

    public FigureProcessor(ImageResizer imageResizer, PdfCompressor pdfCompressor, Settings settings) {
        this.imageResizer = imageResizer;
        this.pdfCompressor = pdfCompressor;
        this.settings = settings;
    }

    public Outcome process(String figure, OutputTree tree) throws IOException {
        Path input = tree.input(figure);
        Path output = tree.output(figure);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }

        if (settings.resizeImages() && ImageResizer.supports(figure)) {
            int maxSide = settings.allowlist().getOrDefault(figure, settings.imageSize());
            try {
                imageResizer.resize(input, output, maxSide);
                return Outcome.RESIZED;
            } catch (IOException e) {
                log.warn("Could not resize {} ({}); copying it unchanged", figure, e.getMessage());
            }
        }
        if (settings.compressPdf() && ImageResizer.extension(figure).equals("pdf")) {
            int resolution = settings.allowlist().getOrDefault(figure, settings.pdfResolution());
            CommandResult result = pdfCompressor.compress(input, output, resolution);
            if (result.isSuccess() && Files.exists(output)) {
                return Outcome.COMPRESSED;
            }
            log.warn("PDF compression of {} failed ({}); copying it unchanged", figure, result.failureReason());
        }
        tree.copy(figure);
        return Outcome.COPIED;
    }

    public enum Outcome {
        COPIED,
        RESIZED,
        COMPRESSED
    }

    public record Settings(
            boolean resizeImages,
            int imageSize,
            boolean compressPdf,
            int pdfResolution,
            Map<String, Integer> allowlist) {

        public Settings {
            allowlist = Map.copyOf(allowlist);
        }
    }
}
