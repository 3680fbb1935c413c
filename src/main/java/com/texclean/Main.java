package com.texclean;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.texclean.pipeline.CleaningPipeline;
import com.texclean.pipeline.CleaningReport;
import com.texclean.runtime.CleanerConfig;
import com.texclean.runtime.CommandLineOverrides;
import com.texclean.runtime.ConfigLoader;
import com.texclean.runtime.ConfigMerger;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "tex-cleaner",
        mixinStandardHelpOptions = true,
        version = "tex-cleaner 0.1.0",
        description = "Clean the LaTeX code of your paper before distributing it: drops comments, dead conditional "
                + "branches and unreferenced files.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_OK = 0;
    static final int EXIT_CLEANING_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Parameters(index = "0", arity = "0..1", description = "Input folder containing the LaTeX code")
    String inputFolder;

    @Option(names = { "-c", "--config" }, description = "YAML config file; command line values take precedence")
    Path configPath;

    @Option(names = "--output-folder", description = "Output folder (default: <input_folder>_arXiv)")
    String outputFolder;

    @Option(names = "--resize-images", description = "Resize images")
    Boolean resizeImages;

    @Option(names = "--im-size", description = "Size of the output images in pixels, longest side (default 500)")
    Integer imSize;

    @Option(names = "--compress-pdf", description = "Compress PDF images using ghostscript")
    Boolean compressPdf;

    @Option(names = "--pdf-im-resolution", description = "Resolution in dpi to which PDF images are resampled (default 500)")
    Integer pdfImResolution;

    @Option(names = "--images-allowlist", description = "Per-image size overrides as JSON, e.g. '{\"path/to/im.jpg\": 1000}'")
    String imagesAllowlist;

    @Option(names = "--commands-to-delete", arity = "1..*", description = "LaTeX commands deleted together with their argument, e.g. todo")
    List<String> commandsToDelete;

    @Option(names = "--commands-only-to-delete", arity = "1..*", description = "LaTeX commands deleted while their argument text is kept")
    List<String> commandsOnlyToDelete;

    @Option(names = "--environments-to-delete", arity = "1..*", description = "LaTeX environments deleted with their content")
    List<String> environmentsToDelete;

    @Option(names = "--if-exceptions", arity = "1..*", description = "Commands starting with \\if that are not conditionals")
    List<String> ifExceptions;

    @Option(names = "--use-external-tikz", description = "Folder (relative to input folder) containing externalized tikz figures in PDF format")
    String useExternalTikz;

    @Option(names = "--svg-inkscape", description = "Folder (relative to input folder) containing Inkscape exports of SVG files")
    String svgInkscape;

    @Option(names = "--keep-bib", description = "Keep .bib files")
    Boolean keepBib;

    @Option(names = "--report", description = "Write a JSON report of the run to this path")
    Path reportPath;

    private final ConfigLoader configLoader = new ConfigLoader();
    private final ConfigMerger configMerger = new ConfigMerger();
    private final CleaningPipeline pipeline;

    public Main() {
        this(new CleaningPipeline());
    }

    Main(CleaningPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CleanerConfig config;
        try {
            config = resolveConfig();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        if (config.getInputFolder() == null || config.getInputFolder().isBlank()) {
            log.error("An input folder is required, either as argument or as input_folder in the config file");
            return EXIT_USAGE_ERROR;
        }

        log.info("Cleaning {}", config.getInputFolder());
        CleaningReport report;
        try {
            report = pipeline.run(config);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException e) {
            log.error("Cleaning failed: {}", e.getMessage(), e);
            return EXIT_CLEANING_FAILURE;
        }

        log.info("Kept {} tex files, pruned {}, copied {} figures and {} other files",
                report.texFilesKept().size(),
                report.texFilesPruned().size(),
                report.figuresCopied().size(),
                report.otherFilesCopied().size());
        if (!report.diagnostics().isEmpty()) {
            log.warn("{} file(s) had malformed conditionals and kept them unchanged", report.diagnostics().size());
        }
        if (reportPath != null) {
            try {
                pipeline.writeReport(report, reportPath);
                log.info("Report written to {}", reportPath);
            } catch (IOException e) {
                log.error("Could not write report {}: {}", reportPath, e.getMessage());
                return EXIT_CLEANING_FAILURE;
            }
        }
        return EXIT_OK;
    }

    CleanerConfig resolveConfig() throws IOException {
        if (configPath != null && !Files.exists(configPath)) {
            log.warn("Config file {} not found; using defaults", configPath);
        } else if (configPath != null) {
            log.info("Using config file: {}", configPath);
        }
        CleanerConfig fromFile = configLoader.load(configPath);
        return configMerger.merge(fromFile, overrides());
    }

    CommandLineOverrides overrides() throws JsonProcessingException {
        return new CommandLineOverrides(
                inputFolder,
                outputFolder,
                resizeImages,
                imSize,
                compressPdf,
                pdfImResolution,
                parseAllowlist(imagesAllowlist),
                commandsToDelete,
                commandsOnlyToDelete,
                environmentsToDelete,
                ifExceptions,
                useExternalTikz,
                svgInkscape,
                keepBib);
    }

    static Map<String, Integer> parseAllowlist(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return null;
        }
        return new ObjectMapper().readValue(json, new TypeReference<Map<String, Integer>>() {
        });
    }
}
