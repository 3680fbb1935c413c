package com.texclean.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.texclean.conditional.ConditionalDiagnostic;
import com.texclean.files.ExternalCommandRunner;
import com.texclean.files.FigureProcessor;
import com.texclean.files.FileSplit;
import com.texclean.files.FileSplitter;
import com.texclean.files.ImageResizer;
import com.texclean.files.OutputTree;
import com.texclean.files.PathConvention;
import com.texclean.files.PdfCompressor;
import com.texclean.files.TexSourceReader;
import com.texclean.reference.ReferenceResolver;
import com.texclean.reference.TransitiveReferenceClosure;
import com.texclean.runtime.CleanerConfig;
import com.texclean.text.PatternSubstituter;
import com.texclean.text.SvgIncludeReplacer;
import com.texclean.text.TikzPictureReplacer;

/**
 * Cleans a whole LaTeX tree: reads every TeX file, runs the per-file stages, keeps the TeX files reachable
 * from the root directory, and copies only the figures and other files the kept sources still reference.
 */
public class CleaningPipeline {
    private static final Logger log = LoggerFactory.getLogger(CleaningPipeline.class);

    private final PathConvention pathConvention;
    private final TexSourceReader reader = new TexSourceReader();
    private final SvgIncludeReplacer svgIncludeReplacer = new SvgIncludeReplacer();
    private final TikzPictureReplacer tikzPictureReplacer = new TikzPictureReplacer();
    private final PatternSubstituter patternSubstituter = new PatternSubstituter();
    private final TransitiveReferenceClosure closure = new TransitiveReferenceClosure();
    private final ReferenceResolver referenceResolver;
    private final Clock clock;

    public CleaningPipeline() {
        this(PathConvention.system(), Clock.systemUTC());
    }

    public CleaningPipeline(PathConvention pathConvention, Clock clock) {
        this.pathConvention = pathConvention;
        this.referenceResolver = new ReferenceResolver(pathConvention);
        this.clock = clock;
    }

    public CleaningReport run(CleanerConfig config) throws IOException {
        Instant startedAt = clock.instant();
        Path inputFolder = resolveInputFolder(config);
        Path outputFolder = config.getOutputFolder() == null || config.getOutputFolder().isBlank()
                ? OutputTree.defaultOutputFolder(inputFolder)
                : Path.of(config.getOutputFolder()).toAbsolutePath().normalize();
        checkFoldersDisjoint(inputFolder, outputFolder);

        log.info("Collecting file structure.");
        OutputTree tree = new OutputTree(inputFolder, outputFolder, pathConvention);
        FileSplit splits = new FileSplitter(pathConvention).split(inputFolder, new FileSplitter.SplitOptions(
                config.isKeepBib(), config.getUseExternalTikz(), config.getSvgInkscape()));
        tree.recreate();

        log.info("Reading all tex files");
        Map<String, SourceFile> sources = new LinkedHashMap<>();
        for (String texFile : splits.allTex()) {
            sources.put(texFile, SourceFile.ofLines(texFile, reader.read(tree.input(texFile))));
        }

        List<CleaningReport.FileDiagnostic> diagnostics = cleanSources(sources.values(), config);
        for (SourceFile source : sources.values()) {
            log.info("Replacing \\includesvg calls in file {}.", source.path());
            source.replaceBody(svgIncludeReplacer.replace(source.body(), splits.svgInkscapeFiles()));
            log.info("Replacing Tikz Pictures in file {}.", source.path());
            source.replaceBody(tikzPictureReplacer.replace(source.body(), splits.externalTikzFigures()));
        }

        List<String> texToCopy = texFilesToCopy(sources, splits);
        for (String texFile : texToCopy) {
            SourceFile source = sources.get(texFile);
            log.info("Replacing patterns in file {}.", texFile);
            source.replaceBody(patternSubstituter.apply(source.body(), config.substitutionRules()));
            Path written = tree.write(texFile, source.body());
            log.info("Writing modified contents to {}.", written);
        }

        String corpus = texToCopy.stream()
                .map(texFile -> sources.get(texFile).body())
                .collect(Collectors.joining("\n"));

        List<String> otherFilesCopied = new ArrayList<>();
        for (String file : referenceResolver.keepReferenced(splits.nonTexNotInRoot(), corpus, true)) {
            tree.copy(file);
            otherFilesCopied.add(file);
        }
        for (String file : splits.nonTexInRoot()) {
            log.info("Copying non-tex file {}.", file);
            tree.copy(file);
            otherFilesCopied.add(file);
        }

        FigureProcessor figureProcessor = figureProcessor(config);
        Map<String, String> figuresCopied = new LinkedHashMap<>();
        for (String figure : referenceResolver.keepReferenced(splits.figures(), corpus, false)) {
            figuresCopied.put(figure, figureProcessor.process(figure, tree).name());
        }

        log.info("Outputs written to {}", outputFolder);
        List<String> pruned = splits.allTex().stream()
                .filter(texFile -> !texToCopy.contains(texFile))
                .toList();
        return new CleaningReport(
                inputFolder.toString(),
                outputFolder.toString(),
                texToCopy,
                pruned,
                otherFilesCopied,
                figuresCopied,
                diagnostics,
                startedAt,
                clock.instant());
    }

    public void writeReport(CleaningReport report, Path reportPath) throws IOException {
        ObjectMapper mapper = JsonMapper.builder()
                .findAndAddModules()
                .build();
        if (reportPath.toAbsolutePath().getParent() != null) {
            Files.createDirectories(reportPath.toAbsolutePath().getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
    }

    List<CleaningReport.FileDiagnostic> cleanSources(Iterable<SourceFile> sources, CleanerConfig config) {
        TexCleaner cleaner = new TexCleaner(new TexCleaner.Rules(
                config.getCommandsToDelete(),
                config.getCommandsOnlyToDelete(),
                config.getEnvironmentsToDelete(),
                config.getIfExceptions(),
                config.getCommentProtectedCommands()));
        List<CleaningReport.FileDiagnostic> diagnostics = new ArrayList<>();
        for (SourceFile source : sources) {
            Optional<ConditionalDiagnostic> diagnostic = cleaner.clean(source);
            diagnostic.ifPresent(found -> diagnostics.add(new CleaningReport.FileDiagnostic(
                    source.path(), found.failure().name(), found.message())));
        }
        return diagnostics;
    }

    List<String> texFilesToCopy(Map<String, SourceFile> sources, FileSplit splits) {
        Map<String, String> bodies = new LinkedHashMap<>();
        sources.forEach((path, source) -> bodies.put(path, source.body()));
        Set<String> reachable = closure.compute(bodies, splits.texInRoot());
        return splits.allTex().stream()
                .filter(reachable::contains)
                .toList();
    }

    private FigureProcessor figureProcessor(CleanerConfig config) {
        ExternalCommandRunner runner = new ExternalCommandRunner(Duration.ofMillis(config.getPdfTimeoutMs()));
        return new FigureProcessor(
                new ImageResizer(),
                new PdfCompressor(runner),
                new FigureProcessor.Settings(
                        config.isResizeImages(),
                        config.getImSize(),
                        config.isCompressPdf(),
                        config.getPdfImResolution(),
                        config.getImagesAllowlist()));
    }

    private static Path resolveInputFolder(CleanerConfig config) {
        if (config.getInputFolder() == null || config.getInputFolder().isBlank()) {
            throw new IllegalArgumentException("No input folder given");
        }
        Path inputFolder = Path.of(config.getInputFolder()).toAbsolutePath().normalize();
        if (!Files.isDirectory(inputFolder)) {
            throw new IllegalArgumentException("Input folder does not exist or is not a directory: " + inputFolder);
        }
        return inputFolder;
    }

    // The output folder is wiped before writing, so it must not overlap the sources.
    private static void checkFoldersDisjoint(Path inputFolder, Path outputFolder) {
        if (inputFolder.startsWith(outputFolder) || outputFolder.startsWith(inputFolder)) {
            throw new IllegalArgumentException(
                    "Output folder " + outputFolder + " overlaps input folder " + inputFolder);
        }
    }
}
