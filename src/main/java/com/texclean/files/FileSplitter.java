package com.texclean.files;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class FileSplitter {
    public static final List<String> FILES_TO_DELETE = List.of(
            "\\.aux$", "\\.sh$", "\\.blg$", "\\.brf$", "\\.log$", "\\.out$", "\\.ps$", "\\.dvi$",
            "\\.synctex\\.gz$", "~$", "\\.backup$", "\\.gitignore$", "\\.DS_Store$", "\\.svg$", "^\\.idea",
            "\\.dpth$", "\\.md5$", "\\.dep$", "\\.auxlock$", "\\.fls$", "\\.fdb_latexmk$");
    public static final String BIB_PATTERN = "\\.bib$";
    public static final List<String> FIGURE_PATTERNS = List.of("\\.png$", "\\.jpg$", "\\.jpeg$", "\\.pdf$");
    public static final List<String> TEX_PATTERNS = List.of("\\.tex$", "\\.tikz$");
    private static final Pattern GIT_DIRECTORY = Pattern.compile("(^|/)\\.git/");

    private final PathConvention pathConvention;

    public FileSplitter(PathConvention pathConvention) {
        this.pathConvention = pathConvention;
    }

    public FileSplit split(Path inputFolder, SplitOptions options) throws IOException {
        List<String> all = listAllFiles(inputFolder);
        List<String> inRoot = all.stream().filter(file -> !file.contains("/")).toList();
        List<String> notInRoot = all.stream().filter(file -> file.contains("/")).toList();
        return split(all, inRoot, notInRoot, options);
    }

    FileSplit split(List<String> all, List<String> inRoot, List<String> notInRoot, SplitOptions options) {
        List<Pattern> toDelete = compile(FILES_TO_DELETE);
        if (!options.keepBib()) {
            toDelete.add(Pattern.compile(BIB_PATTERN));
        }
        List<Pattern> figurePatterns = compile(FIGURE_PATTERNS);
        List<Pattern> texPatterns = compile(TEX_PATTERNS);

        List<Pattern> notCopiedDirectly = new ArrayList<>(toDelete);
        notCopiedDirectly.addAll(figurePatterns);

        List<String> toCopyInRoot = removePattern(inRoot, notCopiedDirectly);
        List<String> toCopyNotInRoot = removePattern(notInRoot, notCopiedDirectly);

        return new FileSplit(
                all,
                inRoot,
                notInRoot,
                toCopyInRoot,
                toCopyNotInRoot,
                keepPattern(all, figurePatterns),
                keepPattern(toCopyInRoot, texPatterns),
                keepPattern(toCopyNotInRoot, texPatterns),
                removePattern(toCopyInRoot, texPatterns),
                removePattern(toCopyNotInRoot, texPatterns),
                folderContents(all, options.externalTikzFolder()),
                folderContents(all, options.svgInkscapeFolder()));
    }

    public List<String> listAllFiles(Path inputFolder) throws IOException {
        try (Stream<Path> walk = Files.walk(inputFolder)) {
            return walk.filter(Files::isRegularFile)
                    .map(file -> pathConvention.toPortable(inputFolder.relativize(file)))
                    .filter(file -> !GIT_DIRECTORY.matcher(file).find())
                    .sorted()
                    .toList();
        }
    }

    public static List<String> keepPattern(List<String> haystack, List<Pattern> patterns) {
        return haystack.stream()
                .filter(item -> patterns.stream().anyMatch(pattern -> pattern.matcher(item).find()))
                .toList();
    }

    public static List<String> removePattern(List<String> haystack, List<Pattern> patterns) {
        return haystack.stream()
                .filter(item -> patterns.stream().noneMatch(pattern -> pattern.matcher(item).find()))
                .toList();
    }

    private List<String> folderContents(List<String> all, String folder) {
        if (folder == null || folder.isBlank()) {
            return List.of();
        }
        return keepPattern(all, List.of(Pattern.compile(Pattern.quote(pathConvention.toPortable(folder)))));
    }

    private static List<Pattern> compile(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
        }
        return compiled;
    }

    public record SplitOptions(boolean keepBib, String externalTikzFolder, String svgInkscapeFolder) {
    }
}
