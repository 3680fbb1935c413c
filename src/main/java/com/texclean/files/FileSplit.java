package com.texclean.files;

import java.util.List;
import java.util.stream.Stream;

/**
 * Files of the input tree sorted into the buckets the cleaner treats differently. All names are relative
 * and portable ({@code /}-separated).
 */
public record FileSplit(
        List<String> all,
        List<String> inRoot,
        List<String> notInRoot,
        List<String> toCopyInRoot,
        List<String> toCopyNotInRoot,
        List<String> figures,
        List<String> texInRoot,
        List<String> texNotInRoot,
        List<String> nonTexInRoot,
        List<String> nonTexNotInRoot,
        List<String> externalTikzFigures,
        List<String> svgInkscapeFiles) {

    public FileSplit {
        all = List.copyOf(all);
        inRoot = List.copyOf(inRoot);
        notInRoot = List.copyOf(notInRoot);
        toCopyInRoot = List.copyOf(toCopyInRoot);
        toCopyNotInRoot = List.copyOf(toCopyNotInRoot);
        figures = List.copyOf(figures);
        texInRoot = List.copyOf(texInRoot);
        texNotInRoot = List.copyOf(texNotInRoot);
        nonTexInRoot = List.copyOf(nonTexInRoot);
        nonTexNotInRoot = List.copyOf(nonTexNotInRoot);
        externalTikzFigures = List.copyOf(externalTikzFigures);
        svgInkscapeFiles = List.copyOf(svgInkscapeFiles);
    }

    public List<String> allTex() {
        return Stream.concat(texInRoot.stream(), texNotInRoot.stream()).toList();
    }
}
