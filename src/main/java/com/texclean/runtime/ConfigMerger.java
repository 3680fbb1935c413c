package com.texclean.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layers command line values over a loaded config: scalars replace, lists are prepended, maps are merged
 * with the command line winning per key.
 */
public class ConfigMerger {

    public CleanerConfig merge(CleanerConfig base, CommandLineOverrides overrides) {
        CleanerConfig merged = base.copy();
        if (overrides.inputFolder() != null) {
            merged.setInputFolder(overrides.inputFolder());
        }
        if (overrides.outputFolder() != null) {
            merged.setOutputFolder(overrides.outputFolder());
        }
        if (overrides.resizeImages() != null) {
            merged.setResizeImages(overrides.resizeImages());
        }
        if (overrides.imSize() != null) {
            merged.setImSize(overrides.imSize());
        }
        if (overrides.compressPdf() != null) {
            merged.setCompressPdf(overrides.compressPdf());
        }
        if (overrides.pdfImResolution() != null) {
            merged.setPdfImResolution(overrides.pdfImResolution());
        }
        if (overrides.useExternalTikz() != null) {
            merged.setUseExternalTikz(overrides.useExternalTikz());
        }
        if (overrides.svgInkscape() != null) {
            merged.setSvgInkscape(overrides.svgInkscape());
        }
        if (overrides.keepBib() != null) {
            merged.setKeepBib(overrides.keepBib());
        }
        merged.setImagesAllowlist(mergeMaps(base.getImagesAllowlist(), overrides.imagesAllowlist()));
        merged.setCommandsToDelete(prepend(overrides.commandsToDelete(), base.getCommandsToDelete()));
        merged.setCommandsOnlyToDelete(prepend(overrides.commandsOnlyToDelete(), base.getCommandsOnlyToDelete()));
        merged.setEnvironmentsToDelete(prepend(overrides.environmentsToDelete(), base.getEnvironmentsToDelete()));
        merged.setIfExceptions(prepend(overrides.ifExceptions(), base.getIfExceptions()));
        return merged;
    }

    private static List<String> prepend(List<String> first, List<String> rest) {
        List<String> combined = new ArrayList<>();
        if (first != null) {
            combined.addAll(first);
        }
        combined.addAll(rest);
        return combined;
    }

    private static Map<String, Integer> mergeMaps(Map<String, Integer> base, Map<String, Integer> overrides) {
        Map<String, Integer> merged = new LinkedHashMap<>(base);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return merged;
    }
}
