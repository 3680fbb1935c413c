package com.texclean.runtime;

import java.util.List;
import java.util.Map;

/**
 * Values given on the command line. {@code null} means "not given" and keeps the configured value.
 */
public record CommandLineOverrides(
        String inputFolder,
        String outputFolder,
        Boolean resizeImages,
        Integer imSize,
        Boolean compressPdf,
        Integer pdfImResolution,
        Map<String, Integer> imagesAllowlist,
        List<String> commandsToDelete,
        List<String> commandsOnlyToDelete,
        List<String> environmentsToDelete,
        List<String> ifExceptions,
        String useExternalTikz,
        String svgInkscape,
        Boolean keepBib) {

    public static CommandLineOverrides none() {
        return new CommandLineOverrides(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
