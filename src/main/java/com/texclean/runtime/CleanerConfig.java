package com.texclean.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.texclean.conditional.ConditionalSimplifier;
import com.texclean.text.CommentStripper;
import com.texclean.text.SubstitutionRule;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CleanerConfig {
    private String inputFolder;
    private String outputFolder;
    private boolean resizeImages;
    private int imSize = 500;
    private boolean compressPdf;
    private int pdfImResolution = 500;
    private long pdfTimeoutMs = 10_000;
    private Map<String, Integer> imagesAllowlist = new LinkedHashMap<>();
    private List<String> commandsToDelete = new ArrayList<>();
    private List<String> commandsOnlyToDelete = new ArrayList<>();
    private List<String> environmentsToDelete = new ArrayList<>();
    private List<String> ifExceptions = new ArrayList<>();
    private List<String> commentProtectedCommands = new ArrayList<>(CommentStripper.DEFAULT_PROTECTED_COMMANDS);
    private String useExternalTikz;
    private String svgInkscape;
    private boolean keepBib;
    private List<PatternInsertion> patternsAndInsertions = new ArrayList<>();

    public String getInputFolder() {
        return inputFolder;
    }

    public void setInputFolder(String inputFolder) {
        this.inputFolder = inputFolder;
    }

    public String getOutputFolder() {
        return outputFolder;
    }

    public void setOutputFolder(String outputFolder) {
        this.outputFolder = outputFolder;
    }

    public boolean isResizeImages() {
        return resizeImages;
    }

    public void setResizeImages(boolean resizeImages) {
        this.resizeImages = resizeImages;
    }

    public int getImSize() {
        return imSize;
    }

    public void setImSize(int imSize) {
        this.imSize = imSize;
    }

    public boolean isCompressPdf() {
        return compressPdf;
    }

    public void setCompressPdf(boolean compressPdf) {
        this.compressPdf = compressPdf;
    }

    public int getPdfImResolution() {
        return pdfImResolution;
    }

    public void setPdfImResolution(int pdfImResolution) {
        this.pdfImResolution = pdfImResolution;
    }

    public long getPdfTimeoutMs() {
        return pdfTimeoutMs;
    }

    public void setPdfTimeoutMs(long pdfTimeoutMs) {
        this.pdfTimeoutMs = pdfTimeoutMs;
    }

    public Map<String, Integer> getImagesAllowlist() {
        return imagesAllowlist;
    }

    public void setImagesAllowlist(Map<String, Integer> imagesAllowlist) {
        this.imagesAllowlist = imagesAllowlist == null ? new LinkedHashMap<>() : new LinkedHashMap<>(imagesAllowlist);
    }

    public List<String> getCommandsToDelete() {
        return commandsToDelete;
    }

    public void setCommandsToDelete(List<String> commandsToDelete) {
        this.commandsToDelete = copy(commandsToDelete);
    }

    public List<String> getCommandsOnlyToDelete() {
        return commandsOnlyToDelete;
    }

    public void setCommandsOnlyToDelete(List<String> commandsOnlyToDelete) {
        this.commandsOnlyToDelete = copy(commandsOnlyToDelete);
    }

    public List<String> getEnvironmentsToDelete() {
        return environmentsToDelete;
    }

    public void setEnvironmentsToDelete(List<String> environmentsToDelete) {
        this.environmentsToDelete = copy(environmentsToDelete);
    }

    public List<String> getIfExceptions() {
        return ifExceptions;
    }

    public void setIfExceptions(List<String> ifExceptions) {
        this.ifExceptions = copy(ifExceptions);
    }

    public List<String> getCommentProtectedCommands() {
        return commentProtectedCommands;
    }

    public void setCommentProtectedCommands(List<String> commentProtectedCommands) {
        this.commentProtectedCommands = commentProtectedCommands == null
                ? new ArrayList<>(CommentStripper.DEFAULT_PROTECTED_COMMANDS)
                : new ArrayList<>(commentProtectedCommands);
    }

    public String getUseExternalTikz() {
        return useExternalTikz;
    }

    public void setUseExternalTikz(String useExternalTikz) {
        this.useExternalTikz = useExternalTikz;
    }

    public String getSvgInkscape() {
        return svgInkscape;
    }

    public void setSvgInkscape(String svgInkscape) {
        this.svgInkscape = svgInkscape;
    }

    public boolean isKeepBib() {
        return keepBib;
    }

    public void setKeepBib(boolean keepBib) {
        this.keepBib = keepBib;
    }

    public List<PatternInsertion> getPatternsAndInsertions() {
        return patternsAndInsertions;
    }

    public void setPatternsAndInsertions(List<PatternInsertion> patternsAndInsertions) {
        this.patternsAndInsertions = patternsAndInsertions == null ? new ArrayList<>() : new ArrayList<>(patternsAndInsertions);
    }

    public List<String> conditionalExceptions() {
        List<String> all = new ArrayList<>(ConditionalSimplifier.DEFAULT_EXCEPTIONS);
        all.addAll(ifExceptions);
        return all;
    }

    public List<SubstitutionRule> substitutionRules() {
        return patternsAndInsertions.stream()
                .map(PatternInsertion::toRule)
                .toList();
    }

    public CleanerConfig copy() {
        CleanerConfig copy = new CleanerConfig();
        copy.setInputFolder(inputFolder);
        copy.setOutputFolder(outputFolder);
        copy.setResizeImages(resizeImages);
        copy.setImSize(imSize);
        copy.setCompressPdf(compressPdf);
        copy.setPdfImResolution(pdfImResolution);
        copy.setPdfTimeoutMs(pdfTimeoutMs);
        copy.setImagesAllowlist(imagesAllowlist);
        copy.setCommandsToDelete(commandsToDelete);
        copy.setCommandsOnlyToDelete(commandsOnlyToDelete);
        copy.setEnvironmentsToDelete(environmentsToDelete);
        copy.setIfExceptions(ifExceptions);
        copy.setCommentProtectedCommands(commentProtectedCommands);
        copy.setUseExternalTikz(useExternalTikz);
        copy.setSvgInkscape(svgInkscape);
        copy.setKeepBib(keepBib);
        copy.setPatternsAndInsertions(patternsAndInsertions);
        return copy;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PatternInsertion {
        private String pattern;
        private String insertion;
        private String description = "";
        private boolean stripWhitespace = true;

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public String getInsertion() {
            return insertion;
        }

        public void setInsertion(String insertion) {
            this.insertion = insertion;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public boolean isStripWhitespace() {
            return stripWhitespace;
        }

        public void setStripWhitespace(boolean stripWhitespace) {
            this.stripWhitespace = stripWhitespace;
        }

        SubstitutionRule toRule() {
            if (pattern == null || insertion == null) {
                throw new IllegalArgumentException("patterns_and_insertions entries need both 'pattern' and 'insertion'");
            }
            return new SubstitutionRule(pattern, insertion, description, stripWhitespace);
        }
    }
}
