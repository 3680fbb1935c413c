package com.texclean;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.texclean.runtime.CleanerConfig;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private Path paper() throws Exception {
        Path paper = tempDir.resolve("paper");
        Files.createDirectories(paper);
        Files.writeString(paper.resolve("main.tex"), "Text \\todo{x} % gone\n\\note{y}\n");
        return paper;
    }

    @Test
    void shouldRequireInputFolder() {
        int exitCode = new CommandLine(new Main()).execute();

        assertEquals(Main.EXIT_USAGE_ERROR, exitCode);
    }

    @Test
    void shouldRejectMissingInputFolder() {
        int exitCode = new CommandLine(new Main()).execute(tempDir.resolve("absent").toString());

        assertEquals(Main.EXIT_USAGE_ERROR, exitCode);
    }

    @Test
    void shouldRejectOutputFolderOverlappingInput() throws Exception {
        Path paper = paper();

        int exitCode = new CommandLine(new Main()).execute(paper.toString(), "--output-folder", tempDir.toString());

        assertEquals(Main.EXIT_USAGE_ERROR, exitCode);
        assertTrue(Files.exists(paper.resolve("main.tex")));
    }

    @Test
    void shouldRejectMalformedAllowlist() throws Exception {
        int exitCode = new CommandLine(new Main()).execute(paper().toString(), "--images-allowlist", "{not json");

        assertEquals(Main.EXIT_USAGE_ERROR, exitCode);
    }

    @Test
    void shouldCleanIntoDefaultOutputFolder() throws Exception {
        Path paper = paper();

        int exitCode = new CommandLine(new Main()).execute(paper.toString(), "--commands-to-delete", "todo", "note");

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals("Text  %\n%\n", Files.readString(tempDir.resolve("paper_arXiv/main.tex")));
    }

    @Test
    void shouldLetCommandLineOverrideConfigAndWriteReport() throws Exception {
        Path paper = paper();
        Path out = tempDir.resolve("cleaned");
        Path report = tempDir.resolve("report.json");
        Path config = tempDir.resolve("cleaner.yaml");
        Files.writeString(config, """
                input_folder: %s
                output_folder: %s
                commands_to_delete: [note]
                """.formatted(tempDir.resolve("elsewhere").toString().replace('\\', '/'),
                out.toString().replace('\\', '/')));

        int exitCode = new CommandLine(new Main()).execute(
                paper.toString(),
                "--config", config.toString(),
                "--commands-to-delete", "todo",
                "--report", report.toString());

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals("Text  %\n%\n", Files.readString(out.resolve("main.tex")));
        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertEquals("main.tex", json.get("texFilesKept").get(0).asText());
        assertFalse(Files.exists(tempDir.resolve("elsewhere")));
    }

    @Test
    void shouldMergeOptionsIntoConfig() throws Exception {
        Main main = new Main();
        new CommandLine(main).parseArgs(
                "in", "--resize-images", "--im-size", "800", "--images-allowlist", "{\"a.png\": 1000}",
                "--if-exceptions", "ifmine");

        CleanerConfig config = main.resolveConfig();

        assertEquals("in", config.getInputFolder());
        assertTrue(config.isResizeImages());
        assertEquals(800, config.getImSize());
        assertEquals(Integer.valueOf(1000), config.getImagesAllowlist().get("a.png"));
        assertTrue(config.conditionalExceptions().contains("ifmine"));
        assertFalse(config.isCompressPdf());
    }

    @Test
    void shouldTreatBlankAllowlistAsAbsent() throws Exception {
        assertNull(Main.parseAllowlist(" "));
        assertNull(Main.parseAllowlist(null));
    }
}
