package com.texclean.runtime;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CleanerConfigDefaultsTest {

    @Test
    void shouldDefaultToCopyingFiguresUntouched() {
        CleanerConfig config = new CleanerConfig();

        assertNull(config.getInputFolder());
        assertFalse(config.isResizeImages());
        assertFalse(config.isCompressPdf());
        assertFalse(config.isKeepBib());
        assertEquals(500, config.getImSize());
        assertEquals(500, config.getPdfImResolution());
        assertEquals(10_000, config.getPdfTimeoutMs());
        assertEquals(List.of("url", "href"), config.getCommentProtectedCommands());
        assertTrue(config.getCommandsToDelete().isEmpty());
        assertTrue(config.substitutionRules().isEmpty());
    }

    @Test
    void shouldAppendCustomConditionalExceptionsToDefaults() {
        CleanerConfig config = new CleanerConfig();
        config.setIfExceptions(List.of("ifmycustomtest"));

        List<String> exceptions = config.conditionalExceptions();

        assertTrue(exceptions.contains("ifthenelse"));
        assertEquals("ifmycustomtest", exceptions.get(exceptions.size() - 1));
    }

    @Test
    void shouldTreatNullListsAsEmpty() {
        CleanerConfig config = new CleanerConfig();
        config.setCommandsToDelete(null);
        config.setImagesAllowlist(null);
        config.setCommentProtectedCommands(null);

        assertTrue(config.getCommandsToDelete().isEmpty());
        assertTrue(config.getImagesAllowlist().isEmpty());
        assertEquals(List.of("url", "href"), config.getCommentProtectedCommands());
    }

    @Test
    void shouldCopyIndependently() {
        CleanerConfig config = new CleanerConfig();
        config.setCommandsToDelete(List.of("todo"));

        CleanerConfig copy = config.copy();
        copy.getCommandsToDelete().add("note");

        assertEquals(List.of("todo"), config.getCommandsToDelete());
        assertNotSame(config.getImagesAllowlist(), copy.getImagesAllowlist());
    }

    @Test
    void shouldRejectIncompleteSubstitutionRules() {
        CleanerConfig.PatternInsertion entry = new CleanerConfig.PatternInsertion();
        entry.setPattern("a");
        CleanerConfig config = new CleanerConfig();
        config.setPatternsAndInsertions(List.of(entry));

        assertThrows(IllegalArgumentException.class, config::substitutionRules);
    }
}
