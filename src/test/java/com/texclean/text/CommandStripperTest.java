package com.texclean.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CommandStripperTest {
    private final CommandStripper stripper = new CommandStripper();

    @Test
    void shouldDeleteCommandSpanningLines() {
        assertEquals("AD\nE", stripper.delete("A\\todo{B\nC}D\nE", "todo"));
    }

    @Test
    void shouldLeaveCommentMarkerWhenCommandIsAloneOnItsLine() {
        assertEquals("A\n%\nD", stripper.delete("A\n\\todo{B\nC}\nD", "todo"));
    }

    @Test
    void shouldDeleteOptionGroupsAroundTheArgument() {
        assertEquals("AB", stripper.delete("A\\todo[inline]{note}[x]B", "todo"));
    }

    @Test
    void shouldDeleteNestedBraces() {
        assertEquals("AE", stripper.delete("A\\todo{B{C}D}E", "todo"));
    }

    @Test
    void shouldNotMatchLongerCommandNames() {
        String text = "\\todonotes{keep}\\todo{drop}";

        assertEquals("\\todonotes{keep}", stripper.delete(text, "todo"));
    }

    @Test
    void shouldSkipUnbalancedInvocations() {
        String text = "A\\todo{B";

        assertEquals(text, stripper.delete(text, "todo"));
    }

    @Test
    void shouldKeepArgumentTextWhenUnwrapping() {
        assertEquals("ABC\nD", stripper.unwrap("A\\red{BC}\nD", "red"));
        assertEquals("AB\nCD\nE", stripper.unwrap("A\\red{B\nC}D\nE", "red"));
    }

    @Test
    void shouldUnwrapNestedInvocationsOfTheSameCommand() {
        assertEquals("ABCD", stripper.unwrap("A\\red{B\\red{C}}D", "red"));
    }

    @Test
    void shouldUnwrapDeeplyNestedInvocations() {
        String text = "\\emph{a\\emph{b\\emph{c\\emph{d}}}}";

        assertEquals("abcd", stripper.unwrap(text, "emph"));
    }

    @Test
    void shouldLeaveOtherCommandsAlone() {
        String text = "\\textbf{A} \\emph{B}";

        assertEquals("\\textbf{A} B", stripper.unwrap(text, "emph"));
    }
}
