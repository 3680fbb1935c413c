package com.texclean.text;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TikzPictureReplacerTest {
    private static final List<String> FIGURES = List.of("ext_tikz/test1.pdf", "ext_tikz/test2.pdf");

    private final TikzPictureReplacer replacer = new TikzPictureReplacer();

    @Test
    void shouldLeaveContentWithoutPicturesUnchanged() {
        assertEquals("Foo\n", replacer.replace("Foo\n", FIGURES));
    }

    @Test
    void shouldKeepPictureWhenNoExternalFigureMatches() {
        String text = "Foo\\tikzsetnextfilename{test_no_match}\n\\begin{tikzpicture}\n\\node (test) at (0,0) {Test1};\n"
                + "\\end{tikzpicture}\nFoo";

        assertEquals(text, replacer.replace(text, FIGURES));
    }

    @Test
    void shouldReplacePictureWithMatchingFigure() {
        String text = "Foo\\tikzsetnextfilename{test2}\n\\begin{tikzpicture}\n\\node (test) at (0,0) {Test1};\n"
                + "\\end{tikzpicture}\nFoo";

        assertEquals("Foo\\includegraphics{ext_tikz/test2.pdf}\nFoo", replacer.replace(text, FIGURES));
    }

    @Test
    void shouldKeepPictureWhenMatchIsAmbiguous() {
        String text = "\\tikzsetnextfilename{test1}\\begin{tikzpicture}\\end{tikzpicture}";

        assertEquals(text, replacer.replace(text, List.of("a/test1.pdf", "b/test1.pdf")));
    }
}
