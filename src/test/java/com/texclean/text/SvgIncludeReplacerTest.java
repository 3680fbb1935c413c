package com.texclean.text;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SvgIncludeReplacerTest {
    private final SvgIncludeReplacer replacer = new SvgIncludeReplacer();

    @Test
    void shouldSwitchToInkscapeExportKeepingOptions() {
        String text = "\\includesvg[width=0.5\\linewidth]{figs/drawing}";
        List<String> exports = List.of("svg-inkscape/drawing-tex.pdf_tex", "svg-inkscape/other-tex.pdf_tex");

        assertEquals("\\includeinkscape[width=0.5\\linewidth]{svg-inkscape/drawing-tex.pdf_tex}",
                replacer.replace(text, exports));
    }

    @Test
    void shouldSwitchWithoutOptions() {
        assertEquals("\\includeinkscape{svg-inkscape/drawing-tex.pdf_tex}",
                replacer.replace("\\includesvg{drawing}", List.of("svg-inkscape/drawing-tex.pdf_tex")));
    }

    @Test
    void shouldKeepIncludeWhenNoExportExists() {
        String text = "\\includesvg{missing}";

        assertEquals(text, replacer.replace(text, List.of("svg-inkscape/drawing-tex.pdf_tex")));
    }
}
