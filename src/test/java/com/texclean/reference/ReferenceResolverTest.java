package com.texclean.reference;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.texclean.files.PathConvention;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReferenceResolverTest {
    private static final List<String> CLEARLY_OTHER_FILES = List.of(
            "{from/img.ext}",
            "{from/img}",
            "{imgoext}",
            "{from/imgo}",
            "{ \n long/\npath/to/img.ext\n}",
            "{path/img.ext}",
            "{long/img.ext}",
            "{long/path/img.ext}",
            "{long/to/img.ext}",
            "{path/img}",
            "{long/img}",
            "{long/path/img}",
            "{long/to/img}");

    private final ReferenceResolver resolver = new ReferenceResolver(PathConvention.UNIX);

    private void assertReferenced(String filename, boolean strict, List<String> contents) {
        for (String content : contents) {
            assertTrue(resolver.isReferenced(filename, content, strict), () -> filename + " should match " + content);
        }
    }

    private void assertNotReferenced(String filename, boolean strict, List<String> contents) {
        for (String content : contents) {
            assertFalse(resolver.isReferenced(filename, content, strict), () -> filename + " should not match " + content);
        }
    }

    @Test
    void shouldMatchAnySuffixOfThreeParentPathLoosely() {
        String filename = "long/path/to/img.ext";

        assertReferenced(filename, false, List.of(
                "{img.ext}", "{to/img.ext}", "{path/to/img.ext}", "{long/path/to/img.ext}",
                "{%\nimg.ext  }", "{to/img.ext % \n}", "{  \npath/to/img.ext\n}", "{ \n \nlong/path/to/img.ext\n}",
                "{img}", "{to/img}", "{path/to/img}", "{long/path/to/img}"));
        assertNotReferenced(filename, false, CLEARLY_OTHER_FILES);
    }

    @Test
    void shouldRejectLongerPathsThanTheFileHas() {
        String filename = "path/to/img.ext";

        assertReferenced(filename, false, List.of(
                "{img.ext}", "{to/img.ext}", "{path/to/img.ext}", "{%\nimg.ext  }", "{to/img.ext % \n}",
                "{  \npath/to/img.ext\n}", "{img}", "{to/img}", "{path/to/img}"));
        assertNotReferenced(filename, false, List.of(
                "{long/path/to/img.ext}", "{ \n \nlong/path/to/img.ext\n}", "{long/path/to/img}"));
        assertNotReferenced(filename, false, CLEARLY_OTHER_FILES);
    }

    @Test
    void shouldMatchOneParentPathLoosely() {
        String filename = "to/img.ext";

        assertReferenced(filename, false, List.of(
                "{img.ext}", "{to/img.ext}", "{%\nimg.ext  }", "{to/img.ext % \n}", "{img}", "{to/img}"));
        assertNotReferenced(filename, false, List.of(
                "{long/path/to/img}", "{path/to/img}", "{ \n \nlong/path/to/img.ext\n}", "{  \npath/to/img.ext\n}",
                "{long/path/to/img.ext}", "{path/to/img.ext}"));
        assertNotReferenced(filename, false, CLEARLY_OTHER_FILES);
    }

    @Test
    void shouldRequireFullPathWithExtensionWhenStrict() {
        String filename = "path/to/img.ext";

        assertReferenced(filename, true, List.of("{path/to/img.ext}", "{  \npath/to/img.ext\n}"));
        assertNotReferenced(filename, true, List.of(
                "{img.ext}", "{to/img.ext}", "{%\nimg.ext  }", "{to/img.ext % \n}", "{img}", "{to/img}",
                "{path/to/img}", "{long/path/to/img.ext}", "{ \n \nlong/path/to/img.ext\n}", "{long/path/to/img}"));
        assertNotReferenced(filename, true, CLEARLY_OTHER_FILES);
    }

    @Test
    void shouldIgnoreCaseAndLeadingDotSlash() {
        assertTrue(resolver.isReferenced("Figs/Plot.PNG", "\\includegraphics{./figs/plot.png}", false));
        assertTrue(resolver.isReferenced("./images/im.png", "\\include{./images/im.png}", false));
        assertFalse(resolver.isReferenced("./figures/im.png", "\\include{./images/im.png}", false));
    }

    @Test
    void shouldKeepEveryFileMatchingAReference() {
        assertEquals(List.of("include_image_yes.png"), resolver.keepReferenced(
                List.of("include_image_yes.png", "include_image.png"), "\\include{include_image_yes.png}", false));
        assertEquals(List.of("include_image.png"), resolver.keepReferenced(
                List.of("include_image_yes.png", "include_image.png"), "\\include{include_image.png}", false));
        assertEquals(List.of("images/include/images/im_included.png"), resolver.keepReferenced(
                List.of("images/im_included.png", "images/include/images/im_included.png"),
                "\\include{images/include/images/im_included.png}", false));
        assertEquals(List.of("images/im_included.png", "images/include/images/im_included.png"),
                resolver.keepReferenced(
                        List.of("images/im_included.png", "images/include/images/im_included.png"),
                        "\\include{images/im_included.png}", false));
        assertEquals(List.of("images/im_included.png"), resolver.keepReferenced(
                List.of("images/im_included.png", "figures/im_included.png"),
                "\\include{images/im_included.png}", false));
    }

    @Test
    void shouldMatchSiblingExtensionsOnlyWithoutExtension() {
        List<String> files = List.of("tables/demo.tex", "tables/demo.tikz", "demo.tex");

        assertEquals(List.of("tables/demo.tex"), resolver.keepReferenced(files, "\\include{tables/demo.tex}", false));
        assertEquals(List.of("tables/demo.tex", "tables/demo.tikz"),
                resolver.keepReferenced(files, "\\include{tables/demo}", false));
    }

    @Test
    void shouldKeepOnlyExactPathsWhenStrict() {
        List<String> nested = List.of("tables/table_included.csv", "tables/include/tables/table_included.csv");

        assertEquals(List.of("demo.tex"),
                resolver.keepReferenced(List.of("demo_yes.tex", "demo.tex"), "\\include{demo.tex}", true));
        assertEquals(List.of("tables/table_included.csv"),
                resolver.keepReferenced(nested, "\\include{tables/table_included.csv}", true));
        assertEquals(List.of("table_included.csv"), resolver.keepReferenced(
                List.of("tables/table_included.csv", "table_included.csv"), "\\include{table_included.csv}", true));
        assertEquals(List.of("tables/demo.csv"), resolver.keepReferenced(
                List.of("tables/demo.csv", "tables/demo.txt", "demo.csv"), "\\include{tables/demo.csv}", true));
    }

    @Test
    void shouldReportMatchedSpan() {
        String contents = "see \\input{ sections/intro }";

        ReferenceMatch match = resolver.search("sections/intro.tex", contents, false).orElseThrow();

        assertEquals("{ sections/intro }", match.matchedText());
        assertEquals(contents.indexOf('{'), match.start());
        assertEquals(contents.length(), match.end());
    }

    @Test
    void shouldConvertHostSeparatorsBeforeMatching() {
        ReferenceResolver windows = new ReferenceResolver(PathConvention.WINDOWS);

        assertTrue(windows.isReferenced("figs\\plot.png", "\\includegraphics{figs/plot}", false));
        assertTrue(windows.isReferenced("figs\\plot.png", "\\includegraphics{figs/plot.png}", true));
    }
}
