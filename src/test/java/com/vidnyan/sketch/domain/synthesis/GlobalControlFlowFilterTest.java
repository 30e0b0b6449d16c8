package com.vidnyan.sketch.domain.synthesis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobalControlFlowFilterTest {

    private final GlobalControlFlowFilter filter = new GlobalControlFlowFilter();

    @Test
    void filter_ShouldRemoveBodylessControlFlowAtFileScope() {
        String source = "int x = 1;\n"
                + "if (x > 0);\n"
                + "else;\n"
                + "while (true);\n"
                + "for (int i = 0; i < 3; i++);\n"
                + "void setup() {\n"
                + "  if (x) ;\n"
                + "  while (x);\n"
                + "}\n";

        LineFilterResult result = filter.filter(source);

        assertEquals(List.of(2, 3, 4, 5), result.removedLines());
        assertEquals("int x = 1;\nvoid setup() {\n  if (x) ;\n  while (x);\n}\n", result.text());
    }

    @Test
    void filter_ShouldKeepOrdinaryGlobalStatements() {
        String source = "bool ready = check(1);\nif (ready) { go(); }\nvoid loop() {}";

        LineFilterResult result = filter.filter(source);

        assertEquals(0, result.removedCount());
        assertEquals(source, result.text());
    }

    @Test
    void filter_ShouldIgnoreStatementsInComments() {
        String source = "// if (x);\nint y;";

        assertEquals(source, filter.filter(source).text());
    }

    @Test
    void isBodylessControlFlow_ShouldRequireBalancedParens() {
        assertTrue(GlobalControlFlowFilter.isBodylessControlFlow("else if (a(b));"));
        assertTrue(GlobalControlFlowFilter.isBodylessControlFlow("switch (mode);"));
        assertFalse(GlobalControlFlowFilter.isBodylessControlFlow("if (a(b);"));
        assertFalse(GlobalControlFlowFilter.isBodylessControlFlow("if (a) b();"));
        assertFalse(GlobalControlFlowFilter.isBodylessControlFlow("iffy(a);"));
    }
}
