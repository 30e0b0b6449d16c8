package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.FunctionSignature;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PrototypeSynthesizerTest {

    private final PrototypeSynthesizer synthesizer = new PrototypeSynthesizer();

    @Test
    void synthesize_ShouldDeclareBuiltInTypedHelpersOnce() {
        String source = "int add(int a, int b) {\n"
                + "  return a + b;\n"
                + "}\n"
                + "void setup() {}\n"
                + "void loop() {}\n"
                + "float scale(float v)\n"
                + "{\n"
                + "  return v * 2;\n"
                + "}\n"
                + "void move(Point p) {}\n"
                + "int add(int a, int b) {}\n"
                + "void Led::on() {}\n"
                + "void tone2(int f = 440) {}\n";

        List<FunctionSignature> prototypes = synthesizer.synthesize(source, Set.of("Point"));

        assertEquals(List.of("int add(int a, int b);", "float scale(float v);"),
                prototypes.stream().map(FunctionSignature::toPrototype).toList());
    }

    @Test
    void synthesize_ShouldExcludeFunctionsUsingCustomTypes() {
        List<FunctionSignature> prototypes = synthesizer.synthesize(
                "void f(PointControl&p) {}\nPointControl make() {}\nunsigned long since(unsigned long t) {}",
                Set.of("PointControl"));

        assertEquals(1, prototypes.size());
        assertEquals("unsigned long since(unsigned long t);", prototypes.get(0).toPrototype());
    }

    @Test
    void synthesize_ShouldIgnoreCommentedOutFunctionsAndPreprocessorLines() {
        String source = "// void ghost() {\n#define twice(x) (x * 2)\nvoid real() {}";

        List<FunctionSignature> prototypes = synthesizer.synthesize(source, Set.of());

        assertEquals(List.of("void real();"), prototypes.stream().map(FunctionSignature::toPrototype).toList());
    }

    @Test
    void synthesize_ShouldReturnEmptyForBlankSource() {
        assertTrue(synthesizer.synthesize("  \n", Set.of()).isEmpty());
    }

    @Test
    void isEligible_ShouldRejectEntryPointsAndKeywords() {
        assertFalse(PrototypeSynthesizer.isEligible(new FunctionSignature("void", "setup", ""), Set.of()));
        assertFalse(PrototypeSynthesizer.isEligible(new FunctionSignature("else", "if", "x"), Set.of()));
        assertFalse(PrototypeSynthesizer.isEligible(new FunctionSignature("std::string", "name", ""), Set.of()));
        assertTrue(PrototypeSynthesizer.isEligible(new FunctionSignature("int", "readSensor", "int pin"), Set.of()));
    }
}
