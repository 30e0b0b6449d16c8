package com.vidnyan.sketch.domain.memory;

import com.vidnyan.sketch.domain.model.BoardProfileCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RamUsageEstimatorTest {

    private static final String UNO = "Arduino Uno";

    private final RamUsageEstimator estimator = new RamUsageEstimator(BoardProfileCatalog.builtIn());

    @Test
    void estimate_ShouldMatchCompilerBaselineForSerialSketch() {
        assertEquals(184, estimator.estimate("void setup(){Serial.begin(9600);}\nvoid loop(){}\n", UNO));
    }

    @Test
    void estimate_ShouldReturnBaseOverheadForEmptySketch() {
        assertEquals(9, estimator.estimate("void setup(){}\nvoid loop(){}\n", UNO));
    }

    @Test
    void estimate_ShouldCountSizedArrays() {
        assertEquals(109, estimator.estimate("byte buffer[100];\nvoid setup(){}\nvoid loop(){}\n", UNO));
        assertEquals(29, estimator.estimate("int readings[10];", UNO));
    }

    @Test
    void estimate_ShouldCountScalarsByBoardWidth() {
        assertEquals(19, estimator.estimate("int x;\nlong y;\nfloat z;\n", UNO));
        assertEquals(15, estimator.estimate("int a, b, c;", UNO));
    }

    @Test
    void estimate_ShouldChargeEachDeclarationToItsMostSpecificType() {
        assertEquals(13, estimator.estimate("unsigned long lastTick;", UNO));
        assertEquals(17, estimator.estimate("long long total;", UNO));
        assertEquals(10, estimator.estimate("static volatile bool flag = false;", UNO));
    }

    @Test
    void estimate_ShouldCountSerialAndWireLibraries() {
        String source = "#include <Wire.h>\nvoid setup(){\n  Serial.begin(9600);\n  Wire.begin();\n}\nvoid loop(){}\n";

        assertEquals(216, estimator.estimate(source, UNO));
    }

    @Test
    void estimate_ShouldCountStringObjects() {
        assertEquals(15, estimator.estimate("String msg;", UNO));
        assertEquals(21, estimator.estimate("String first, second;", UNO));
    }

    @Test
    void estimate_ShouldSkipProgmemDeclarations() {
        assertEquals(15, estimator.estimate("const int table[] = {1, 2, 3};", UNO));
        assertEquals(9, estimator.estimate("const int table[] PROGMEM = {1, 2, 3};", UNO));
        assertEquals(9, estimator.estimate("const char message[] PROGMEM = \"Hello\";\nvoid setup(){}\nvoid loop(){}\n", UNO));
    }

    @Test
    void estimate_ShouldCountPointersByBoardWidth() {
        String source = "int x = 42;\nfloat y;\nint *ptr;\n";

        assertEquals(17, estimator.estimate(source, UNO));
    }

    @Test
    void estimate_ShouldNotCountMultiplicationAsPointer() {
        String product = "void loop(){ int area; area = width * height; }";
        String sum = "void loop(){ int area; area = width + height; }";

        assertEquals(11, estimator.estimate(product, UNO));
        assertEquals(estimator.estimate(sum, UNO), estimator.estimate(product, UNO));
        assertEquals(9, estimator.estimate("int mul(int a, int b){ return a * b; }", UNO));
    }

    @Test
    void estimate_ShouldCountSeveralPointerDeclarationsOnOneLine() {
        assertEquals(13, estimator.estimate("int *a; const char *b = 0;", UNO));
    }

    @Test
    void estimate_ShouldClampHugeArraysInsteadOfOverflowing() {
        int huge = estimator.estimate("byte big[99999999999];\nvoid setup(){}\nvoid loop(){}\n", UNO);
        int twoLarge = estimator.estimate("byte a[2000000000];\nbyte b[2000000000];\n", UNO);

        assertEquals(Integer.MAX_VALUE, huge);
        assertEquals(Integer.MAX_VALUE, twoLarge);
        assertTrue(estimator.estimate("byte a[2000000000];\n", UNO) > 0);
    }

    @Test
    void estimate_ShouldUseWideTypesOnUnoR4() {
        String source = "int x;\ndouble d;\nint *p;\n";

        assertEquals(116, estimator.estimate(source, "Arduino Uno R4 WiFi"));
    }

    @Test
    void estimate_ShouldAddWifiOnlyOnEspBoards() {
        String source = "String s;\ndouble d;\nint *p;\nvoid setup(){ WiFi.begin(); }\n";

        assertEquals(26642, estimator.estimate(source, "ESP32 Dev Module"));
        assertEquals(21, estimator.estimate(source, UNO));
    }

    @Test
    void estimate_ShouldCountLibraryInstances() {
        String source = "#include <SoftwareSerial.h>\nSoftwareSerial gps(4, 3);\nServo left;\nServo right;\n";

        assertEquals(75, estimator.estimate(source, UNO));
    }

    @Test
    void estimate_ShouldNotMistakeSoftwareSerialForHardwareSerial() {
        String source = "SoftwareSerial mySerial(10, 11);\nvoid setup(){ mySerial.begin(9600); }\n";

        assertEquals(73, estimator.estimate(source, UNO));
    }

    @Test
    void estimate_ShouldIgnoreCommentedDeclarations() {
        assertEquals(9, estimator.estimate("// int unused;\n/* long old; */\nvoid setup(){}", UNO));
    }

    @Test
    void estimate_ShouldFallBackToDefaultProfileForUnknownBoard() {
        assertEquals(11, estimator.estimate("int x;", "Mystery Board"));
    }

    @Test
    void estimate_ShouldReturnZeroForBlankSource() {
        assertEquals(0, estimator.estimate("", UNO));
        assertEquals(0, estimator.estimate(null, UNO));
    }

    @Test
    void estimate_ShouldNeverDecreaseWhenDeclarationsAreAdded() {
        List<String> additions = List.of(
                "int counter;\n",
                "float ratio = 0.5;\n",
                "byte frame[32];\n",
                "char *label;\n",
                "String name;\n",
                "void setup(){ Serial.begin(9600); }\n",
                "#include <Wire.h>\n",
                "Servo arm;\n");

        StringBuilder sketch = new StringBuilder("void loop(){}\n");
        int previous = estimator.estimate(sketch.toString(), UNO);
        for (String addition : additions) {
            sketch.append(addition);
            int current = estimator.estimate(sketch.toString(), UNO);
            assertTrue(current >= previous, "estimate dropped after adding: " + addition);
            previous = current;
        }
    }

    @Test
    void estimate_ShouldBeLargerOnEsp32ThanOnUno() {
        String source = "String s;\ndouble d;\nvoid setup(){ WiFi.begin(); }\n";

        assertTrue(estimator.estimate(source, "ESP32 Dev Module") > estimator.estimate(source, UNO));
    }
}
