package io.github.eutro.sidefx.test;

import io.github.eutro.sidefx.analysis.FunctionSideEffects;
import io.github.eutro.sidefx.ssa.Function;
import io.github.eutro.sidefx.ssa.IRBuilder;
import io.github.eutro.sidefx.ssa.Var;
import io.github.eutro.sidefx.ssa.display.ControlDepsDisplay;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.github.eutro.sidefx.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ControlDepsDisplayTest {
    @Test
    void testDot() {
        Function func = new Function("quote\"d");
        IRBuilder ib = new IRBuilder(func);
        Var v = handle(ib, "v");
        write(ib, v);
        read(ib, v);

        String dot = ControlDepsDisplay.displayDot(FunctionSideEffects.of(func));
        assertTrue(dot.startsWith("digraph \"quote\\\"d\" {"), dot);
        // handle, constant, write, read
        assertTrue(dot.contains("n3 [label="), dot);
        assertTrue(dot.contains("n2 -> n3;"), dot);
        assertEquals(1, dot.split("->", -1).length - 1, dot);
    }

    @Test
    void testToFile(@TempDir Path dir) throws IOException {
        File file = new File(dir.toFile(), "nested/out.dot");
        ControlDepsDisplay.debugDisplayToFile("digraph {}\n", file);
        assertEquals("digraph {}\n", new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
    }
}
