package io.github.eutro.sidefx.test;

import io.github.eutro.sidefx.analysis.FunctionSideEffects;
import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ext.MetadataState;
import io.github.eutro.sidefx.passes.IRPass;
import io.github.eutro.sidefx.passes.InPlaceIRPass;
import io.github.eutro.sidefx.passes.Passes;
import io.github.eutro.sidefx.passes.meta.ComputeSideEffects;
import io.github.eutro.sidefx.passes.misc.ForPass;
import io.github.eutro.sidefx.ssa.*;
import io.github.eutro.sidefx.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.eutro.sidefx.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComputeSideEffectsTest {
    private final Module module = new Module();
    private final Function func = module.newFunction("f");
    private final IRBuilder ib = new IRBuilder(func);

    @Test
    void testPassAttachesDeps() {
        Var v = handle(ib, "v");
        Effect w = write(ib, v);
        Effect r = read(ib, v);

        ComputeSideEffects.INSTANCE.run(func);
        FunctionSideEffects deps = func.getExtOrThrow(CommonExts.CONTROL_DEPS);
        assertEquals(Collections.singletonList(w), deps.getDirectControlPredecessors(r));
        assertTrue(func.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.CONTROL_DEPS));
    }

    @Test
    void testComputedOnDemand() {
        Var v = handle(ib, "v");
        write(ib, v);

        assertFalse(func.getExt(CommonExts.CONTROL_DEPS).isPresent());
        FunctionSideEffects deps = FunctionSideEffects.of(func);
        assertSame(deps, FunctionSideEffects.of(func));
    }

    @Test
    void testRecomputedAfterChange() {
        Var v = handle(ib, "v");
        Effect w = write(ib, v);
        FunctionSideEffects before = FunctionSideEffects.of(func);

        Effect r = read(ib, v);
        func.markChanged();
        assertFalse(func.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.CONTROL_DEPS));

        FunctionSideEffects after = FunctionSideEffects.of(func);
        assertNotSame(before, after);
        assertTrue(before.getDirectControlPredecessors(r).isEmpty());
        assertEquals(Collections.singletonList(w), after.getDirectControlPredecessors(r));
    }

    @Test
    void testModulePass() {
        Function g = module.newFunction("g");
        IRBuilder gIb = new IRBuilder(g);
        Effect u1 = call(gIb, "h");
        Effect u2 = call(gIb, "h");

        Passes.CONTROL_DEPS.run(module);
        assertTrue(Passes.CONTROL_DEPS.isInPlace());
        for (Function fn : module.functions) {
            assertTrue(fn.getExt(CommonExts.CONTROL_DEPS).isPresent());
        }
        assertEquals(Collections.singletonList(u1),
                g.getExtOrThrow(CommonExts.CONTROL_DEPS).getDirectControlPredecessors(u2));
    }

    @Test
    void testChainReportsFailingPass() {
        InPlaceIRPass<Function> fail = fn -> {
            throw new IllegalStateException("broken");
        };
        IRPass<Module, Module> chain = ForPass.liftFunctions(ComputeSideEffects.INSTANCE.then(fail));
        assertTrue(chain.isInPlace());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(module));
        assertEquals("broken", e.getMessage());
        assertEquals("running pass 1 in chain", e.getSuppressed()[0].getMessage());
        assertEquals("in function 0 (f)", e.getSuppressed()[1].getMessage());
        // the first pass still ran
        assertTrue(func.getExt(CommonExts.CONTROL_DEPS).isPresent());
    }

    @Test
    void testLiftRequiresInPlace() {
        IRPass<Function, Function> copying = fn -> new Function(fn.name);
        assertThrows(IllegalArgumentException.class, () -> ForPass.liftFunctions(copying));
    }
}
