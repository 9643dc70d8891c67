package io.github.eutro.sidefx.test;

import io.github.eutro.sidefx.analysis.ResourceAliasAnalysis;
import io.github.eutro.sidefx.analysis.ResourceId;
import io.github.eutro.sidefx.ops.CommonOps;
import io.github.eutro.sidefx.ops.ResourceOps;
import io.github.eutro.sidefx.ssa.Effect;
import io.github.eutro.sidefx.ssa.Function;
import io.github.eutro.sidefx.ssa.IRBuilder;
import io.github.eutro.sidefx.ssa.Module;
import io.github.eutro.sidefx.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static io.github.eutro.sidefx.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ResourceAliasAnalysisTest {
    private final Module module = new Module();
    private final Function func = module.newFunction("f");
    private final IRBuilder ib = new IRBuilder(func);

    @Test
    void testSharedNames() {
        Var a1 = handle(ib, "a");
        Var a2 = handle(ib, "a");
        Var b = handle(ib, "b");
        ResourceAliasAnalysis.Info info = new ResourceAliasAnalysis(module).getAnalysisForFunc(func);

        assertEquals(info.getResourceIds(a1), info.getResourceIds(a2));
        assertNotEquals(info.getResourceIds(a1), info.getResourceIds(b));
        assertFalse(info.isUnknownResource(b));
    }

    @Test
    void testIdsScopedToFunction() {
        Var a = handle(ib, "a");
        Function g = module.newFunction("g");
        IRBuilder gIb = new IRBuilder(g);
        Var gb = handle(gIb, "b");
        ResourceAliasAnalysis aliases = new ResourceAliasAnalysis(module);

        // both are the first resource of their function
        assertEquals(aliases.getAnalysisForFunc(func).getResourceIds(a),
                aliases.getAnalysisForFunc(g).getResourceIds(gb));
    }

    @Test
    void testUnknownHandles() {
        Var arg = argHandle(ib, 0);
        Var called = ib.insertResource(CommonOps.CALL.create("make").insn(), "made");
        Var forwarded = ib.insertResource(CommonOps.IDENTITY.insn(arg), "fwd");
        ResourceAliasAnalysis.Info info = new ResourceAliasAnalysis.Info(func);

        assertTrue(info.isUnknownResource(arg));
        assertTrue(info.isUnknownResource(called));
        assertTrue(info.isUnknownResource(forwarded));
        assertThrows(IllegalStateException.class, () -> info.getResourceIds(arg));
    }

    @Test
    void testFindAccessedResources() {
        Var a = handle(ib, "a");
        Var b = handle(ib, "b");
        Var arg = argHandle(ib, 0);
        Var idx = ib.insert(CommonOps.constant(0), "idx");
        Effect scatter = ib.insert(ResourceOps.SCATTER_UPDATE.insn(a, idx, b));
        Effect unknownRead = read(ib, arg);
        Effect add = ib.insert(CommonOps.ADD.insn(idx, idx));
        ResourceAliasAnalysis.Info info = new ResourceAliasAnalysis.Info(func);

        Set<ResourceId> expected = new HashSet<>(info.getResourceIds(a));
        expected.addAll(info.getResourceIds(b));
        assertEquals(expected, info.findAccessedResources(scatter));
        assertEquals(ResourceId.UNKNOWN_SET, info.findAccessedResources(unknownRead));
        assertEquals(Collections.emptySet(), info.findAccessedResources(add));
    }

    @Test
    void testUnknownFunction() {
        ResourceAliasAnalysis aliases = new ResourceAliasAnalysis(module);
        assertThrows(IllegalArgumentException.class, () -> aliases.getAnalysisForFunc(new Function("stray")));
    }
}
