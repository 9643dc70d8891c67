package io.github.eutro.sidefx.test;

import io.github.eutro.sidefx.analysis.FunctionSideEffects;
import io.github.eutro.sidefx.analysis.ResourceAccessKind;
import io.github.eutro.sidefx.ext.CommonExts;
import io.github.eutro.sidefx.ext.Ext;
import io.github.eutro.sidefx.ext.ExtHolder;
import io.github.eutro.sidefx.ops.CommonOps;
import io.github.eutro.sidefx.ops.ResourceOps;
import io.github.eutro.sidefx.ops.SimpleOpKey;
import io.github.eutro.sidefx.passes.meta.ComputeSideEffects;
import io.github.eutro.sidefx.ssa.*;
import io.github.eutro.sidefx.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static io.github.eutro.sidefx.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IRTest {
    @Test
    void testExtHolder() {
        Ext<String> ext = Ext.create(String.class, "test");
        ExtHolder holder = new ExtHolder();
        assertNull(holder.getNullable(ext));
        assertThrows(IllegalStateException.class, () -> holder.getExtOrThrow(ext));

        holder.attachExt(ext, "value");
        assertEquals(Optional.of("value"), ext.getIn(holder));
        holder.removeExt(ext);
        assertFalse(holder.getExt(ext).isPresent());
    }

    @Test
    void testOwnership() {
        Module module = new Module();
        Function func = module.newFunction("f");
        assertSame(module, func.getExtOrThrow(CommonExts.OWNING_MODULE));
        assertSame(func, func.body.getExtOrThrow(CommonExts.OWNING_FUNCTION));

        IRBuilder ib = new IRBuilder(func);
        Effect ifEffect = enterIf(ib);
        Region inner = ib.getRegion();
        Effect call = call(ib, "g");

        assertSame(func.body, ifEffect.getExtOrThrow(CommonExts.OWNING_REGION));
        assertSame(ifEffect, ifEffect.insn().getExtOrThrow(CommonExts.OWNING_EFFECT));
        assertSame(ifEffect.insn(), inner.getExtOrThrow(CommonExts.OWNING_INSN));
        assertSame(inner, call.getExtOrThrow(CommonExts.OWNING_REGION));
        assertSame(func, inner.findFunction());

        module.functions.remove(func);
        assertNull(func.getNullable(CommonExts.OWNING_MODULE));
        inner.getEffects().clear();
        assertNull(call.getNullable(CommonExts.OWNING_REGION));
        assertNull(new Region().findFunction());
    }

    @Test
    void testSingleOwner() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func);
        Effect call = call(ib, "g");

        Region other = new Region();
        assertThrows(IllegalStateException.class, () -> other.addEffect(call));
        assertTrue(other.getEffects().isEmpty());

        func.body.getEffects().remove(call);
        other.addEffect(call);
        assertSame(other, call.getExtOrThrow(CommonExts.OWNING_REGION));
    }

    @Test
    void testOpExtsVisibleFromEffects() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func);
        Var v = handle(ib, "v");
        Effect r = read(ib, v);
        Effect w = write(ib, v);
        Effect c = call(ib, "g");

        assertEquals(Optional.of(ResourceAccessKind.READ), r.getExt(CommonExts.RESOURCE_ACCESS));
        assertEquals(Optional.of(ResourceAccessKind.WRITE), w.getExt(CommonExts.RESOURCE_ACCESS));
        assertFalse(c.getExt(CommonExts.RESOURCE_ACCESS).isPresent());
        assertTrue(v.getExtOrThrow(CommonExts.ASSIGNED_AT).getExtOrThrow(CommonExts.IS_RESOURCE_DECLARATION));
        assertTrue(v.isResource());
        assertEquals("v", ResourceOps.VAR_HANDLE.argNullable(v.getExtOrThrow(CommonExts.ASSIGNED_AT).insn().op));
    }

    @Test
    void testArgsReplaceable() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func);
        Var a = handle(ib, "a");
        Var b = handle(ib, "b");
        Effect r = read(ib, a);

        r.insn().args().set(0, b);
        assertSame(b, r.insn().args().get(0));
        assertThrows(IndexOutOfBoundsException.class, () -> r.insn().args().get(1));
    }

    @Test
    void testToString() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func);
        Var v = handle(ib, "v");
        write(ib, v);
        enterIf(ib);
        read(ib, v);

        String s = func.toString();
        assertTrue(s.startsWith("fn f() {"), s);
        assertTrue(s.contains("%v"), s);
        assertTrue(s.contains("read_var"), s);
        assertTrue(s.contains("if"), s);
    }

    @Test
    void testGetExtOrRun() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func);
        write(ib, handle(ib, "v"));

        FunctionSideEffects deps = func.getExtOrRun(CommonExts.CONTROL_DEPS, func, ComputeSideEffects.INSTANCE);
        assertSame(deps, func.getExtOrThrow(CommonExts.CONTROL_DEPS));
        assertEquals(3, deps.getEffects().size());
    }

    @Test
    void testConstants() {
        Function func = new Function("f");
        IRBuilder ib = new IRBuilder(func);
        Var k = ib.insert(CommonOps.constant(null), "k");
        assertNull(CommonOps.CONST.argNullable(k.getExtOrThrow(CommonExts.ASSIGNED_AT).insn().op));
        assertThrows(IllegalArgumentException.class, () -> CommonOps.CALL.create(null));
        assertThrows(IllegalArgumentException.class, () -> new SimpleOpKey("two words"));
        assertThrows(IllegalArgumentException.class, () -> new SimpleOpKey(""));
    }
}
