package org.dxworks.scoreframe.convert;

import org.dxworks.scoreframe.musicxml.model.PartSymbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionContextTest {

    @Test
    void identitiesShareOneCounter() {
        ConversionContext ctx = new ConversionContext();

        assertEquals("ly-note-1", ctx.generateId("note"));
        assertEquals("ly-slur-2", ctx.generateId("slur"));
        assertEquals("ly-note-3", ctx.generateId("note"));
    }

    @Test
    void customPrefix() {
        assertEquals("score-mei-1", new ConversionContext("score").generateId("mei"));
        assertThrows(IllegalArgumentException.class, () -> new ConversionContext(" "));
    }

    @Test
    void reverseLookupReturnsTheFirstSource() {
        ConversionContext ctx = new ConversionContext();
        ctx.mapId("staffDef-1", "P1");
        ctx.mapId("staffDef-2", "P1");

        assertEquals("P1", ctx.resolveId("staffDef-2").orElseThrow());
        assertEquals("staffDef-1", ctx.reverseResolveId("P1").orElseThrow());
        assertTrue(ctx.resolveId("unknown").isEmpty());
    }

    @Test
    void partStavesDefaultToOne() {
        ConversionContext ctx = new ConversionContext();
        assertEquals(1, ctx.stavesForPart("P1"));

        ctx.registerPartStaff("P1", 2, 4);
        ctx.registerPartStaff("P1", 1, 3);

        assertEquals(2, ctx.stavesForPart("P1"));
        assertEquals(4, ctx.globalStaffForPart("P1", 2).orElseThrow());
        assertTrue(ctx.globalStaffForPart("P1", 3).isEmpty());
        assertTrue(ctx.globalStaffForPart("P2", 1).isEmpty());
    }

    @Test
    void partSymbols() {
        ConversionContext ctx = new ConversionContext();
        ctx.setPartSymbol("P1", new PartSymbol("bracket", 1, 2));

        assertEquals(new PartSymbol("bracket", 1, 2), ctx.partSymbol("P1").orElseThrow());
        assertTrue(ctx.partSymbol("P2").isEmpty());
    }

    @Test
    void resultCarriesACopyOfTheWarnings() {
        ConversionContext ctx = new ConversionContext();
        ctx.addWarning("staff 1", "first");

        ConversionResult<String> result = ctx.result("value");
        ctx.addWarning("staff 1", "second");

        assertEquals("value", result.value);
        assertEquals(List.of(new ConversionWarning("staff 1", "first")), result.warnings);
        assertTrue(result.hasWarnings());
        assertEquals(2, ctx.warnings().size());
        assertEquals("staff 1: first", result.warnings.get(0).toString());
        assertThrows(UnsupportedOperationException.class, () -> ctx.warnings().clear());
    }
}
