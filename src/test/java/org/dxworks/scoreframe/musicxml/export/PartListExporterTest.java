package org.dxworks.scoreframe.musicxml.export;

import org.dxworks.scoreframe.TestUtils;
import org.dxworks.scoreframe.convert.ConversionContext;
import org.dxworks.scoreframe.ext.ExtensionStore;
import org.dxworks.scoreframe.ext.InstrumentInfo;
import org.dxworks.scoreframe.ext.PartSymbolInfo;
import org.dxworks.scoreframe.lilypond.importer.ImportedScore;
import org.dxworks.scoreframe.lilypond.importer.LilyPondImporter;
import org.dxworks.scoreframe.lilypond.parser.LilyPondParser;
import org.dxworks.scoreframe.mei.GrpSym;
import org.dxworks.scoreframe.mei.InstrDef;
import org.dxworks.scoreframe.mei.Label;
import org.dxworks.scoreframe.mei.ScoreDef;
import org.dxworks.scoreframe.mei.StaffDef;
import org.dxworks.scoreframe.mei.StaffGrp;
import org.dxworks.scoreframe.musicxml.model.Part;
import org.dxworks.scoreframe.musicxml.model.PartGroup;
import org.dxworks.scoreframe.musicxml.model.PartList;
import org.dxworks.scoreframe.musicxml.model.PartSymbol;
import org.dxworks.scoreframe.musicxml.model.ScoreInstrument;
import org.dxworks.scoreframe.musicxml.model.ScorePart;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PartListExporterTest {

    private final PartListExporter exporter = new PartListExporter();
    private final ConversionContext ctx = new ConversionContext();
    private final ExtensionStore store = new ExtensionStore();

    private static ImportedScore importSource(String source) throws Exception {
        return new LilyPondImporter(new ConversionContext()).importFile(LilyPondParser.parse(source));
    }

    private static StaffDef staffDef(int n, String label) {
        StaffDef staffDef = new StaffDef();
        staffDef.xmlId = "sd" + n;
        staffDef.n = n;
        if (label != null) {
            staffDef.label = new Label(label);
        }
        return staffDef;
    }

    private static StaffGrp group(String id, String symbol, Boolean barThru) {
        StaffGrp group = new StaffGrp();
        group.xmlId = id;
        group.symbol = symbol;
        group.barThru = barThru;
        return group;
    }

    private static ScoreDef scoreDef(StaffGrp root) {
        ScoreDef scoreDef = new ScoreDef();
        scoreDef.staffGrp = root;
        return scoreDef;
    }

    @Test
    void choirStaffBecomesPartGroupAroundItsStaves() throws Exception {
        ImportedScore score = importSource(TestUtils.readSample("choir.ly"));

        PartList partList = exporter.exportParts(score.document.scoreDef, score.store, ctx);

        assertEquals(5, partList.items.size());
        PartGroup start = (PartGroup) partList.items.get(0);
        assertEquals("start", start.type);
        assertEquals("1", start.number);
        assertEquals("bracket", start.groupSymbol);
        assertEquals("no", start.groupBarline);

        ScorePart soprano = (ScorePart) partList.items.get(1);
        assertEquals("ly-staffDef-6", soprano.id);
        assertEquals("Soprano", soprano.partName);
        assertEquals("S.", soprano.partAbbreviation);
        ScoreInstrument instrument = soprano.scoreInstruments.get(0);
        assertEquals("ly-instrDef-9", instrument.id);
        assertEquals("choir aahs", instrument.instrumentName);

        assertEquals("Alto", ((ScorePart) partList.items.get(2)).partName);
        PartGroup stop = (PartGroup) partList.items.get(3);
        assertEquals("stop", stop.type);
        assertEquals("1", stop.number);

        ScorePart solo = (ScorePart) partList.items.get(4);
        assertEquals("ly-staffDef-24", solo.id);
        assertEquals("", solo.partName);
        assertTrue(ctx.warnings().isEmpty());
    }

    @Test
    void pianoStaffCollapsesToOnePartWithTwoStaves() throws Exception {
        ImportedScore score = importSource("\\new PianoStaff << \\new Staff { c'1 } \\new Staff { c1 } >>");

        PartList partList = exporter.exportParts(score.document.scoreDef, score.store, ctx);

        assertEquals(1, partList.items.size());
        ScorePart piano = (ScorePart) partList.items.get(0);
        assertEquals("ly-staffDef-6", piano.id);
        assertEquals(2, ctx.stavesForPart(piano.id));
        assertEquals(2, ctx.globalStaffForPart(piano.id, 2).orElseThrow());
        assertEquals("ly-staffDef-6", ctx.resolveId("ly-staffGrp-5").orElseThrow());
        assertTrue(ctx.partSymbol(piano.id).isEmpty());

        List<Part> parts = exporter.createEmptyParts(partList, ctx);
        assertEquals(1, parts.size());
        assertEquals(2, parts.get(0).staves);
        assertNull(parts.get(0).partSymbol);
    }

    @Test
    void bracketedMultiStaffGroupKeepsItsSymbolOnThePart() throws Exception {
        StaffGrp root = group("root", null, null);
        StaffGrp harp = group("harp", "bracket", true);
        harp.children.add(new Label("Harp"));
        harp.children.add(staffDef(1, null));
        harp.children.add(staffDef(2, null));
        root.children.add(harp);

        PartList partList = exporter.exportParts(scoreDef(root), store, ctx);

        ScorePart part = (ScorePart) partList.items.get(0);
        assertEquals("sd1", part.id);
        assertEquals("Harp", part.partName);
        assertEquals(new PartSymbol("bracket", null, null), ctx.partSymbol("sd1").orElseThrow());
    }

    @Test
    void storedPartSymbolWins() throws Exception {
        StaffGrp root = group("root", null, null);
        StaffGrp piano = group("piano", "brace", true);
        piano.children.add(staffDef(1, null));
        piano.children.add(staffDef(2, null));
        root.children.add(piano);
        store.insert("piano", new PartSymbolInfo("brace", 1, 2));

        exporter.exportParts(scoreDef(root), store, ctx);

        assertEquals(new PartSymbol("brace", 1, 2), ctx.partSymbol("sd1").orElseThrow());
    }

    @Test
    void labelledStavesStaySeparateParts() throws Exception {
        StaffGrp root = group("root", null, null);
        StaffGrp strings = group("strings", "bracket", true);
        strings.children.add(staffDef(1, "Violin"));
        strings.children.add(staffDef(2, "Viola"));
        root.children.add(strings);

        PartList partList = exporter.exportParts(scoreDef(root), store, ctx);

        assertEquals(4, partList.items.size());
        assertEquals("yes", ((PartGroup) partList.items.get(0)).groupBarline);
        assertEquals(List.of("sd1", "sd2"), List.of(partList.scoreParts().get(0).id, partList.scoreParts().get(1).id));
        assertEquals(1, ctx.stavesForPart("sd2"));
        assertEquals(2, ctx.globalStaffForPart("sd2", 1).orElseThrow());
    }

    @Test
    void nestedGroupsAreNumberedInOrder() throws Exception {
        StaffGrp root = group("root", null, null);
        StaffGrp outer = group("outer", "line", null);
        StaffGrp inner = group("inner", "bracketsq", false);
        inner.children.add(staffDef(1, "Flute"));
        outer.children.add(inner);
        outer.children.add(staffDef(2, "Oboe"));
        StaffGrp last = group("last", "bracket", null);
        last.children.add(staffDef(3, "Horn"));
        root.children.add(outer);
        root.children.add(last);

        PartList partList = exporter.exportParts(scoreDef(root), store, ctx);

        List<String> shape = partList.items.stream().map(item -> item instanceof PartGroup g
                ? g.type + " " + g.number
                : ((ScorePart) item).partName).collect(Collectors.toList());
        assertEquals(List.of("start 1", "start 2", "Flute", "stop 2", "Oboe", "stop 1",
                "start 3", "Horn", "stop 3"), shape);
        assertEquals("line", ((PartGroup) partList.items.get(0)).groupSymbol);
        assertEquals("square", ((PartGroup) partList.items.get(1)).groupSymbol);
    }

    @Test
    void grpSymIsReportedAsWarning() throws Exception {
        StaffGrp root = group("root", null, null);
        root.children.add(new GrpSym());
        root.children.add(staffDef(1, null));

        PartList partList = exporter.exportParts(scoreDef(root), store, ctx);

        assertEquals(1, partList.items.size());
        assertEquals(1, ctx.warnings().size());
        assertEquals("staffGrp root", ctx.warnings().get(0).location);
    }

    @Test
    void instrumentDetailComesFromTheStore() throws Exception {
        StaffGrp root = group("root", null, null);
        StaffDef clarinet = staffDef(1, "Clarinet");
        InstrDef instrDef = new InstrDef();
        instrDef.xmlId = "i1";
        instrDef.midiInstrname = "clarinet";
        clarinet.instrDefs.add(instrDef);
        root.children.add(clarinet);
        store.insert("i1", new InstrumentInfo("Clarinet in B-flat", "Cl.", "wind.reed.clarinet.bflat", 2, 72));

        ScorePart part = exporter.exportParts(scoreDef(root), store, ctx).scoreParts().get(0);

        ScoreInstrument instrument = part.scoreInstruments.get(0);
        assertEquals("Clarinet in B-flat", instrument.instrumentName);
        assertEquals("Cl.", instrument.instrumentAbbreviation);
        assertEquals(2, instrument.midiChannel);
        assertEquals(72, instrument.midiProgram);
    }

    @Test
    void missingScoreDefGivesEmptyPartList() throws Exception {
        assertTrue(exporter.exportParts(null, store, ctx).items.isEmpty());
    }
}
