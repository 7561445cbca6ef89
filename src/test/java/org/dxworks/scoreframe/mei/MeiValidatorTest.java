package org.dxworks.scoreframe.mei;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MeiValidatorTest {

    private final MeiValidator validator = new MeiValidator();
    private MeiDocument document;
    private Layer layer;

    @BeforeEach
    void setUp() {
        document = new MeiDocument();
        document.xmlId = "mei";
        document.scoreDef.xmlId = "scoreDef";
        document.section.xmlId = "section";

        StaffGrp root = new StaffGrp();
        root.xmlId = "grp";
        StaffDef staffDef = new StaffDef();
        staffDef.xmlId = "sd";
        staffDef.n = 1;
        root.children.add(staffDef);
        document.scoreDef.staffGrp = root;

        Staff staff = new Staff();
        staff.xmlId = "staff";
        staff.n = 1;
        layer = new Layer();
        layer.xmlId = "layer";
        layer.n = 1;
        staff.layers.add(layer);
        document.section.staves.add(staff);

        layer.children.add(note("n1", 4));
        layer.children.add(note("n2", 8));
    }

    private static Note note(String id, Integer dur) {
        Note note = new Note();
        note.xmlId = id;
        note.pname = 'c';
        note.oct = 4;
        note.dur = dur;
        return note;
    }

    private Slur slur(String id, String startid, String endid) {
        Slur slur = new Slur();
        slur.xmlId = id;
        slur.startid = startid;
        slur.endid = endid;
        document.section.controlEvents.add(slur);
        return slur;
    }

    @Test
    void wellFormedDocumentIsValid() {
        slur("s1", "n1", "n2");

        ValidationResult result = validator.validate(document);

        assertTrue(result.isValid(), String.join("; ", result.diagnostics));
    }

    @Test
    void controlEventsMustPointAtLayerContent() {
        slur("s1", "n1", "n9");
        slur("s2", null, null);

        assertEquals(List.of(
                "slur s1 references missing endid n9",
                "slur s2 has no startid"
        ), validator.validate(document).diagnostics);
    }

    @Test
    void chordMembersAndWrappedEventsAreReferenceable() {
        Chord chord = new Chord();
        chord.xmlId = "c1";
        chord.dur = 4;
        chord.notes.add(note("c1n1", null));
        BTrem bTrem = new BTrem();
        bTrem.xmlId = "t1";
        bTrem.child = chord;
        layer.children.add(bTrem);
        slur("s1", "c1n1", "c1");

        assertTrue(validator.validate(document).isValid());
    }

    @Test
    void duplicateAndMissingIdentities() {
        layer.children.add(note("n1", 4));
        layer.children.add(note(null, 4));

        assertEquals(List.of("duplicate xml:id n1", "note without xml:id"),
                validator.validate(document).diagnostics);
    }

    @Test
    void staffWithoutDefinition() {
        Staff extra = new Staff();
        extra.xmlId = "staff2";
        extra.n = 2;
        document.section.staves.add(extra);

        assertEquals(List.of("staff 2 has no staffDef"), validator.validate(document).diagnostics);
    }

    @Test
    void emptyGroupsAndWrappers() {
        StaffGrp empty = new StaffGrp();
        empty.xmlId = "empty";
        document.scoreDef.staffGrp.children.add(empty);
        GraceGrp graceGrp = new GraceGrp();
        graceGrp.xmlId = "g1";
        layer.children.add(graceGrp);

        assertEquals(List.of("staffGrp empty contains no staffDef", "graceGrp g1 is empty"),
                validator.validate(document).diagnostics);
    }

    @Test
    void invalidPitchAndDuration() {
        Note note = note("n3", 3);
        note.pname = 'h';
        layer.children.add(note);

        assertEquals(List.of("note n3 has invalid pname h", "note n3 has invalid dur 3"),
                validator.validate(document).diagnostics);
    }

    @Test
    void layerEventsLookThroughWrappers() {
        GraceGrp graceGrp = new GraceGrp();
        graceGrp.xmlId = "g1";
        graceGrp.children.add(note("gn", 16));
        layer.children.add(0, graceGrp);

        List<LayerElement> events = LayerElements.events(layer.children);

        assertEquals(List.of("gn", "n1", "n2"), events.stream().map(e -> e.xmlId).collect(Collectors.toList()));
        assertEquals(4, LayerElements.descendants(layer.children).size());
    }
}
