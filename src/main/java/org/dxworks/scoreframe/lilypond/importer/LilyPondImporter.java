package org.dxworks.scoreframe.lilypond.importer;

import org.dxworks.scoreframe.convert.ConversionContext;
import org.dxworks.scoreframe.convert.ConversionException;
import org.dxworks.scoreframe.ext.ArticulationInfo;
import org.dxworks.scoreframe.ext.ChordRepetitionMarker;
import org.dxworks.scoreframe.ext.ControlEvent;
import org.dxworks.scoreframe.ext.Direction;
import org.dxworks.scoreframe.ext.DurationInfo;
import org.dxworks.scoreframe.ext.EnclosingGraceMarker;
import org.dxworks.scoreframe.ext.EndingInfo;
import org.dxworks.scoreframe.ext.ExtensionStore;
import org.dxworks.scoreframe.ext.FormatOriginInfo;
import org.dxworks.scoreframe.ext.GraceInfo;
import org.dxworks.scoreframe.ext.OrnamentInfo;
import org.dxworks.scoreframe.ext.PhrasingSlurMarker;
import org.dxworks.scoreframe.ext.PitchContextInfo;
import org.dxworks.scoreframe.ext.PlainSimultaneousMarker;
import org.dxworks.scoreframe.ext.RepeatInfo;
import org.dxworks.scoreframe.ext.StaffContextInfo;
import org.dxworks.scoreframe.ext.TremoloInfo;
import org.dxworks.scoreframe.ext.TupletInfo;
import org.dxworks.scoreframe.lilypond.OrnamentTable;
import org.dxworks.scoreframe.lilypond.model.*;
import org.dxworks.scoreframe.mei.BTrem;
import org.dxworks.scoreframe.mei.BeamSpan;
import org.dxworks.scoreframe.mei.Chord;
import org.dxworks.scoreframe.mei.ControlElement;
import org.dxworks.scoreframe.mei.Dir;
import org.dxworks.scoreframe.mei.Dynam;
import org.dxworks.scoreframe.mei.Fing;
import org.dxworks.scoreframe.mei.GraceGrp;
import org.dxworks.scoreframe.mei.Hairpin;
import org.dxworks.scoreframe.mei.InstrDef;
import org.dxworks.scoreframe.mei.Label;
import org.dxworks.scoreframe.mei.LabelAbbr;
import org.dxworks.scoreframe.mei.Layer;
import org.dxworks.scoreframe.mei.LayerElement;
import org.dxworks.scoreframe.mei.MeiDocument;
import org.dxworks.scoreframe.mei.MeiValidator;
import org.dxworks.scoreframe.mei.Note;
import org.dxworks.scoreframe.mei.Rest;
import org.dxworks.scoreframe.mei.Slur;
import org.dxworks.scoreframe.mei.Space;
import org.dxworks.scoreframe.mei.Staff;
import org.dxworks.scoreframe.mei.StaffDef;
import org.dxworks.scoreframe.mei.StaffGrp;
import org.dxworks.scoreframe.mei.Tie;
import org.dxworks.scoreframe.mei.TupletSpan;
import org.dxworks.scoreframe.mei.ValidationResult;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a parsed LilyPond file into an MEI document plus the extension entries MEI cannot hold.
 * <p>
 * One depth-first walk. Tuplet, grace, repeat and ending blocks push a scope; span elements are created
 * when their block opens, so outer spans precede inner ones in the control list, and get their start and
 * end when it closes. Use one importer per conversion.
 */
public final class LilyPondImporter {

    private static final Set<String> STAFF_CONTEXTS = Set.of("Staff", "RhythmicStaff", "TabStaff", "DrumStaff");
    private static final Set<String> GROUP_CONTEXTS = Set.of("StaffGroup", "ChoirStaff", "PianoStaff", "GrandStaff");

    private static final String INSTRUMENT_NAME = "instrumentName";
    private static final String SHORT_INSTRUMENT_NAME = "shortInstrumentName";
    private static final String MIDI_INSTRUMENT = "midiInstrument";

    private static final Pitch DEFAULT_RELATIVE_REFERENCE = new Pitch('f', 0, 0);

    private final ConversionContext ctx;
    private final ExtensionStore store = new ExtensionStore();
    private final ScopeStack scopes = new ScopeStack();
    private MeiDocument document;
    private StaffState staff;
    private int staffCount;

    public LilyPondImporter(ConversionContext ctx) {
        this.ctx = ctx;
    }

    public ImportedScore importFile(LilyPondFile file) throws ConversionException {
        if (document != null) {
            throw new IllegalStateException("LilyPondImporter instances are single-use");
        }
        document = new MeiDocument();
        document.xmlId = ctx.generateId("mei");
        document.scoreDef.xmlId = ctx.generateId("scoreDef");
        document.section.xmlId = ctx.generateId("section");

        importFileLevel(file);

        if (file.music.isEmpty()) {
            throw new ConversionException("No music expression to import");
        }
        if (file.music.size() > 1) {
            ctx.addWarning("file", "Only the first of " + file.music.size() + " top-level music expressions is imported");
        }

        StaffGrp root = new StaffGrp();
        root.xmlId = ctx.generateId("staffGrp");
        document.scoreDef.staffGrp = root;
        importGroupLevel(file.music.get(0), root);
        if (root.children.isEmpty()) {
            throw new ConversionException("The music contains no staff");
        }

        ValidationResult validation = new MeiValidator().validate(document);
        if (!validation.isValid()) {
            throw new ConversionException("Imported document is invalid: " + String.join("; ", validation.diagnostics));
        }
        return new ImportedScore(document, store);
    }

    private void importFileLevel(LilyPondFile file) {
        Map<String, String> headerFields = new LinkedHashMap<>();
        if (file.header != null) {
            for (Assignment assignment : file.header) {
                if ("title".equals(assignment.key) && assignment.isQuoted() && document.head.title == null) {
                    document.head.title = assignment.text();
                } else if ("composer".equals(assignment.key) && assignment.isQuoted() && document.head.composer == null) {
                    document.head.composer = assignment.text();
                } else {
                    headerFields.put(assignment.key, assignment.value);
                }
            }
        }
        List<FormatOriginInfo.OutputDef> outputDefs = new ArrayList<>();
        for (OutputDef def : file.outputDefs) {
            outputDefs.add(new FormatOriginInfo.OutputDef(def.kind, toMap(def.assignments)));
        }
        if (file.version != null || file.scoreBlock || !headerFields.isEmpty() || !outputDefs.isEmpty()) {
            store.insert(document.xmlId, new FormatOriginInfo(file.version, file.scoreBlock, headerFields, outputDefs));
        }
    }

    // ---- staff groups and staves ----

    private void importGroupLevel(Music music, StaffGrp parent) throws ConversionException {
        if (music instanceof ContextedMusic contexted) {
            importContext(contexted, parent);
        } else if (music instanceof SimultaneousMusic sim && !sim.voiceSeparated && !sim.items.isEmpty()
                && sim.items.stream().allMatch(ContextedMusic.class::isInstance)) {
            for (Music item : sim.items) {
                importContext((ContextedMusic) item, parent);
            }
        } else {
            importStaff(null, music, parent);
        }
    }

    private void importContext(ContextedMusic contexted, StaffGrp parent) throws ConversionException {
        String type = contexted.contextType;
        if (STAFF_CONTEXTS.contains(type)) {
            importStaff(contexted, contexted.music, parent);
        } else if (GROUP_CONTEXTS.contains(type)) {
            importGroup(contexted, parent);
        } else if ("Voice".equals(type)) {
            ctx.addWarning("staffGrp " + parent.xmlId, "Voice context is not kept; its music is imported");
            importGroupLevel(contexted.music, parent);
        } else {
            ctx.addWarning("staffGrp " + parent.xmlId, type + " context is not supported; its content is skipped");
        }
    }

    private void importGroup(ContextedMusic contexted, StaffGrp parent) throws ConversionException {
        StaffGrp group = new StaffGrp();
        group.xmlId = ctx.generateId("staffGrp");
        switch (contexted.contextType) {
            case "ChoirStaff" -> {
                group.symbol = "bracket";
                group.barThru = false;
            }
            case "PianoStaff", "GrandStaff" -> {
                group.symbol = "brace";
                group.barThru = true;
            }
            default -> {
                group.symbol = "bracket";
                group.barThru = true;
            }
        }
        Map<String, String> withAssignments = new LinkedHashMap<>();
        String name = null;
        String shortName = null;
        if (contexted.with != null) {
            for (Assignment assignment : contexted.with) {
                if (INSTRUMENT_NAME.equals(assignment.key) && assignment.isQuoted() && name == null) {
                    name = assignment.text();
                } else if (SHORT_INSTRUMENT_NAME.equals(assignment.key) && assignment.isQuoted() && shortName == null) {
                    shortName = assignment.text();
                } else {
                    withAssignments.put(assignment.key, assignment.value);
                }
            }
        }
        if (name != null) {
            Label label = new Label(name);
            label.xmlId = ctx.generateId("label");
            group.children.add(label);
        }
        if (shortName != null) {
            LabelAbbr labelAbbr = new LabelAbbr(shortName);
            labelAbbr.xmlId = ctx.generateId("labelAbbr");
            group.children.add(labelAbbr);
        }
        store.insert(group.xmlId, new StaffContextInfo(contexted.keyword, contexted.contextType, contexted.name,
                withAssignments));
        parent.children.add(group);
        importGroupLevel(contexted.music, group);
    }

    private void importStaff(ContextedMusic contexted, Music music, StaffGrp parent) throws ConversionException {
        int n = ++staffCount;
        StaffDef staffDef = new StaffDef();
        staffDef.xmlId = ctx.generateId("staffDef");
        staffDef.n = n;
        staffDef.lines = contexted == null ? 5 : staffLines(contexted.contextType);
        if (contexted != null) {
            applyStaffWith(contexted, staffDef);
        }
        parent.children.add(staffDef);

        Staff meiStaff = new Staff();
        meiStaff.xmlId = ctx.generateId("staff");
        meiStaff.n = n;
        document.section.staves.add(meiStaff);
        staff = new StaffState(staffDef, meiStaff);

        Music body = music;
        if (body instanceof RelativeMusic relative) {
            store.insert(staffDef.xmlId, pitchContext(relative.reference));
            staff.relativeRef = relative.reference != null ? relative.reference : DEFAULT_RELATIVE_REFERENCE;
            body = relative.body;
        }
        List<Music> branches = body instanceof SimultaneousMusic sim ? sim.items : List.of(body);
        if (body instanceof SimultaneousMusic plain && !plain.voiceSeparated && branches.size() > 1) {
            store.insert(staffDef.xmlId, PlainSimultaneousMarker.INSTANCE);
        }
        int layerNumber = 1;
        for (Music branch : branches) {
            Layer layer = new Layer();
            layer.xmlId = ctx.generateId("layer");
            layer.n = layerNumber++;
            meiStaff.layers.add(layer);
            staff.layer = layer.n;
            walk(branch, layer.children);
        }
        finishStaff();
        staff = null;
    }

    private void applyStaffWith(ContextedMusic contexted, StaffDef staffDef) {
        Map<String, String> withAssignments = new LinkedHashMap<>();
        String name = null;
        String shortName = null;
        String midiInstrument = null;
        if (contexted.with != null) {
            for (Assignment assignment : contexted.with) {
                if (INSTRUMENT_NAME.equals(assignment.key) && assignment.isQuoted() && name == null) {
                    name = assignment.text();
                } else if (SHORT_INSTRUMENT_NAME.equals(assignment.key) && assignment.isQuoted() && shortName == null) {
                    shortName = assignment.text();
                } else if (MIDI_INSTRUMENT.equals(assignment.key) && assignment.isQuoted() && midiInstrument == null) {
                    midiInstrument = assignment.text();
                } else {
                    withAssignments.put(assignment.key, assignment.value);
                }
            }
        }
        if (name != null) {
            staffDef.label = new Label(name);
            staffDef.label.xmlId = ctx.generateId("label");
        }
        if (shortName != null) {
            staffDef.labelAbbr = new LabelAbbr(shortName);
            staffDef.labelAbbr.xmlId = ctx.generateId("labelAbbr");
        }
        if (midiInstrument != null) {
            InstrDef instrDef = new InstrDef();
            instrDef.xmlId = ctx.generateId("instrDef");
            instrDef.midiInstrname = midiInstrument;
            staffDef.instrDefs.add(instrDef);
        }
        store.insert(staffDef.xmlId, new StaffContextInfo(contexted.keyword, contexted.contextType, contexted.name,
                withAssignments));
    }

    private static int staffLines(String contextType) {
        return switch (contextType) {
            case "RhythmicStaff" -> 1;
            case "TabStaff" -> 6;
            default -> 5;
        };
    }

    private static PitchContextInfo pitchContext(Pitch reference) {
        if (reference == null) {
            return PitchContextInfo.withoutReference();
        }
        return new PitchContextInfo(reference.step, reference.alter, reference.octave);
    }

    private void finishStaff() {
        if (!staff.events.isEmpty()) {
            store.insert(staff.staffDef.xmlId, staff.events.build());
        }
        if (staff.openTie != null) {
            dropUnterminated(staff.openTie, "tie");
        }
        for (Slur slur : staff.openSlurs) {
            dropUnterminated(slur, "slur");
        }
        for (Slur slur : staff.openPhrasingSlurs) {
            dropUnterminated(slur, "phrasing slur");
        }
        for (BeamSpan beam : staff.openBeams) {
            dropUnterminated(beam, "beam");
        }
        if (staff.openHairpin != null) {
            dropUnterminated(staff.openHairpin, "hairpin");
        }
    }

    private void dropUnterminated(ControlElement element, String what) {
        ctx.addWarning(staff.location(), "Unterminated " + what + " starting at " + element.startid + " is dropped");
        document.section.controlEvents.remove(element);
    }

    // ---- layer content ----

    private void walk(Music music, List<LayerElement> target) throws ConversionException {
        if (music instanceof SequentialMusic seq) {
            for (Music item : seq.items) {
                walk(item, target);
            }
        } else if (music instanceof NoteEvent note) {
            importNote(note, target);
        } else if (music instanceof ChordEvent chord) {
            importChord(chord, target);
        } else if (music instanceof ChordRepetition repetition) {
            importChordRepetition(repetition, target);
        } else if (music instanceof RestEvent rest) {
            importRest(rest, target);
        } else if (music instanceof TupletMusic tuplet) {
            importTuplet(tuplet, target);
        } else if (music instanceof GraceMusic grace) {
            importGrace(grace, target);
        } else if (music instanceof AfterGraceMusic afterGrace) {
            importAfterGrace(afterGrace, target);
        } else if (music instanceof RepeatMusic repeat) {
            importRepeat(repeat, target);
        } else if (music instanceof BarCheck) {
            addControlEvent(new ControlEvent.BarCheck());
        } else if (music instanceof BarLine barLine) {
            addControlEvent(new ControlEvent.BarLine(barLine.style));
        } else if (music instanceof MarkupMusic markup) {
            addControlEvent(markup.list
                    ? new ControlEvent.MarkupList(markup.serialized)
                    : new ControlEvent.Markup(markup.serialized));
        } else if (music instanceof ClefChange clef) {
            addControlEvent(new ControlEvent.Clef(clef.name));
        } else if (music instanceof KeySignature key) {
            addControlEvent(new ControlEvent.Key(key.tonic, key.mode));
        } else if (music instanceof TimeSignature time) {
            addControlEvent(new ControlEvent.Time(time.numerator, time.denominator));
        } else if (music instanceof SimultaneousMusic sim) {
            ctx.addWarning(staff.location(), "Simultaneous music inside a layer is imported sequentially");
            for (Music item : sim.items) {
                walk(item, target);
            }
        } else if (music instanceof ContextedMusic contexted) {
            if ("Voice".equals(contexted.contextType)) {
                ctx.addWarning(staff.location(), "Voice context is not kept; its music is imported");
                walk(contexted.music, target);
            } else {
                ctx.addWarning(staff.location(),
                        contexted.contextType + " context inside a staff is not supported; its content is skipped");
            }
        } else if (music instanceof RelativeMusic relative) {
            ctx.addWarning(staff.location(), "\\relative below staff level is imported as absolute pitches");
            Pitch saved = staff.relativeRef;
            staff.relativeRef = relative.reference != null ? relative.reference : DEFAULT_RELATIVE_REFERENCE;
            walk(relative.body, target);
            staff.relativeRef = saved;
        } else {
            throw new ConversionException("Unsupported music element " + music.getClass().getSimpleName());
        }
    }

    private void importNote(NoteEvent event, List<LayerElement> target) {
        Note note = note(resolve(event.pitch));
        Duration duration = effectiveDuration(event.duration);
        note.dur = duration.base;
        note.dots = duration.dots;
        graceInfo().ifPresent(info -> {
            note.grace = graceFlag(info);
            store.insert(note.xmlId, info);
        });
        emit(note, event, target);
    }

    private void importChord(ChordEvent event, List<LayerElement> target) {
        List<Pitch> resolved = new ArrayList<>();
        Pitch chordReference = staff.relativeRef;
        for (Pitch pitch : event.pitches) {
            resolved.add(resolve(pitch));
        }
        if (chordReference != null) {
            // the next note is relative to the first chord note, not the last
            staff.relativeRef = resolved.get(0);
        }
        staff.lastChord = resolved;
        emit(chord(resolved, event.duration), event, target);
    }

    private void importChordRepetition(ChordRepetition event, List<LayerElement> target) throws ConversionException {
        if (staff.lastChord == null) {
            throw new ConversionException("Chord repetition in " + staff.location() + " has no preceding chord");
        }
        Chord chord = chord(staff.lastChord, event.duration);
        store.insert(chord.xmlId, ChordRepetitionMarker.INSTANCE);
        emit(chord, event, target);
    }

    private Chord chord(List<Pitch> pitches, Duration written) {
        Chord chord = new Chord();
        chord.xmlId = ctx.generateId("chord");
        for (Pitch pitch : pitches) {
            chord.notes.add(note(pitch));
        }
        Duration duration = effectiveDuration(written);
        chord.dur = duration.base;
        chord.dots = duration.dots;
        graceInfo().ifPresent(info -> {
            chord.grace = graceFlag(info);
            store.insert(chord.xmlId, info);
        });
        return chord;
    }

    private void importRest(RestEvent event, List<LayerElement> target) {
        Duration duration = effectiveDuration(event.duration);
        if (event.skip) {
            Space space = new Space();
            space.xmlId = ctx.generateId("space");
            space.dur = duration.base;
            space.dots = duration.dots;
            emit(space, event, target);
            return;
        }
        Rest rest = new Rest();
        rest.xmlId = ctx.generateId("rest");
        rest.dur = duration.base;
        rest.dots = duration.dots;
        if (event.position != null) {
            Pitch position = staff.relativeRef == null
                    ? event.position
                    : event.position.resolveRelative(staff.relativeRef.step, staff.relativeRef.octave);
            rest.ploc = position.step;
            rest.oloc = position.absoluteOctave();
        }
        emit(rest, event, target);
    }

    private Note note(Pitch pitch) {
        Note note = new Note();
        note.xmlId = ctx.generateId("note");
        note.pname = pitch.step;
        note.oct = pitch.absoluteOctave();
        note.alter = pitch.alter;
        note.accidForced = pitch.forcedAccidental;
        note.accidCautionary = pitch.cautionaryAccidental;
        return note;
    }

    /**
     * Places a duration-bearing element, wrapping it for a tremolo, and attaches its post events.
     */
    private void emit(LayerElement element, RhythmicEvent event, List<LayerElement> target) {
        String eventId = element.xmlId;
        LayerElement placed = element;
        if (event.tremolo != null) {
            BTrem bTrem = new BTrem();
            bTrem.xmlId = ctx.generateId("bTrem");
            bTrem.child = element;
            int slashes = TremoloInfo.slashCount(event.tremolo);
            bTrem.num = slashes > 0 ? slashes : null;
            store.insert(bTrem.xmlId, new TremoloInfo(event.tremolo));
            placed = bTrem;
        }
        target.add(placed);
        if ((element instanceof Note || element instanceof Chord) && staff.openTie != null) {
            staff.openTie.endid = eventId;
            staff.openTie = null;
        }
        scopes.recordEvent(eventId);
        staff.eventCount++;
        applyPostEvents(eventId, event.postEvents);
    }

    private Duration effectiveDuration(Duration written) {
        if (written != null) {
            staff.lastDuration = written;
        }
        return staff.lastDuration;
    }

    private Pitch resolve(Pitch written) {
        if (staff.relativeRef == null) {
            return written;
        }
        Pitch resolved = written.resolveRelative(staff.relativeRef.step, staff.relativeRef.octave);
        staff.relativeRef = resolved;
        return resolved;
    }

    private Optional<GraceInfo> graceInfo() {
        return scopes.innermostGrace();
    }

    private static String graceFlag(GraceInfo info) {
        return info.kind == GraceInfo.Kind.APPOGGIATURA ? "acc" : "unacc";
    }

    private void addControlEvent(ControlEvent event) {
        staff.events.add(staff.layer, staff.eventCount, scopes.depth(), staff.blockCount, event);
    }

    // ---- post events ----

    private void applyPostEvents(String eventId, List<PostEvent> postEvents) {
        for (PostEvent postEvent : postEvents) {
            switch (postEvent.kind) {
                case TIE -> {
                    if (staff.openTie != null) {
                        dropUnterminated(staff.openTie, "tie");
                    }
                    staff.openTie = control(new Tie(), eventId);
                }
                case SLUR_START -> staff.openSlurs.push(control(new Slur(), eventId));
                case SLUR_END -> close(staff.openSlurs, eventId, "slur");
                case PHRASING_SLUR_START -> {
                    Slur slur = control(new Slur(), eventId);
                    store.insert(slur.xmlId, PhrasingSlurMarker.INSTANCE);
                    staff.openPhrasingSlurs.push(slur);
                }
                case PHRASING_SLUR_END -> close(staff.openPhrasingSlurs, eventId, "phrasing slur");
                case BEAM_START -> staff.openBeams.push(control(new BeamSpan(), eventId));
                case BEAM_END -> close(staff.openBeams, eventId, "beam");
                case CRESCENDO, DECRESCENDO -> {
                    closeHairpin(eventId);
                    Hairpin hairpin = control(new Hairpin(), eventId);
                    hairpin.form = postEvent.kind == PostEvent.Kind.CRESCENDO ? "cres" : "dim";
                    staff.openHairpin = hairpin;
                }
                case HAIRPIN_END -> {
                    if (staff.openHairpin == null) {
                        ctx.addWarning(staff.location(), "Hairpin end at " + eventId + " without an open hairpin");
                    }
                    closeHairpin(eventId);
                }
                case DYNAMIC -> {
                    closeHairpin(eventId);
                    Dynam dynam = control(new Dynam(), eventId);
                    dynam.text = postEvent.name;
                    dynam.place = place(postEvent.direction);
                }
                case SCRIPT -> script(eventId, postEvent.name, postEvent.direction);
                case ABBREVIATED_SCRIPT -> {
                    Optional<String> script = Scripts.expandAbbreviation(postEvent.name);
                    if (script.isPresent()) {
                        script(eventId, script.get(), postEvent.direction);
                    } else {
                        ctx.addWarning(staff.location(), "Unknown script abbreviation '" + postEvent.name + "'");
                    }
                }
                case FINGERING -> {
                    Fing fing = control(new Fing(), eventId);
                    fing.text = postEvent.name;
                    fing.place = place(postEvent.direction);
                }
                case STRING_NUMBER -> {
                    Dir dir = control(new Dir(), eventId);
                    dir.place = place(postEvent.direction);
                    store.insert(dir.xmlId, new ArticulationInfo(ArticulationInfo.Kind.STRING_NUMBER,
                            postEvent.name, postEvent.direction));
                }
            }
        }
    }

    private void script(String eventId, String name, Direction direction) {
        Optional<ControlElement> ornament = OrnamentTable.createElement(name);
        if (ornament.isPresent()) {
            ControlElement element = control(ornament.get(), eventId);
            element.place = place(direction);
            if (OrnamentTable.isAmbiguous(name)) {
                store.insert(element.xmlId, new OrnamentInfo(name));
            }
            return;
        }
        Dir dir = control(new Dir(), eventId);
        dir.place = place(direction);
        store.insert(dir.xmlId, new ArticulationInfo(ArticulationInfo.Kind.ARTICULATION, name, direction));
    }

    private <T extends ControlElement> void close(Deque<T> open, String eventId, String what) {
        if (open.isEmpty()) {
            ctx.addWarning(staff.location(), "End of " + what + " at " + eventId + " without a start");
            return;
        }
        open.pop().endid = eventId;
    }

    private void closeHairpin(String eventId) {
        if (staff.openHairpin != null) {
            staff.openHairpin.endid = eventId;
            staff.openHairpin = null;
        }
    }

    private static String place(Direction direction) {
        return switch (direction) {
            case UP -> "above";
            case DOWN -> "below";
            case NEUTRAL -> null;
        };
    }

    /**
     * Identifies the element, points it at its start event and appends it to the control list.
     */
    private <T extends ControlElement> T control(T element, String startid) {
        element.xmlId = ctx.generateId(element.element);
        element.startid = startid;
        element.staff = staff.n();
        document.section.controlEvents.add(element);
        return element;
    }

    // ---- blocks ----

    private void importTuplet(TupletMusic tuplet, List<LayerElement> target) throws ConversionException {
        TupletSpan span = control(new TupletSpan(), null);
        span.num = tuplet.numerator;
        span.numbase = tuplet.denominator;
        if (tuplet.spanDuration != null) {
            store.insert(span.xmlId, new TupletInfo(tuplet.numerator, tuplet.denominator,
                    new DurationInfo(tuplet.spanDuration.base, tuplet.spanDuration.dots)));
        }
        Scope scope = Scope.span(Scope.Kind.TUPLET, span);
        openScope(scope);
        walk(tuplet.body, target);
        closeSpan(scope, "tuplet");
    }

    private void importGrace(GraceMusic grace, List<LayerElement> target) throws ConversionException {
        GraceInfo info = GraceInfo.of(grace.kind);
        GraceGrp group = new GraceGrp();
        group.xmlId = ctx.generateId("graceGrp");
        group.attach = GraceGrp.ATTACH_PRE;
        group.grace = graceFlag(info);
        target.add(group);
        walkGrace(info, grace.body, group, "grace");
    }

    private void importAfterGrace(AfterGraceMusic afterGrace, List<LayerElement> target) throws ConversionException {
        walk(afterGrace.main, target);
        GraceInfo info = GraceInfo.afterGrace(afterGrace.fraction);
        GraceGrp group = new GraceGrp();
        group.xmlId = ctx.generateId("graceGrp");
        group.attach = GraceGrp.ATTACH_POST;
        group.grace = graceFlag(info);
        target.add(group);
        walkGrace(info, afterGrace.grace, group, "after-grace");
    }

    private void walkGrace(GraceInfo info, Music body, GraceGrp group, String what) throws ConversionException {
        Scope scope = Scope.grace(info);
        int firstControl = document.section.controlEvents.size();
        openScope(scope);
        walk(body, group.children);
        scopes.pop();
        if (scope.isEmpty()) {
            throw new ConversionException("Empty " + what + " block in " + staff.location());
        }
        List<ControlElement> inner = document.section.controlEvents
                .subList(firstControl, document.section.controlEvents.size());
        for (ControlElement control : inner) {
            if (isBlockSpan(control) && scope.firstEventId.equals(control.startid)
                    && scope.lastEventId.equals(control.endid)) {
                store.insert(group.xmlId, EnclosingGraceMarker.INSTANCE);
                break;
            }
        }
    }

    private boolean isBlockSpan(ControlElement control) {
        return control instanceof TupletSpan
                || (control instanceof Dir && (store.repeat(control.xmlId).isPresent()
                || store.ending(control.xmlId).isPresent()));
    }

    private void importRepeat(RepeatMusic repeat, List<LayerElement> target) throws ConversionException {
        Dir dir = control(new Dir(), null);
        Scope scope = Scope.span(Scope.Kind.REPEAT, dir);
        openScope(scope);
        walk(repeat.body, target);
        closeSpan(scope, "repeat");
        store.insert(dir.xmlId, new RepeatInfo(repeat.kind, repeat.count,
                repeat.alternatives.isEmpty() ? null : repeat.alternatives.size()));

        for (int i = 0; i < repeat.alternatives.size(); i++) {
            Dir ending = control(new Dir(), null);
            Scope endingScope = Scope.span(Scope.Kind.ENDING, ending);
            openScope(endingScope);
            walk(repeat.alternatives.get(i), target);
            closeSpan(endingScope, "alternative");
            store.insert(ending.xmlId, new EndingInfo(i));
        }
    }

    private void openScope(Scope scope) {
        scopes.push(scope);
        staff.blockCount++;
    }

    private void closeSpan(Scope scope, String what) throws ConversionException {
        scopes.pop();
        if (scope.isEmpty()) {
            throw new ConversionException("Empty " + what + " block in " + staff.location());
        }
        scope.span.startid = scope.firstEventId;
        scope.span.endid = scope.lastEventId;
    }

    private static Map<String, String> toMap(List<Assignment> assignments) {
        Map<String, String> map = new LinkedHashMap<>();
        for (Assignment assignment : assignments) {
            map.put(assignment.key, assignment.value);
        }
        return map;
    }
}
