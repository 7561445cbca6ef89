package org.dxworks.scoreframe.lilypond.exporter;

import org.dxworks.scoreframe.convert.ConversionContext;
import org.dxworks.scoreframe.convert.ConversionException;
import org.dxworks.scoreframe.ext.ArticulationInfo;
import org.dxworks.scoreframe.ext.ControlEvent;
import org.dxworks.scoreframe.ext.Direction;
import org.dxworks.scoreframe.ext.ExtensionStore;
import org.dxworks.scoreframe.ext.FormatOriginInfo;
import org.dxworks.scoreframe.ext.Fraction;
import org.dxworks.scoreframe.ext.GraceInfo;
import org.dxworks.scoreframe.ext.PitchContextInfo;
import org.dxworks.scoreframe.ext.PositionedEvent;
import org.dxworks.scoreframe.ext.RepeatInfo;
import org.dxworks.scoreframe.ext.StaffContextInfo;
import org.dxworks.scoreframe.ext.TremoloInfo;
import org.dxworks.scoreframe.ext.TupletInfo;
import org.dxworks.scoreframe.lilypond.OrnamentTable;
import org.dxworks.scoreframe.lilypond.importer.ImportedScore;
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
import org.dxworks.scoreframe.mei.Layer;
import org.dxworks.scoreframe.mei.LayerElement;
import org.dxworks.scoreframe.mei.LayerElements;
import org.dxworks.scoreframe.mei.MeiDocument;
import org.dxworks.scoreframe.mei.Note;
import org.dxworks.scoreframe.mei.Rest;
import org.dxworks.scoreframe.mei.Slur;
import org.dxworks.scoreframe.mei.Space;
import org.dxworks.scoreframe.mei.Staff;
import org.dxworks.scoreframe.mei.StaffDef;
import org.dxworks.scoreframe.mei.StaffGrp;
import org.dxworks.scoreframe.mei.StaffGrpChild;
import org.dxworks.scoreframe.mei.Tie;
import org.dxworks.scoreframe.mei.TupletSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Raises an MEI document and its extension entries back to LilyPond, mirroring {@code LilyPondImporter}.
 * <p>
 * Each layer is flattened to its duration-bearing events; tuplet, grace, repeat and ending blocks are
 * rebuilt from span annotations and grace groups, post events from the control elements pointing at each
 * event, and bar checks, bar lines, markup, clefs, keys and time signatures are replayed from the staff's
 * event sequence at their recorded layer, position, depth and block.
 */
public final class LilyPondExporter {

    private static final Pitch DEFAULT_RELATIVE_REFERENCE = new Pitch('f', 0, 0);

    private final ConversionContext ctx;
    private ExtensionStore store;
    private final Map<Integer, Staff> stavesByNumber = new HashMap<>();
    private final Map<String, List<ControlElement>> byStart = new HashMap<>();
    private final Map<String, List<ControlElement>> byEnd = new HashMap<>();
    private final List<ControlElement> spanElements = new ArrayList<>();
    private final Set<String> claimedSpans = new HashSet<>();
    private int blocksOpened; // in the staff being exported

    public LilyPondExporter(ConversionContext ctx) {
        this.ctx = ctx;
    }

    public String export(ImportedScore score) throws ConversionException {
        return LilyPondSerializer.serialize(exportFile(score.document, score.store));
    }

    public LilyPondFile exportFile(MeiDocument document, ExtensionStore store) throws ConversionException {
        if (this.store != null) {
            throw new IllegalStateException("LilyPondExporter instances are single-use");
        }
        this.store = store;
        index(document);

        LilyPondFile file = new LilyPondFile();
        Optional<FormatOriginInfo> origin = document.xmlId == null
                ? Optional.empty() : store.formatOrigin(document.xmlId);
        exportFileLevel(document, origin, file);

        if (document.scoreDef == null || document.scoreDef.staffGrp == null) {
            throw new ConversionException("Document has no staff group to export");
        }
        file.music.add(rootMusic(document.scoreDef.staffGrp));

        for (ControlElement span : spanElements) {
            if (!claimedSpans.contains(span.xmlId)) {
                throw new ConversionException(span.element + " " + span.xmlId
                        + " does not start on an event of any exported layer: " + span.startid);
            }
        }
        return file;
    }

    private void index(MeiDocument document) {
        if (document.section == null) {
            return;
        }
        for (Staff staff : document.section.staves) {
            stavesByNumber.put(staff.n, staff);
        }
        for (ControlElement control : document.section.controlEvents) {
            if (isSpan(control)) {
                spanElements.add(control);
                continue;
            }
            if (control.startid != null) {
                byStart.computeIfAbsent(control.startid, k -> new ArrayList<>()).add(control);
            }
            if (control.endid != null) {
                byEnd.computeIfAbsent(control.endid, k -> new ArrayList<>()).add(control);
            }
        }
    }

    private boolean isSpan(ControlElement control) {
        if (control instanceof TupletSpan) {
            return true;
        }
        return control instanceof Dir && control.xmlId != null
                && (store.repeat(control.xmlId).isPresent() || store.ending(control.xmlId).isPresent());
    }

    private static void exportFileLevel(MeiDocument document, Optional<FormatOriginInfo> origin, LilyPondFile file) {
        List<Assignment> header = new ArrayList<>();
        if (document.head != null && document.head.title != null) {
            header.add(Assignment.quoted("title", document.head.title));
        }
        if (document.head != null && document.head.composer != null) {
            header.add(Assignment.quoted("composer", document.head.composer));
        }
        if (origin.isPresent()) {
            FormatOriginInfo info = origin.get();
            file.version = info.version;
            file.scoreBlock = info.scoreBlock;
            info.headerFields.forEach((key, value) -> header.add(new Assignment(key, value)));
            for (FormatOriginInfo.OutputDef def : info.outputDefs) {
                OutputDef outputDef = new OutputDef(def.kind);
                def.assignments.forEach((key, value) -> outputDef.assignments.add(new Assignment(key, value)));
                file.outputDefs.add(outputDef);
            }
        }
        if (!header.isEmpty()) {
            file.header = header;
        }
    }

    // ---- contexts ----

    private Music rootMusic(StaffGrp root) throws ConversionException {
        List<StaffGrpChild> members = members(root);
        if (members.isEmpty()) {
            throw new ConversionException("staffGrp " + root.xmlId + " has no staves to export");
        }
        if (members.size() == 1) {
            StaffGrpChild only = members.get(0);
            if (isBareStaff(only)) {
                return staffMusic((StaffDef) only);
            }
            return contextMusic(only);
        }
        SimultaneousMusic sim = new SimultaneousMusic();
        for (StaffGrpChild member : members) {
            sim.items.add(contextMusic(member));
        }
        return sim;
    }

    private List<StaffGrpChild> members(StaffGrp group) {
        List<StaffGrpChild> members = new ArrayList<>();
        for (StaffGrpChild child : group.children) {
            if (child instanceof StaffDef || child instanceof StaffGrp) {
                members.add(child);
            }
        }
        return members;
    }

    /**
     * A staff that was never written as a context, e.g. music given without {@code \new Staff}.
     */
    private boolean isBareStaff(StaffGrpChild child) {
        return child instanceof StaffDef staffDef
                && (staffDef.xmlId == null || store.staffContext(staffDef.xmlId).isEmpty())
                && staffDef.label == null && staffDef.labelAbbr == null && staffDef.instrDefs.isEmpty();
    }

    private Music contextMusic(StaffGrpChild member) throws ConversionException {
        if (member instanceof StaffDef staffDef) {
            return staffContext(staffDef);
        }
        return groupContext((StaffGrp) member);
    }

    private ContextedMusic staffContext(StaffDef staffDef) throws ConversionException {
        Optional<StaffContextInfo> info = contextInfo(staffDef.xmlId);
        ContextedMusic contexted = new ContextedMusic(
                info.map(i -> i.keyword).orElse("new"),
                info.map(i -> i.contextType).orElse("Staff"));
        contexted.name = info.map(i -> i.name).orElse(null);

        List<Assignment> with = new ArrayList<>();
        staffDef.labelText().ifPresent(text -> with.add(Assignment.quoted("instrumentName", text)));
        staffDef.labelAbbrText().ifPresent(text -> with.add(Assignment.quoted("shortInstrumentName", text)));
        for (InstrDef instrDef : staffDef.instrDefs) {
            if (instrDef.midiInstrname != null) {
                with.add(Assignment.quoted("midiInstrument", instrDef.midiInstrname));
                break;
            }
        }
        info.ifPresent(i -> i.withAssignments.forEach((key, value) -> with.add(new Assignment(key, value))));
        contexted.with = with.isEmpty() ? null : with;
        contexted.music = staffMusic(staffDef);
        return contexted;
    }

    private ContextedMusic groupContext(StaffGrp group) throws ConversionException {
        Optional<StaffContextInfo> info = contextInfo(group.xmlId);
        ContextedMusic contexted = new ContextedMusic(
                info.map(i -> i.keyword).orElse("new"),
                info.map(i -> i.contextType).orElseGet(() -> groupContextType(group)));
        contexted.name = info.map(i -> i.name).orElse(null);

        List<Assignment> with = new ArrayList<>();
        group.labelText().ifPresent(text -> with.add(Assignment.quoted("instrumentName", text)));
        group.labelAbbrText().ifPresent(text -> with.add(Assignment.quoted("shortInstrumentName", text)));
        info.ifPresent(i -> i.withAssignments.forEach((key, value) -> with.add(new Assignment(key, value))));
        contexted.with = with.isEmpty() ? null : with;

        List<StaffGrpChild> members = members(group);
        if (members.size() == 1 && isBareStaff(members.get(0))) {
            contexted.music = staffMusic((StaffDef) members.get(0));
        } else {
            SimultaneousMusic sim = new SimultaneousMusic();
            for (StaffGrpChild member : members) {
                sim.items.add(contextMusic(member));
            }
            contexted.music = sim;
        }
        return contexted;
    }

    private Optional<StaffContextInfo> contextInfo(String id) {
        return id == null ? Optional.empty() : store.staffContext(id);
    }

    private static String groupContextType(StaffGrp group) {
        if ("brace".equals(group.symbol)) {
            return "PianoStaff";
        }
        if (Boolean.FALSE.equals(group.barThru)) {
            return "ChoirStaff";
        }
        return "StaffGroup";
    }

    // ---- staves and layers ----

    private Music staffMusic(StaffDef staffDef) throws ConversionException {
        Staff staff = staffDef.n == null ? null : stavesByNumber.get(staffDef.n);
        if (staff == null || staff.layers.isEmpty()) {
            return new SequentialMusic();
        }
        List<PositionedEvent> pending = new LinkedList<>();
        blocksOpened = 0;
        if (staffDef.xmlId != null) {
            store.eventSequence(staffDef.xmlId).ifPresent(seq -> pending.addAll(seq.events));
        }

        List<Music> layers = new ArrayList<>();
        int offset = 0;
        for (Layer layer : staff.layers) {
            LayerBuilder builder = new LayerBuilder(layer, offset, pending);
            layers.add(new SequentialMusic(builder.build()));
            offset += builder.events.size();
        }
        if (!pending.isEmpty()) {
            SequentialMusic last = (SequentialMusic) layers.get(layers.size() - 1);
            for (PositionedEvent event : pending) {
                last.items.add(controlEventMusic(event.event));
            }
            pending.clear();
        }

        Music body;
        if (layers.size() == 1) {
            body = layers.get(0);
        } else {
            SimultaneousMusic sim = new SimultaneousMusic();
            sim.items.addAll(layers);
            sim.voiceSeparated = staffDef.xmlId == null || !store.isPlainSimultaneous(staffDef.xmlId);
            body = sim;
        }
        new DurationOmitter().visit(body);

        Optional<PitchContextInfo> pitchContext = staffDef.xmlId == null
                ? Optional.empty() : store.pitchContext(staffDef.xmlId);
        if (pitchContext.isEmpty()) {
            return body;
        }
        PitchContextInfo info = pitchContext.get();
        Pitch reference = info.hasReference()
                ? new Pitch(info.referenceStep, info.referenceAlter, info.referenceOctave)
                : null;
        new Relativizer(reference != null ? reference : DEFAULT_RELATIVE_REFERENCE).visit(body);
        return new RelativeMusic(reference, body);
    }

    private static Music controlEventMusic(ControlEvent event) {
        if (event instanceof ControlEvent.BarCheck) {
            return new BarCheck();
        }
        if (event instanceof ControlEvent.BarLine barLine) {
            return new BarLine(barLine.style);
        }
        if (event instanceof ControlEvent.Markup markup) {
            return new MarkupMusic(false, markup.serialized);
        }
        if (event instanceof ControlEvent.MarkupList markupList) {
            return new MarkupMusic(true, markupList.serialized);
        }
        if (event instanceof ControlEvent.Clef clef) {
            return new ClefChange(clef.name);
        }
        if (event instanceof ControlEvent.Key key) {
            return new KeySignature(key.tonic, key.mode);
        }
        if (event instanceof ControlEvent.Time time) {
            return new TimeSignature(time.numerator, time.denominator);
        }
        throw new IllegalArgumentException("Unknown control event " + event.type);
    }

    private enum SpanKind {
        TUPLET,
        REPEAT,
        ENDING,
        GRACE,
        AFTER_GRACE
    }

    /**
     * A block over the inclusive event index range [start, end].
     */
    private static final class Span {
        final SpanKind kind;
        final int start;
        final int end;
        final int order;
        final int rank;               // among blocks over the same range: -1 outside, 0 control spans, 1 inside
        final ControlElement element; // null for grace groups
        final GraceGrp graceGrp;      // null for control spans

        Span(SpanKind kind, int start, int end, int order, int rank, ControlElement element, GraceGrp graceGrp) {
            this.kind = kind;
            this.start = start;
            this.end = end;
            this.order = order;
            this.rank = rank;
            this.element = element;
            this.graceGrp = graceGrp;
        }

        boolean isGrace() {
            return graceGrp != null;
        }

        String id() {
            return element != null ? element.xmlId : graceGrp.xmlId;
        }
    }

    private static final Comparator<Span> SPAN_ORDER = Comparator
            .comparingInt((Span s) -> s.start)
            .thenComparing(Comparator.comparingInt((Span s) -> s.end).reversed())
            .thenComparingInt((Span s) -> s.rank)
            .thenComparingInt(s -> s.order);

    /**
     * Rebuilds the nested block structure of one layer. Positions are staff-wide: the layer's events
     * occupy [offset, offset + events.size()).
     */
    private final class LayerBuilder {
        private final int offset;
        private final List<PositionedEvent> pending;
        private final List<LayerElement> events;
        private final Map<String, Integer> positions = new HashMap<>();
        private final Map<String, BTrem> tremolos = new HashMap<>();
        private final List<GraceGrp> graceGroups = new ArrayList<>();
        private final Layer layer;

        LayerBuilder(Layer layer, int offset, List<PositionedEvent> pending) {
            this.layer = layer;
            this.offset = offset;
            this.pending = pending;
            this.events = LayerElements.events(layer.children);
            for (int i = 0; i < events.size(); i++) {
                positions.put(events.get(i).xmlId, offset + i);
            }
            scanWrappers(layer.children);
        }

        private void scanWrappers(List<LayerElement> elements) {
            for (LayerElement element : elements) {
                if (element instanceof BTrem bTrem && bTrem.child != null) {
                    tremolos.put(bTrem.child.xmlId, bTrem);
                } else if (element instanceof GraceGrp graceGrp) {
                    graceGroups.add(graceGrp);
                    scanWrappers(graceGrp.children);
                }
            }
        }

        List<Music> build() throws ConversionException {
            List<Span> spans = collectSpans();
            spans.sort(SPAN_ORDER);
            return build(offset, offset + events.size(), spans, 0);
        }

        private List<Span> collectSpans() throws ConversionException {
            List<Span> spans = new ArrayList<>();
            for (int order = 0; order < spanElements.size(); order++) {
                ControlElement element = spanElements.get(order);
                Integer start = positions.get(element.startid);
                if (start == null) {
                    continue;
                }
                Integer end = element.endid == null ? start : positions.get(element.endid);
                if (end == null || end < start) {
                    throw new ConversionException(element.element + " " + element.xmlId
                            + " ends outside layer " + layer.xmlId + ": " + element.endid);
                }
                claimedSpans.add(element.xmlId);
                SpanKind kind;
                if (element instanceof TupletSpan) {
                    kind = SpanKind.TUPLET;
                } else if (store.repeat(element.xmlId).isPresent()) {
                    kind = SpanKind.REPEAT;
                } else {
                    kind = SpanKind.ENDING;
                }
                spans.add(new Span(kind, start, end, order, 0, element, null));
            }
            for (int order = 0; order < graceGroups.size(); order++) {
                GraceGrp graceGrp = graceGroups.get(order);
                List<LayerElement> graceEvents = LayerElements.events(graceGrp.children);
                if (graceEvents.isEmpty()) {
                    throw new ConversionException("graceGrp " + graceGrp.xmlId + " has no events");
                }
                int start = positions.get(graceEvents.get(0).xmlId);
                int end = positions.get(graceEvents.get(graceEvents.size() - 1).xmlId);
                SpanKind kind = GraceGrp.ATTACH_POST.equals(graceGrp.attach) ? SpanKind.AFTER_GRACE : SpanKind.GRACE;
                int rank = store.isEnclosingGrace(graceGrp.xmlId) ? -1 : 1;
                spans.add(new Span(kind, start, end, order, rank, null, graceGrp));
            }
            return spans;
        }

        private List<Music> build(int from, int to, List<Span> spans, int depth) throws ConversionException {
            List<Music> items = new ArrayList<>();
            int i = from;
            int s = 0;
            while (i < to) {
                if (s >= spans.size() || spans.get(s).start != i) {
                    if (s < spans.size() && spans.get(s).start < i) {
                        throw new ConversionException("Span " + spans.get(s).id() + " overlaps another block");
                    }
                    emitPending(items, i, depth);
                    items.add(leaf(i));
                    i++;
                    continue;
                }
                Span span = spans.get(s);
                int innerEnd = innerEnd(spans, s);
                List<Span> inner = spans.subList(s + 1, innerEnd);
                s = innerEnd;

                if (span.kind == SpanKind.AFTER_GRACE) {
                    if (items.isEmpty()) {
                        throw new ConversionException("After-grace group " + span.id() + " has no main note before it");
                    }
                    Music main = items.remove(items.size() - 1);
                    blocksOpened++;
                    Music grace = new SequentialMusic(build(span.start, span.end + 1, inner, depth + 1));
                    items.add(new AfterGraceMusic(afterGraceFraction(span), main, grace));
                    i = span.end + 1;
                    continue;
                }

                emitPending(items, i, depth);
                blocksOpened++;
                Music body = new SequentialMusic(build(span.start, span.end + 1, inner, depth + 1));
                i = span.end + 1;
                switch (span.kind) {
                    case TUPLET -> items.add(tuplet((TupletSpan) span.element, body));
                    case GRACE -> items.add(new GraceMusic(graceKind(span), body));
                    case REPEAT -> {
                        RepeatInfo info = store.repeat(span.id()).orElseThrow();
                        RepeatMusic repeat = new RepeatMusic(info.repeatType, info.count, body);
                        int alternatives = info.alternativeCount == null ? 0 : info.alternativeCount;
                        for (int a = 0; a < alternatives; a++) {
                            if (s >= spans.size() || spans.get(s).kind != SpanKind.ENDING || spans.get(s).start != i) {
                                throw new ConversionException("Repeat " + span.id() + " is missing alternative " + a);
                            }
                            Span ending = spans.get(s);
                            int endingInnerEnd = innerEnd(spans, s);
                            List<Span> endingInner = spans.subList(s + 1, endingInnerEnd);
                            s = endingInnerEnd;
                            blocksOpened++;
                            repeat.alternatives.add(new SequentialMusic(
                                    build(ending.start, ending.end + 1, endingInner, depth + 1)));
                            i = ending.end + 1;
                        }
                        items.add(repeat);
                    }
                    case ENDING -> throw new ConversionException("Ending " + span.id() + " does not follow a repeat");
                    default -> throw new IllegalStateException("Unexpected span kind " + span.kind);
                }
            }
            emitPending(items, to, depth);
            return items;
        }

        /**
         * Index just past the spans nested inside {@code spans.get(s)}.
         */
        private int innerEnd(List<Span> spans, int s) throws ConversionException {
            Span outer = spans.get(s);
            int next = s + 1;
            while (next < spans.size() && spans.get(next).start <= outer.end) {
                if (spans.get(next).end > outer.end) {
                    throw new ConversionException("Span " + spans.get(next).id() + " overlaps " + outer.id());
                }
                next++;
            }
            return next;
        }

        /**
         * Emits this layer's events recorded at this position, depth and block, plus any stale ones
         * left behind.
         */
        private void emitPending(List<Music> items, int position, int depth) {
            Iterator<PositionedEvent> it = pending.iterator();
            while (it.hasNext()) {
                PositionedEvent event = it.next();
                if (event.isAt(layer.n, position, depth, blocksOpened)
                        || (event.layer == layer.n && event.position < position)) {
                    items.add(controlEventMusic(event.event));
                    it.remove();
                }
            }
        }

        private Music leaf(int index) throws ConversionException {
            LayerElement element = events.get(index - offset);
            RhythmicEvent event;
            Integer dur;
            int dots;
            if (element instanceof Note note) {
                event = new NoteEvent(pitch(note));
                dur = note.dur;
                dots = note.dots;
            } else if (element instanceof Chord chord) {
                if (store.isChordRepetition(chord.xmlId)) {
                    event = new ChordRepetition();
                } else {
                    ChordEvent chordEvent = new ChordEvent();
                    for (Note note : chord.notes) {
                        chordEvent.pitches.add(pitch(note));
                    }
                    event = chordEvent;
                }
                dur = chord.dur;
                dots = chord.dots;
            } else if (element instanceof Rest rest) {
                RestEvent restEvent = new RestEvent(false);
                if (rest.ploc != null) {
                    restEvent.position = new Pitch(rest.ploc, 0, (rest.oloc != null ? rest.oloc : 4) - 3);
                }
                event = restEvent;
                dur = rest.dur;
                dots = rest.dots;
            } else if (element instanceof Space space) {
                event = new RestEvent(true);
                dur = space.dur;
                dots = space.dots;
            } else {
                throw new ConversionException("Unsupported layer element " + element.element + " " + element.xmlId);
            }
            event.duration = dur == null ? null : new Duration(dur, dots);

            BTrem bTrem = tremolos.get(element.xmlId);
            if (bTrem != null) {
                event.tremolo = store.tremolo(bTrem.xmlId)
                        .map(info -> info.subdivision)
                        .orElse(TremoloInfo.subdivisionForSlashes(bTrem.num == null ? 0 : bTrem.num));
            }
            postEvents(element.xmlId, event.postEvents);
            return event;
        }

        private TupletMusic tuplet(TupletSpan span, Music body) {
            Optional<TupletInfo> info = store.tuplet(span.xmlId);
            Duration spanDuration = info
                    .filter(i -> i.spanDuration != null)
                    .map(i -> new Duration(i.spanDuration.base, i.spanDuration.dots))
                    .orElse(null);
            return new TupletMusic(span.num, span.numbase, spanDuration, body);
        }

        private GraceInfo.Kind graceKind(Span span) {
            Optional<GraceInfo> info = firstGraceInfo(span.graceGrp);
            if (info.isPresent() && !info.get().isAfterGrace()) {
                return info.get().kind;
            }
            return "acc".equals(span.graceGrp.grace) ? GraceInfo.Kind.APPOGGIATURA : GraceInfo.Kind.GRACE;
        }

        private Fraction afterGraceFraction(Span span) {
            return firstGraceInfo(span.graceGrp).map(info -> info.fraction).orElse(null);
        }

        private Optional<GraceInfo> firstGraceInfo(GraceGrp graceGrp) {
            for (LayerElement event : LayerElements.events(graceGrp.children)) {
                Optional<GraceInfo> info = store.grace(event.xmlId);
                if (info.isPresent()) {
                    return info;
                }
            }
            return Optional.empty();
        }
    }

    private static Pitch pitch(Note note) {
        Pitch pitch = new Pitch(note.pname, note.alter, note.oct - 3);
        pitch.forcedAccidental = note.accidForced;
        pitch.cautionaryAccidental = note.accidCautionary;
        return pitch;
    }

    // ---- post events ----

    /**
     * Closing marks first, then everything starting here in control-list order.
     */
    private void postEvents(String eventId, List<PostEvent> out) {
        List<ControlElement> starting = byStart.getOrDefault(eventId, List.of());
        List<ControlElement> ending = byEnd.getOrDefault(eventId, List.of());

        for (ControlElement control : ending) {
            if (control instanceof Slur) {
                out.add(new PostEvent(store.isPhrasingSlur(control.xmlId)
                        ? PostEvent.Kind.PHRASING_SLUR_END : PostEvent.Kind.SLUR_END));
            } else if (control instanceof BeamSpan) {
                out.add(new PostEvent(PostEvent.Kind.BEAM_END));
            } else if (control instanceof Hairpin && !endsImplicitly(control, starting)) {
                out.add(new PostEvent(PostEvent.Kind.HAIRPIN_END));
            }
        }

        for (ControlElement control : starting) {
            Direction direction = direction(control.place);
            if (control instanceof Tie) {
                out.add(new PostEvent(PostEvent.Kind.TIE));
            } else if (control instanceof Slur) {
                out.add(new PostEvent(store.isPhrasingSlur(control.xmlId)
                        ? PostEvent.Kind.PHRASING_SLUR_START : PostEvent.Kind.SLUR_START));
            } else if (control instanceof BeamSpan) {
                out.add(new PostEvent(PostEvent.Kind.BEAM_START));
            } else if (control instanceof Hairpin hairpin) {
                out.add(new PostEvent("dim".equals(hairpin.form)
                        ? PostEvent.Kind.DECRESCENDO : PostEvent.Kind.CRESCENDO));
            } else if (control instanceof Dynam dynam) {
                out.add(new PostEvent(PostEvent.Kind.DYNAMIC, direction, dynam.text));
            } else if (control instanceof Fing fing) {
                out.add(new PostEvent(PostEvent.Kind.FINGERING, direction, fing.text));
            } else if (control instanceof Dir dir) {
                articulation(dir, out);
            } else {
                Optional<String> ornament = OrnamentTable.scriptName(control, store);
                if (ornament.isPresent()) {
                    out.add(new PostEvent(PostEvent.Kind.SCRIPT, direction, ornament.get()));
                } else {
                    ctx.addWarning(control.element + " " + control.xmlId, "No LilyPond equivalent; dropped");
                }
            }
        }
    }

    /**
     * A dynamic or a new hairpin on the same event ends a hairpin without an explicit {@code \!}.
     */
    private static boolean endsImplicitly(ControlElement hairpin, List<ControlElement> starting) {
        for (ControlElement control : starting) {
            if (control instanceof Dynam || (control instanceof Hairpin && control != hairpin)) {
                return true;
            }
        }
        return false;
    }

    private void articulation(Dir dir, List<PostEvent> out) {
        Optional<ArticulationInfo> stored = dir.xmlId == null ? Optional.empty() : store.articulation(dir.xmlId);
        if (stored.isEmpty()) {
            ctx.addWarning("dir " + dir.xmlId, "Direction without articulation data; dropped");
            return;
        }
        ArticulationInfo info = stored.get();
        Direction direction = info.direction != null ? info.direction : Direction.NEUTRAL;
        switch (info.kind) {
            case ARTICULATION -> {
                Optional<String> abbreviation = Scripts.abbreviationFor(info.value);
                if (abbreviation.isPresent()) {
                    out.add(new PostEvent(PostEvent.Kind.ABBREVIATED_SCRIPT, direction, abbreviation.get()));
                } else {
                    out.add(new PostEvent(PostEvent.Kind.SCRIPT, direction, info.value));
                }
            }
            case FINGERING -> out.add(new PostEvent(PostEvent.Kind.FINGERING, direction, info.value));
            case STRING_NUMBER -> out.add(new PostEvent(PostEvent.Kind.STRING_NUMBER, direction, info.value));
        }
    }

    private static Direction direction(String place) {
        if ("above".equals(place)) {
            return Direction.UP;
        }
        if ("below".equals(place)) {
            return Direction.DOWN;
        }
        return Direction.NEUTRAL;
    }

    // ---- staff-wide passes ----

    /**
     * Visits rhythmic events in the order the importer reads them: after-grace main note before its
     * grace notes, repeat body before its alternatives.
     */
    private abstract static class MusicWalker {

        abstract void rhythmic(RhythmicEvent event);

        void visit(Music music) {
            if (music instanceof RhythmicEvent event) {
                rhythmic(event);
            } else if (music instanceof SequentialMusic seq) {
                seq.items.forEach(this::visit);
            } else if (music instanceof SimultaneousMusic sim) {
                sim.items.forEach(this::visit);
            } else if (music instanceof TupletMusic tuplet) {
                visit(tuplet.body);
            } else if (music instanceof GraceMusic grace) {
                visit(grace.body);
            } else if (music instanceof AfterGraceMusic afterGrace) {
                visit(afterGrace.main);
                visit(afterGrace.grace);
            } else if (music instanceof RepeatMusic repeat) {
                visit(repeat.body);
                repeat.alternatives.forEach(this::visit);
            } else if (music instanceof RelativeMusic relative) {
                visit(relative.body);
            } else if (music instanceof ContextedMusic contexted) {
                visit(contexted.music);
            }
        }
    }

    /**
     * Drops each duration equal to the one before it, in reading order.
     */
    private static final class DurationOmitter extends MusicWalker {
        private Duration previous;

        @Override
        void rhythmic(RhythmicEvent event) {
            if (event.duration == null) {
                return;
            }
            if (event.duration.equals(previous)) {
                event.duration = null;
            } else {
                previous = event.duration;
            }
        }
    }

    /**
     * Rewrites absolute octaves as relative octave marks, walking in the order the importer resolves them.
     */
    private static final class Relativizer extends MusicWalker {
        private Pitch reference;

        Relativizer(Pitch reference) {
            this.reference = reference;
        }

        @Override
        void rhythmic(RhythmicEvent event) {
            if (event instanceof NoteEvent note) {
                Pitch absolute = note.pitch.copy();
                note.pitch.octave = absolute.toRelativeMarks(reference.step, reference.octave);
                reference = absolute;
            } else if (event instanceof ChordEvent chord && !chord.pitches.isEmpty()) {
                Pitch first = chord.pitches.get(0).copy();
                for (Pitch pitch : chord.pitches) {
                    Pitch absolute = pitch.copy();
                    pitch.octave = absolute.toRelativeMarks(reference.step, reference.octave);
                    reference = absolute;
                }
                reference = first;
            } else if (event instanceof RestEvent rest && rest.position != null) {
                rest.position.octave = rest.position.toRelativeMarks(reference.step, reference.octave);
            }
        }
    }
}
