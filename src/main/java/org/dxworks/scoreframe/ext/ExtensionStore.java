package org.dxworks.scoreframe.ext;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Side table for data the common tree cannot hold natively, keyed by element identity and concern.
 * <p>
 * Entries are write-once: a second entry for the same identity and concern is rejected. A missing
 * entry means the element's native fields carry everything there is to know.
 */
public final class ExtensionStore {

    private final Map<Concern, Map<String, ExtensionEntry>> entries = new EnumMap<>(Concern.class);

    public void insert(String id, ExtensionEntry entry) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Extension entries need an element identity");
        }
        Map<String, ExtensionEntry> byId = entries.computeIfAbsent(entry.concern(), c -> new LinkedHashMap<>());
        if (byId.containsKey(id)) {
            throw new IllegalStateException("Duplicate " + entry.concern().getName() + " entry for " + id);
        }
        byId.put(id, entry);
    }

    public Optional<ExtensionEntry> lookup(String id, Concern concern) {
        Map<String, ExtensionEntry> byId = entries.get(concern);
        return byId == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    /**
     * Lookup by the external concern name, e.g. "tuplet" or "event-sequence".
     */
    public Optional<ExtensionEntry> lookup(String id, String concernName) {
        return Concern.fromName(concernName).flatMap(concern -> lookup(id, concern));
    }

    public boolean contains(String id, Concern concern) {
        return lookup(id, concern).isPresent();
    }

    public Set<String> ids(Concern concern) {
        Map<String, ExtensionEntry> byId = entries.get(concern);
        return byId == null ? Collections.emptySet() : Collections.unmodifiableSet(byId.keySet());
    }

    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Optional<ArticulationInfo> articulation(String id) {
        return typed(id, Concern.ARTICULATION, ArticulationInfo.class);
    }

    public Optional<OrnamentInfo> ornament(String id) {
        return typed(id, Concern.ORNAMENT, OrnamentInfo.class);
    }

    public Optional<TremoloInfo> tremolo(String id) {
        return typed(id, Concern.TREMOLO, TremoloInfo.class);
    }

    public Optional<TupletInfo> tuplet(String id) {
        return typed(id, Concern.TUPLET, TupletInfo.class);
    }

    public Optional<GraceInfo> grace(String id) {
        return typed(id, Concern.GRACE, GraceInfo.class);
    }

    public Optional<RepeatInfo> repeat(String id) {
        return typed(id, Concern.REPEAT, RepeatInfo.class);
    }

    public Optional<EndingInfo> ending(String id) {
        return typed(id, Concern.ENDING, EndingInfo.class);
    }

    public boolean isChordRepetition(String id) {
        return contains(id, Concern.CHORD_REPETITION);
    }

    public Optional<EventSequence> eventSequence(String id) {
        return typed(id, Concern.EVENT_SEQUENCE, EventSequence.class);
    }

    public Optional<PitchContextInfo> pitchContext(String id) {
        return typed(id, Concern.PITCH_CONTEXT, PitchContextInfo.class);
    }

    public Optional<StaffContextInfo> staffContext(String id) {
        return typed(id, Concern.STAFF_CONTEXT, StaffContextInfo.class);
    }

    public boolean isPhrasingSlur(String id) {
        return contains(id, Concern.PHRASING_SLUR);
    }

    public Optional<FormatOriginInfo> formatOrigin(String id) {
        return typed(id, Concern.FORMAT_ORIGIN, FormatOriginInfo.class);
    }

    public Optional<PartSymbolInfo> partSymbol(String id) {
        return typed(id, Concern.PART_SYMBOL, PartSymbolInfo.class);
    }

    public Optional<InstrumentInfo> instrument(String id) {
        return typed(id, Concern.INSTRUMENT, InstrumentInfo.class);
    }

    public boolean isEnclosingGrace(String id) {
        return contains(id, Concern.ENCLOSING_GRACE);
    }

    public boolean isPlainSimultaneous(String id) {
        return contains(id, Concern.PLAIN_SIMULTANEOUS);
    }

    /**
     * Concern name to (identity to entry), both levels sorted, for reports and approval output.
     */
    @JsonValue
    public Map<String, Map<String, ExtensionEntry>> asMap() {
        Map<String, Map<String, ExtensionEntry>> result = new TreeMap<>();
        for (Map.Entry<Concern, Map<String, ExtensionEntry>> e : entries.entrySet()) {
            if (!e.getValue().isEmpty()) {
                result.put(e.getKey().getName(), new TreeMap<>(e.getValue()));
            }
        }
        return result;
    }

    private <T extends ExtensionEntry> Optional<T> typed(String id, Concern concern, Class<T> type) {
        return lookup(id, concern).filter(type::isInstance).map(type::cast);
    }
}
