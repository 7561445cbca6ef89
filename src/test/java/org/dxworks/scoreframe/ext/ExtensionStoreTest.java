package org.dxworks.scoreframe.ext;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ExtensionStoreTest {

    private final ExtensionStore store = new ExtensionStore();

    @Test
    void entriesAreKeyedByIdentityAndConcern() {
        store.insert("n1", new TremoloInfo(16));
        store.insert("n1", GraceInfo.of(GraceInfo.Kind.GRACE));

        assertEquals(new TremoloInfo(16), store.tremolo("n1").orElseThrow());
        assertEquals(GraceInfo.Kind.GRACE, store.grace("n1").orElseThrow().kind);
        assertTrue(store.tuplet("n1").isEmpty());
        assertTrue(store.tremolo("n2").isEmpty());
        assertEquals(2, store.size());
    }

    @Test
    void secondEntryForTheSameConcernIsRejected() {
        store.insert("d1", new RepeatInfo(RepeatInfo.RepeatType.VOLTA, 2, null));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> store.insert("d1", new RepeatInfo(RepeatInfo.RepeatType.UNFOLD, 3, null)));
        assertEquals("Duplicate repeat entry for d1", e.getMessage());
        assertEquals(RepeatInfo.RepeatType.VOLTA, store.repeat("d1").orElseThrow().repeatType);
    }

    @Test
    void blankIdentityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.insert("", new EndingInfo(0)));
        assertThrows(IllegalArgumentException.class, () -> store.insert(null, new EndingInfo(0)));
        assertTrue(store.isEmpty());
    }

    @Test
    void lookupByConcernName() {
        store.insert("s1", new EventSequence(List.of(new PositionedEvent(1, 0, 0, 0, new ControlEvent.BarCheck()))));

        assertTrue(store.lookup("s1", "event-sequence").isPresent());
        assertTrue(store.lookup("s1", "tuplet").isEmpty());
        assertTrue(store.lookup("s1", "no-such-concern").isEmpty());
        assertEquals(Concern.EVENT_SEQUENCE, Concern.fromName("event-sequence").orElseThrow());
    }

    @Test
    void markersAnswerContains() {
        store.insert("c1", ChordRepetitionMarker.INSTANCE);
        store.insert("sl1", PhrasingSlurMarker.INSTANCE);

        assertTrue(store.isChordRepetition("c1"));
        assertFalse(store.isChordRepetition("sl1"));
        assertTrue(store.isPhrasingSlur("sl1"));
        assertEquals(Set.of("c1"), store.ids(Concern.CHORD_REPETITION));
        assertTrue(store.ids(Concern.TUPLET).isEmpty());
    }

    @Test
    void asMapSortsConcernsAndIdentities() {
        store.insert("n2", new TremoloInfo(8));
        store.insert("n1", new TremoloInfo(16));
        store.insert("t1", new TupletInfo(3, 2, null));

        Map<String, Map<String, ExtensionEntry>> map = store.asMap();

        assertEquals(List.of("tremolo", "tuplet"), List.copyOf(map.keySet()));
        assertEquals(List.of("n1", "n2"), List.copyOf(map.get("tremolo").keySet()));
    }

    @Test
    void valueTypesCheckTheirArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TremoloInfo(-1));
        assertThrows(IllegalArgumentException.class, () -> new EndingInfo(-1));
        assertThrows(IllegalArgumentException.class, () -> new Fraction(1, 0));
        assertThrows(IllegalArgumentException.class, () -> new PositionedEvent(1, -1, 0, 0, new ControlEvent.BarCheck()));
        assertThrows(IllegalArgumentException.class, () -> new PositionedEvent(0, 0, 0, 0, new ControlEvent.BarCheck()));
        assertThrows(IllegalArgumentException.class, () -> new PositionedEvent(1, 0, 0, -1, new ControlEvent.BarCheck()));
    }

    @Test
    void tremoloSlashCounts() {
        assertEquals(1, TremoloInfo.slashCount(8));
        assertEquals(2, TremoloInfo.slashCount(16));
        assertEquals(3, TremoloInfo.slashCount(32));
        assertEquals(0, TremoloInfo.slashCount(4));
        assertEquals(0, TremoloInfo.slashCount(0));
        assertEquals(32, TremoloInfo.subdivisionForSlashes(3));
        assertEquals(0, TremoloInfo.subdivisionForSlashes(0));
    }
}
