package org.dxworks.scoreframe.lilypond.importer;

import org.dxworks.scoreframe.ext.EventSequence;
import org.dxworks.scoreframe.lilypond.model.Duration;
import org.dxworks.scoreframe.lilypond.model.Pitch;
import org.dxworks.scoreframe.mei.BeamSpan;
import org.dxworks.scoreframe.mei.Hairpin;
import org.dxworks.scoreframe.mei.Slur;
import org.dxworks.scoreframe.mei.Staff;
import org.dxworks.scoreframe.mei.StaffDef;
import org.dxworks.scoreframe.mei.Tie;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Running state of the staff being imported. Durations and relative pitches carry over from one layer
 * to the next, the way they carry over in the source text.
 */
final class StaffState {

    final StaffDef staffDef;
    final Staff staff;
    final EventSequence.Builder events = new EventSequence.Builder();

    Duration lastDuration = new Duration(4, 0);
    int layer;               // number of the layer being walked
    int eventCount;          // staff-wide, across layers
    int blockCount;          // tuplet, grace, repeat and ending scopes opened so far
    List<Pitch> lastChord;   // absolute pitches of the last written chord
    Pitch relativeRef;       // null outside relative mode

    Tie openTie;
    final Deque<Slur> openSlurs = new ArrayDeque<>();
    final Deque<Slur> openPhrasingSlurs = new ArrayDeque<>();
    final Deque<BeamSpan> openBeams = new ArrayDeque<>();
    Hairpin openHairpin;

    StaffState(StaffDef staffDef, Staff staff) {
        this.staffDef = staffDef;
        this.staff = staff;
    }

    int n() {
        return staff.n;
    }

    String location() {
        return "staff " + staff.n;
    }
}
