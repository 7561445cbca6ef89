package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tree-shaped checks over an MEI document: identities present and unique, control events pointing at
 * existing layer content, staves matching a staff definition, groups not empty.
 */
public final class MeiValidator {

    private static final Set<Integer> DURATIONS = Set.of(1, 2, 4, 8, 16, 32, 64, 128);

    public ValidationResult validate(MeiDocument document) {
        List<String> diagnostics = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        Set<Integer> staffNumbers = new HashSet<>();

        checkId(document, ids, diagnostics);
        if (document.scoreDef == null || document.scoreDef.staffGrp == null) {
            diagnostics.add("scoreDef has no staffGrp");
        } else {
            checkId(document.scoreDef, ids, diagnostics);
            validateGroup(document.scoreDef.staffGrp, ids, staffNumbers, diagnostics);
        }

        Set<String> eventIds = new HashSet<>();
        if (document.section != null) {
            checkId(document.section, ids, diagnostics);
            for (Staff staff : document.section.staves) {
                checkId(staff, ids, diagnostics);
                if (!staffNumbers.contains(staff.n)) {
                    diagnostics.add("staff " + staff.n + " has no staffDef");
                }
                for (Layer layer : staff.layers) {
                    checkId(layer, ids, diagnostics);
                    for (MeiElement element : LayerElements.descendants(layer.children)) {
                        checkId(element, ids, diagnostics);
                        validateLayerElement(element, diagnostics);
                        if (element.xmlId != null) {
                            eventIds.add(element.xmlId);
                        }
                    }
                }
            }
            for (ControlElement control : document.section.controlEvents) {
                checkId(control, ids, diagnostics);
                if (control.startid == null) {
                    diagnostics.add(control.element + " " + control.xmlId + " has no startid");
                } else if (!eventIds.contains(control.startid)) {
                    diagnostics.add(control.element + " " + control.xmlId + " references missing startid " + control.startid);
                }
                if (control.endid != null && !eventIds.contains(control.endid)) {
                    diagnostics.add(control.element + " " + control.xmlId + " references missing endid " + control.endid);
                }
            }
        }
        return new ValidationResult(diagnostics);
    }

    private void validateGroup(StaffGrp group, Set<String> ids, Set<Integer> staffNumbers, List<String> diagnostics) {
        checkId(group, ids, diagnostics);
        boolean hasStaves = false;
        for (StaffGrpChild child : group.children) {
            if (child instanceof StaffGrp nested) {
                hasStaves = true;
                validateGroup(nested, ids, staffNumbers, diagnostics);
            } else if (child instanceof StaffDef staffDef) {
                hasStaves = true;
                checkId(staffDef, ids, diagnostics);
                if (staffDef.n == null) {
                    diagnostics.add("staffDef " + staffDef.xmlId + " has no n");
                } else if (!staffNumbers.add(staffDef.n)) {
                    diagnostics.add("duplicate staffDef n " + staffDef.n);
                }
                for (InstrDef instrDef : staffDef.instrDefs) {
                    checkId(instrDef, ids, diagnostics);
                }
            }
        }
        if (!hasStaves) {
            diagnostics.add("staffGrp " + group.xmlId + " contains no staffDef");
        }
    }

    private void validateLayerElement(MeiElement element, List<String> diagnostics) {
        if (element instanceof Note note) {
            if (note.pname < 'a' || note.pname > 'g') {
                diagnostics.add("note " + note.xmlId + " has invalid pname " + note.pname);
            }
            if (note.dur != null && !DURATIONS.contains(note.dur)) {
                diagnostics.add("note " + note.xmlId + " has invalid dur " + note.dur);
            }
        } else if (element instanceof Chord chord) {
            if (chord.notes.isEmpty()) {
                diagnostics.add("chord " + chord.xmlId + " has no notes");
            }
            if (!DURATIONS.contains(chord.dur)) {
                diagnostics.add("chord " + chord.xmlId + " has invalid dur " + chord.dur);
            }
        } else if (element instanceof BTrem bTrem && bTrem.child == null) {
            diagnostics.add("bTrem " + bTrem.xmlId + " is empty");
        } else if (element instanceof GraceGrp graceGrp && graceGrp.children.isEmpty()) {
            diagnostics.add("graceGrp " + graceGrp.xmlId + " is empty");
        }
    }

    private void checkId(MeiElement element, Set<String> ids, List<String> diagnostics) {
        if (element.xmlId == null || element.xmlId.isEmpty()) {
            diagnostics.add(element.element + " without xml:id");
        } else if (!ids.add(element.xmlId)) {
            diagnostics.add("duplicate xml:id " + element.xmlId);
        }
    }
}
