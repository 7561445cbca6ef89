package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class StaffGrp extends MeiElement implements StaffGrpChild {
    public String symbol; // brace, bracket, bracketsq, line, none
    public Boolean barThru;
    public List<StaffGrpChild> children = new ArrayList<>();

    public StaffGrp() {
        super("staffGrp");
    }

    public Optional<String> labelText() {
        for (StaffGrpChild child : children) {
            if (child instanceof Label label && label.text != null && !label.text.isEmpty()) {
                return Optional.of(label.text);
            }
        }
        return Optional.empty();
    }

    public Optional<String> labelAbbrText() {
        for (StaffGrpChild child : children) {
            if (child instanceof LabelAbbr abbr && abbr.text != null && !abbr.text.isEmpty()) {
                return Optional.of(abbr.text);
            }
        }
        return Optional.empty();
    }

    public List<StaffDef> staffDefs() {
        List<StaffDef> result = new ArrayList<>();
        for (StaffGrpChild child : children) {
            if (child instanceof StaffDef staffDef) {
                result.add(staffDef);
            }
        }
        return result;
    }

    public boolean hasNestedGroups() {
        return children.stream().anyMatch(StaffGrp.class::isInstance);
    }
}
