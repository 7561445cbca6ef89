package org.dxworks.scoreframe.mei;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class StaffDef extends MeiElement implements StaffGrpChild {
    public Integer n;
    public Integer lines;
    public Label label;
    public LabelAbbr labelAbbr;
    public List<InstrDef> instrDefs = new ArrayList<>();

    public StaffDef() {
        super("staffDef");
    }

    public Optional<String> labelText() {
        return label == null || label.text == null || label.text.isEmpty()
                ? Optional.empty() : Optional.of(label.text);
    }

    public Optional<String> labelAbbrText() {
        return labelAbbr == null || labelAbbr.text == null || labelAbbr.text.isEmpty()
                ? Optional.empty() : Optional.of(labelAbbr.text);
    }
}
