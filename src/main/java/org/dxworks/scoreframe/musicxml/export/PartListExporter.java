package org.dxworks.scoreframe.musicxml.export;

import org.dxworks.scoreframe.convert.ConversionContext;
import org.dxworks.scoreframe.convert.ConversionException;
import org.dxworks.scoreframe.ext.ExtensionStore;
import org.dxworks.scoreframe.ext.InstrumentInfo;
import org.dxworks.scoreframe.ext.PartSymbolInfo;
import org.dxworks.scoreframe.mei.GrpSym;
import org.dxworks.scoreframe.mei.InstrDef;
import org.dxworks.scoreframe.mei.Label;
import org.dxworks.scoreframe.mei.LabelAbbr;
import org.dxworks.scoreframe.mei.ScoreDef;
import org.dxworks.scoreframe.mei.StaffDef;
import org.dxworks.scoreframe.mei.StaffGrp;
import org.dxworks.scoreframe.mei.StaffGrpChild;
import org.dxworks.scoreframe.musicxml.model.Part;
import org.dxworks.scoreframe.musicxml.model.PartGroup;
import org.dxworks.scoreframe.musicxml.model.PartList;
import org.dxworks.scoreframe.musicxml.model.PartSymbol;
import org.dxworks.scoreframe.musicxml.model.ScoreInstrument;
import org.dxworks.scoreframe.musicxml.model.ScorePart;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the MusicXML part-list from the staff-group tree of an MEI score definition.
 * <p>
 * Groups become part-group start/stop pairs only when they carry a symbol, a shared-barline flag or a
 * name. A nested group that looks like one instrument on several staves (piano, harp) collapses to a
 * single score-part whose staves are registered in the conversion context.
 */
public class PartListExporter {

    public PartList exportParts(ScoreDef scoreDef, ExtensionStore store, ConversionContext ctx)
            throws ConversionException {
        PartList partList = new PartList();
        if (scoreDef != null && scoreDef.staffGrp != null) {
            exportGroup(scoreDef.staffGrp, partList, store, ctx, 1);
        }
        return partList;
    }

    /**
     * One empty part per score-part, carrying the staff count and part symbol collected during {@link #exportParts}.
     */
    public List<Part> createEmptyParts(PartList partList, ConversionContext ctx) {
        List<Part> parts = new ArrayList<>();
        for (ScorePart scorePart : partList.scoreParts()) {
            Part part = new Part(scorePart.id);
            part.staves = ctx.stavesForPart(scorePart.id);
            part.partSymbol = ctx.partSymbol(scorePart.id).orElse(null);
            parts.add(part);
        }
        return parts;
    }

    /**
     * Returns the next free group number.
     */
    private int exportGroup(StaffGrp group, PartList partList, ExtensionStore store, ConversionContext ctx,
                            int groupNumber) throws ConversionException {
        int nextNumber = groupNumber;
        boolean needsGroup = group.symbol != null
                || group.barThru != null
                || group.labelText().isPresent()
                || group.labelAbbrText().isPresent();

        if (needsGroup) {
            PartGroup start = PartGroup.start(groupNumber);
            start.groupName = group.labelText().orElse(null);
            start.groupAbbreviation = group.labelAbbrText().orElse(null);
            start.groupSymbol = groupSymbol(group.symbol);
            start.groupBarline = group.barThru == null ? null : (group.barThru ? "yes" : "no");
            partList.items.add(start);
            nextNumber++;
        }

        for (StaffGrpChild child : group.children) {
            if (child instanceof StaffDef staffDef) {
                partList.items.add(exportStaffDef(staffDef, store, ctx));
            } else if (child instanceof StaffGrp nested) {
                if (isMultiStaffPart(nested)) {
                    partList.items.add(exportMultiStaffGroup(nested, store, ctx));
                } else {
                    nextNumber = exportGroup(nested, partList, store, ctx, nextNumber);
                }
            } else if (child instanceof Label || child instanceof LabelAbbr) {
                // written on the part-group start
                continue;
            } else if (child instanceof GrpSym) {
                ctx.addWarning("staffGrp " + group.xmlId, "grpSym has no MusicXML equivalent");
            } else {
                ctx.addWarning("staffGrp " + group.xmlId,
                        child.getClass().getSimpleName() + " has no MusicXML equivalent");
            }
        }

        if (needsGroup) {
            partList.items.add(PartGroup.stop(groupNumber));
        }
        return nextNumber;
    }

    /**
     * Shared barline, at least two staves, no nesting and no staff naming itself: the names belong to
     * the group, so the staves are one instrument. Anything short of that stays separate parts.
     */
    static boolean isMultiStaffPart(StaffGrp group) {
        List<StaffDef> staffDefs = group.staffDefs();
        boolean staffDefsHaveLabels = staffDefs.stream().anyMatch(sd -> sd.labelText().isPresent());
        return Boolean.TRUE.equals(group.barThru)
                && staffDefs.size() >= 2
                && !group.hasNestedGroups()
                && !staffDefsHaveLabels;
    }

    private ScorePart exportMultiStaffGroup(StaffGrp group, ExtensionStore store, ConversionContext ctx)
            throws ConversionException {
        List<StaffDef> staffDefs = group.staffDefs();
        if (staffDefs.isEmpty()) {
            throw new ConversionException("Multi-staff group " + group.xmlId + " has no staffDef");
        }
        StaffDef first = staffDefs.get(0);
        String partId = partId(first, ctx);

        String partName = group.labelText().or(first::labelText).orElse("");
        ScorePart scorePart = new ScorePart(partId, partName);
        scorePart.partAbbreviation = group.labelAbbrText().or(first::labelAbbrText).orElse(null);

        partSymbol(group, store).ifPresent(symbol -> ctx.setPartSymbol(partId, symbol));
        addInstruments(first, partId, store, scorePart);

        for (int i = 0; i < staffDefs.size(); i++) {
            StaffDef staffDef = staffDefs.get(i);
            int localStaff = i + 1;
            int globalStaff = staffDef.n != null ? staffDef.n : localStaff;
            ctx.registerPartStaff(partId, localStaff, globalStaff);
            if (staffDef.xmlId != null) {
                ctx.mapId(staffDef.xmlId, partId);
            }
        }
        if (group.xmlId != null) {
            ctx.mapId(group.xmlId, partId);
        }
        return scorePart;
    }

    private ScorePart exportStaffDef(StaffDef staffDef, ExtensionStore store, ConversionContext ctx) {
        String partId = partId(staffDef, ctx);
        ScorePart scorePart = new ScorePart(partId, staffDef.labelText().orElse(""));
        scorePart.partAbbreviation = staffDef.labelAbbrText().orElse(null);
        addInstruments(staffDef, partId, store, scorePart);

        if (staffDef.xmlId != null) {
            ctx.mapId(staffDef.xmlId, partId);
        }
        ctx.registerPartStaff(partId, 1, staffDef.n != null ? staffDef.n : 1);
        return scorePart;
    }

    private String partId(StaffDef staffDef, ConversionContext ctx) {
        if (staffDef.xmlId != null) {
            return staffDef.xmlId;
        }
        if (staffDef.n != null) {
            return "P" + staffDef.n;
        }
        return ctx.generateId("part");
    }

    private Optional<PartSymbol> partSymbol(StaffGrp group, ExtensionStore store) {
        if (group.xmlId != null) {
            Optional<PartSymbolInfo> stored = store.partSymbol(group.xmlId);
            if (stored.isPresent()) {
                PartSymbolInfo info = stored.get();
                return Optional.of(new PartSymbol(info.value, info.topStaff, info.bottomStaff));
            }
        }
        String value = groupSymbol(group.symbol);
        // brace is what a reader assumes for a multi-staff part anyway
        if (value == null || "brace".equals(value)) {
            return Optional.empty();
        }
        return Optional.of(new PartSymbol(value, null, null));
    }

    private void addInstruments(StaffDef staffDef, String partId, ExtensionStore store, ScorePart scorePart) {
        int index = 1;
        for (InstrDef instrDef : staffDef.instrDefs) {
            ScoreInstrument instrument = new ScoreInstrument();
            instrument.id = instrDef.xmlId != null ? instrDef.xmlId : partId + "-I" + index;
            Optional<InstrumentInfo> info = instrDef.xmlId == null
                    ? Optional.empty() : store.instrument(instrDef.xmlId);
            if (info.isPresent()) {
                instrument.instrumentName = info.get().name;
                instrument.instrumentAbbreviation = info.get().abbreviation;
                instrument.instrumentSound = info.get().sound;
                instrument.midiChannel = info.get().midiChannel;
                instrument.midiProgram = info.get().midiProgram;
            } else if (instrDef.midiInstrname != null) {
                instrument.instrumentName = instrDef.midiInstrname;
                instrument.midiProgram = instrDef.midiInstrnum;
            } else {
                index++;
                continue;
            }
            scorePart.scoreInstruments.add(instrument);
            index++;
        }
    }

    private static String groupSymbol(String meiSymbol) {
        if (meiSymbol == null) {
            return null;
        }
        return switch (meiSymbol) {
            case "brace" -> "brace";
            case "bracket" -> "bracket";
            case "bracketsq" -> "square";
            case "line" -> "line";
            case "none" -> "none";
            default -> "brace";
        };
    }
}
