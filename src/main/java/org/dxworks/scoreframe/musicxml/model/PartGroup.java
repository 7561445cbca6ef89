package org.dxworks.scoreframe.musicxml.model;

public class PartGroup implements PartListItem {
    public final String element = "part-group";
    public String type; // start, stop
    public String number;
    public String groupName;
    public String groupAbbreviation;
    public String groupSymbol; // brace, bracket, square, line, none
    public String groupBarline; // yes, no

    public static PartGroup start(int number) {
        PartGroup group = new PartGroup();
        group.type = "start";
        group.number = String.valueOf(number);
        return group;
    }

    public static PartGroup stop(int number) {
        PartGroup group = new PartGroup();
        group.type = "stop";
        group.number = String.valueOf(number);
        return group;
    }
}
