package org.dxworks.scoreframe.lilypond.model;

/**
 * \markup or \markuplist, with its content already in canonical serialized form.
 */
public class MarkupMusic extends Music {
    public boolean list;
    public String serialized;

    public MarkupMusic(boolean list, String serialized) {
        this.list = list;
        this.serialized = serialized;
    }
}
