package org.dxworks.scoreframe.lilypond.model;

import org.dxworks.scoreframe.ext.GraceInfo;

/**
 * \grace, \acciaccatura or \appoggiatura. After-graces have their own node.
 */
public class GraceMusic extends Music {
    public GraceInfo.Kind kind;
    public Music body;

    public GraceMusic(GraceInfo.Kind kind, Music body) {
        this.kind = kind;
        this.body = body;
    }
}
