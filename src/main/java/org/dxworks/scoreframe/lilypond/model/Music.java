package org.dxworks.scoreframe.lilypond.model;

/**
 * Any LilyPond music expression. Each node owns its children; nodes are never shared.
 */
public abstract class Music {
}
