package org.dxworks.scoreframe.ext;

public enum Direction {
    UP,
    DOWN,
    NEUTRAL
}
