package org.dxworks.scoreframe.musicxml.model;

public interface PartListItem {
}
