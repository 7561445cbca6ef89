package org.dxworks.scoreframe.ext;

/**
 * Marker for the typed values held by {@link ExtensionStore}.
 * Every entry belongs to exactly one concern.
 */
public interface ExtensionEntry {
    Concern concern();
}
