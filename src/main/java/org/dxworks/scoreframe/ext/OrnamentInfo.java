package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * Ornament name for cases where the native annotation cannot tell variants apart
 * (e.g. long and very long fermatas share a shape).
 */
public final class OrnamentInfo implements ExtensionEntry {
    public final String name;

    public OrnamentInfo(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Concern concern() {
        return Concern.ORNAMENT;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof OrnamentInfo && name.equals(((OrnamentInfo) o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
