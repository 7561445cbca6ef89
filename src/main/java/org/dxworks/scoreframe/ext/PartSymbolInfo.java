package org.dxworks.scoreframe.ext;

import java.util.Objects;

/**
 * Full MusicXML part-symbol for a multi-staff group. The common tree only keeps the bare symbol.
 */
public final class PartSymbolInfo implements ExtensionEntry {
    public final String value;
    public final Integer topStaff;
    public final Integer bottomStaff;

    public PartSymbolInfo(String value, Integer topStaff, Integer bottomStaff) {
        this.value = Objects.requireNonNull(value, "value");
        this.topStaff = topStaff;
        this.bottomStaff = bottomStaff;
    }

    @Override
    public Concern concern() {
        return Concern.PART_SYMBOL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartSymbolInfo)) return false;
        PartSymbolInfo other = (PartSymbolInfo) o;
        return value.equals(other.value) && Objects.equals(topStaff, other.topStaff)
                && Objects.equals(bottomStaff, other.bottomStaff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, topStaff, bottomStaff);
    }
}
