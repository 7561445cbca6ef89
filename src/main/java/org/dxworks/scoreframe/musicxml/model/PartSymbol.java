package org.dxworks.scoreframe.musicxml.model;

import java.util.Objects;

public class PartSymbol {
    public String value; // brace, bracket, square, line, none
    public Integer topStaff;
    public Integer bottomStaff;

    public PartSymbol(String value, Integer topStaff, Integer bottomStaff) {
        this.value = value;
        this.topStaff = topStaff;
        this.bottomStaff = bottomStaff;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartSymbol)) return false;
        PartSymbol other = (PartSymbol) o;
        return Objects.equals(value, other.value) && Objects.equals(topStaff, other.topStaff)
                && Objects.equals(bottomStaff, other.bottomStaff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, topStaff, bottomStaff);
    }
}
