package org.dxworks.scoreframe.ext;

public final class EndingInfo implements ExtensionEntry {
    public final int index;

    public EndingInfo(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Ending index must be zero or positive: " + index);
        }
        this.index = index;
    }

    @Override
    public Concern concern() {
        return Concern.ENDING;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EndingInfo && index == ((EndingInfo) o).index);
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }
}
