package org.dxworks.scoreframe.ext;

/**
 * Tremolo subdivision as written after the colon; 0 means unmeasured.
 */
public final class TremoloInfo implements ExtensionEntry {
    public final int subdivision;

    public TremoloInfo(int subdivision) {
        if (subdivision < 0) {
            throw new IllegalArgumentException("Negative tremolo subdivision: " + subdivision);
        }
        this.subdivision = subdivision;
    }

    /**
     * Number of beams drawn through the stem: 8 -> 1, 16 -> 2, 32 -> 3. Unmeasured yields 0.
     */
    public int slashCount() {
        return slashCount(subdivision);
    }

    public static int slashCount(int subdivision) {
        if (subdivision <= 0) {
            return 0;
        }
        return Math.max(0, Integer.numberOfTrailingZeros(subdivision) - 2);
    }

    public static int subdivisionForSlashes(int slashes) {
        return slashes <= 0 ? 0 : 1 << (slashes + 2);
    }

    @Override
    public Concern concern() {
        return Concern.TREMOLO;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TremoloInfo && subdivision == ((TremoloInfo) o).subdivision);
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(subdivision);
    }
}
