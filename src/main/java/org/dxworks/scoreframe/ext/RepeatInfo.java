package org.dxworks.scoreframe.ext;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public final class RepeatInfo implements ExtensionEntry {

    public enum RepeatType {
        VOLTA,
        UNFOLD,
        PERCENT;

        public String keyword() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<RepeatType> fromKeyword(String keyword) {
            for (RepeatType type : values()) {
                if (type.keyword().equals(keyword)) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }
    }

    public final RepeatType repeatType;
    public final int count;
    public final Integer alternativeCount; // null when no \alternative followed

    public RepeatInfo(RepeatType repeatType, int count, Integer alternativeCount) {
        this.repeatType = Objects.requireNonNull(repeatType, "repeatType");
        this.count = count;
        this.alternativeCount = alternativeCount;
    }

    @Override
    public Concern concern() {
        return Concern.REPEAT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RepeatInfo)) return false;
        RepeatInfo other = (RepeatInfo) o;
        return repeatType == other.repeatType && count == other.count
                && Objects.equals(alternativeCount, other.alternativeCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repeatType, count, alternativeCount);
    }
}
