package org.dxworks.scoreframe.convert;

import java.util.Objects;

/**
 * A construct with no equivalent in the target format. The conversion went on without it.
 */
public final class ConversionWarning {
    public final String location;
    public final String message;

    public ConversionWarning(String location, String message) {
        this.location = Objects.requireNonNull(location, "location");
        this.message = Objects.requireNonNull(message, "message");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionWarning)) return false;
        ConversionWarning other = (ConversionWarning) o;
        return location.equals(other.location) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, message);
    }

    @Override
    public String toString() {
        return location + ": " + message;
    }
}
