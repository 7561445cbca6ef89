package org.dxworks.scoreframe.convert;

import java.util.List;

/**
 * A successful conversion plus the warnings collected on the way. The caller decides whether warnings are fatal.
 */
public final class ConversionResult<T> {
    public final T value;
    public final List<ConversionWarning> warnings;

    public ConversionResult(T value, List<ConversionWarning> warnings) {
        this.value = value;
        this.warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
