package org.dxworks.scoreframe.mei;

import java.util.List;

public final class ValidationResult {
    public final List<String> diagnostics;

    public ValidationResult(List<String> diagnostics) {
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }
}
