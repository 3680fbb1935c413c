package com.texclean.conditional;

import java.util.Optional;

public record SimplificationResult(String text, Optional<ConditionalDiagnostic> diagnostic) {

    public static SimplificationResult simplified(String text) {
        return new SimplificationResult(text, Optional.empty());
    }

    public static SimplificationResult aborted(String originalText, ConditionalDiagnostic diagnostic) {
        return new SimplificationResult(originalText, Optional.of(diagnostic));
    }

    public boolean isAborted() {
        return diagnostic.isPresent();
    }
}
