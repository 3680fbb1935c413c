package com.texclean.conditional;

public class MalformedConditionalException extends RuntimeException {
    private final ConditionalDiagnostic diagnostic;

    public MalformedConditionalException(ConditionalDiagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public ConditionalDiagnostic diagnostic() {
        return diagnostic;
    }
}
