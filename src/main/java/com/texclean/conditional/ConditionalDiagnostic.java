package com.texclean.conditional;

import java.util.List;
import java.util.stream.Collectors;

public record ConditionalDiagnostic(Failure failure, TokenLocation offending, List<TokenLocation> ancestors) {

    public enum Failure {
        UNMATCHED_ELSE("\\else without an open conditional"),
        DUPLICATE_ELSE("second \\else in the same conditional"),
        UNMATCHED_FI("\\fi without an open conditional"),
        UNCLOSED_IF("conditional never closed by \\fi");

        private final String description;

        Failure(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public record TokenLocation(String token, int offset, int line) {
        @Override
        public String toString() {
            return token + " (line " + line + ")";
        }
    }

    public ConditionalDiagnostic {
        ancestors = List.copyOf(ancestors);
    }

    public String message() {
        String where = ancestors.isEmpty()
                ? "at top level"
                : "inside " + ancestors.stream().map(TokenLocation::toString).collect(Collectors.joining(" > "));
        return failure.description() + ": " + offending + " " + where;
    }
}
