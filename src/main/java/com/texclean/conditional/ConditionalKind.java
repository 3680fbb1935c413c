package com.texclean.conditional;

public enum ConditionalKind {
    RESOLVED_TRUE,
    RESOLVED_FALSE,
    UNKNOWN
}
