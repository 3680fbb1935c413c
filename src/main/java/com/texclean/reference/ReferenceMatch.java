package com.texclean.reference;

public record ReferenceMatch(String filename, int start, int end, String matchedText) {
}
