package com.texclean.text;

public record SubstitutionRule(String pattern, String insertion, String description, boolean stripWhitespace) {
}
