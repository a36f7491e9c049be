package com.serialpdf.render;

/** A placeholder token left in a rendered file, with its key and 1-based line number. */
public record UnmatchedPlaceholder(String token, String key, int line) {}
