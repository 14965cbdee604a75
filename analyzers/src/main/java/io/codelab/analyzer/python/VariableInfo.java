package io.codelab.analyzer.python;

/** A module-level variable bound by a plain assignment at column 0. */
public record VariableInfo(String name, int line) {}
