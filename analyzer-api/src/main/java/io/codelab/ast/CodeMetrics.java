package io.codelab.ast;

/** Structural counts over a whole generic tree, see {@link AstTraversal#extractMetrics}. */
public record CodeMetrics(
        int functions, int classes, int variables, int conditionals, int loops, int complexity, int depth, int nodeCount) {}
