package com.myorg.normparser.model;

/**
 * Outcome of classifying one content row, in the order the rules are tried.
 */
public enum RowKind {
    /** Nothing in caption, code or term. */
    SKIP,
    /** Level 1, one-digit code. */
    DIVISION,
    /** Level 2, three-digit code. */
    SUBDIVISION,
    /** Level 3, five-digit code without indent. */
    GROUP_CODE_ITEM,
    /** Level 3 title without code or term; groups the items below it. */
    GROUP_HEADER,
    /** Level 4, identified by an indent of two or more. */
    LEAF_ITEM,
    /** Matched no rule; dropped from the tree and reported. */
    UNCLASSIFIED
}
