package org.pragmatica.nixfmt.tree;

/**
 * Grammar productions of the Nix subset.
 */
public enum NodeKind implements SyntaxKind {
    ROOT,
    /** Set literal, {@code { a = 1; }} or {@code rec { ... }}. */
    SET,
    /** Binding {@code key = value;} inside a set or a let. */
    SET_ENTRY,
    /** Attribute path on the left side of a binding or after {@code ?}. */
    KEY,
    INHERIT,
    /** List literal, {@code [ 1 2 ]}. */
    LIST,
    /** Function literal, {@code x: body} or {@code { a, b }: body}. */
    LAMBDA,
    PATTERN,
    PAT_ENTRY,
    APPLY,
    /** Binary operation. */
    OPERATION,
    UNARY_OP,
    /** Index expression, {@code foo.bar.baz}. */
    INDEX_SET,
    LET_IN,
    WITH,
    ASSERT,
    IF_ELSE,
    PAREN,
    /** Number, path or URI literal. */
    VALUE,
    STRING,
    IDENT
}
