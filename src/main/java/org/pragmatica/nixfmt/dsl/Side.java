package org.pragmatica.nixfmt.dsl;

/**
 * Which gap of the anchor token a spacing directive controls.
 */
public enum Side {
    BEFORE,
    AFTER
}
