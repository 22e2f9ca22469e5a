package com.cdlc.core.model;

/**
 * Whether a block is supplied by the catalog or built from other blocks.
 */
public enum BlockKind {
    /** Opaque leaf block supplied by the elementary block catalog. */
    ELEMENTARY,
    /** Block composed of instances and connections, loaded from CDL source. */
    COMPOSITE
}
