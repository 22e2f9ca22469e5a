package com.cdlc.core.model;

/**
 * Where the value of a parameter binding came from.
 */
public enum BindingOrigin {
    /** Written in the instantiation's modification list. */
    EXPLICIT,
    /** Taken from the parameter declaration's default. */
    DEFAULT,
    /** Neither bound nor defaulted. */
    UNBOUND
}
