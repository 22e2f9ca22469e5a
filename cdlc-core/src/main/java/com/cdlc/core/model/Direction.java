package com.cdlc.core.model;

/**
 * Direction of a connector as declared on its block.
 */
public enum Direction {
    INPUT,
    OUTPUT
}
