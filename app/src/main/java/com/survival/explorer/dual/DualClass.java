package com.survival.explorer.dual;

/**
 * Which side of a two-cohort comparison a node or edge belongs to.
 */
public enum DualClass {
    SHARED,
    PATH_A,
    PATH_B,
    UNCLASSIFIED
}
