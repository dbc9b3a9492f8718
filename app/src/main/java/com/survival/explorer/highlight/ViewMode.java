package com.survival.explorer.highlight;

public enum ViewMode {
    /** Nothing highlighted */
    IDLE,
    /** One passenger's path */
    SINGLE,
    /** Two cohorts compared */
    DUAL
}
