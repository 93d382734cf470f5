package com.respkv.core;

/**
 * Precondition for a write, evaluated against the live (non-expired) entry.
 */
public enum SetCondition {
    /** Write unconditionally. */
    ALWAYS,
    /** Write only if no live entry exists (NX). */
    IF_ABSENT,
    /** Write only if a live entry exists (XX). */
    IF_PRESENT;

    /**
     * @param present whether a live entry currently exists
     * @return true if the write may proceed
     */
    public boolean permits(boolean present) {
        switch (this) {
            case IF_ABSENT:
                return !present;
            case IF_PRESENT:
                return present;
            default:
                return true;
        }
    }
}
