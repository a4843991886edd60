package com.lucsartech.raw.session;

/**
 * Lifecycle of a {@link ConversionSession}. Transitions only move forward,
 * except that a failed decode leaves the session in {@link #LOADED}.
 */
public enum SessionState {
    EMPTY,
    LOADED,
    PROCESSED,
    CLOSED
}
