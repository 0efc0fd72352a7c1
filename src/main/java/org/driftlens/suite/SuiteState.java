package org.driftlens.suite;

/**
 * Run protocol states. {@code FAILED} is left only through {@code reset}.
 */
public enum SuiteState {
    UNINITIALIZED,
    RESET,
    VERIFIED,
    RUNNING,
    COMPLETE,
    FAILED
}
