package com.williamcallahan.mathcore.service.mathml;

/**
 * Lifetime of equation numbering.
 */
public enum CounterScope {
    /** Numbering restarts at 1 for every conversion call. */
    LOCAL,
    /** Numbering continues across calls until reset. */
    GLOBAL
}
