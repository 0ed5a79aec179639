package com.largomodo.romcatalog.naming;

/**
 * Dump fidelity encoded by the trailing bracket tag of a release name.
 * <p>
 * {@code [!]} and the absence of any bracket both mean {@link #VERIFIED}.
 */
public enum DumpStatus {
    VERIFIED,
    BAD_DUMP,
    OVERDUMP
}
