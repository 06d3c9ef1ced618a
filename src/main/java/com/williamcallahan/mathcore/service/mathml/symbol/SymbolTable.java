package com.williamcallahan.mathcore.service.mathml.symbol;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Codepoint-keyed operator dictionary.
 *
 * <p>Built once at class initialization and never modified afterwards, so lookups are safe from
 * any thread. Unmapped codepoints resolve to {@link SymbolCategory#ORD_PLAIN}.</p>
 */
public final class SymbolTable {

    private static final Map<Integer, SymbolDescriptor> ENTRIES;

    static {
        Map<Integer, SymbolDescriptor> entries = new TreeMap<>();

        register(entries, SymbolCategory.REL_DEFAULT,
            '=', '<', '>', 0x2260, 0x2264, 0x2265, 0x2261, 0x2262, 0x2248, 0x223C, 0x2241, 0x2243,
            0x2245, 0x221D, 0x2208, 0x2209, 0x220B, 0x220C, 0x2282, 0x2283, 0x2284, 0x2286, 0x2287,
            0x2288, 0x2289, 0x227A, 0x227B, 0x2AAF, 0x2AB0, 0x226A, 0x226B, 0x226E, 0x226F, 0x2270,
            0x2271, 0x2223, 0x2225, 0x22A5, 0x22A2, 0x22A3, 0x22A8, 0x2250, 0x2254, 0x22B2, 0x22B3,
            0x2234, 0x2235, 0x224D, 0x2323, 0x2322, 0x22C8);

        register(entries, SymbolCategory.REL_A,
            0x2192, 0x2190, 0x2194, 0x21D2, 0x21D0, 0x21D4, 0x21A6, 0x27F6, 0x27F5, 0x27F7, 0x27F9,
            0x27F8, 0x27FA, 0x27FC, 0x2191, 0x2193, 0x2195, 0x21D1, 0x21D3, 0x21D5, 0x2197, 0x2198,
            0x2199, 0x2196, 0x21AA, 0x21A9, 0x21C0, 0x21BC, 0x21C1, 0x21BD, 0x21CC);

        register(entries, SymbolCategory.BIN_BD, '+', 0x2212, 0x00B1, 0x2213, 0x00F7);

        register(entries, SymbolCategory.BIN_B,
            0x222A, 0x2229, 0x2227, 0x2228, 0x2295, 0x2297, 0x2296, 0x2298, 0x2299, 0x2216, 0x22C6,
            0x2218, 0x2219, 0x22C4, 0x228E, 0x2293, 0x2294, 0x2240, 0x2020, 0x2021, 0x2A3F, 0x2217,
            0x25B3, 0x25BD);

        register(entries, SymbolCategory.OP_C, 0x00D7, 0x00B7, 0x22C5, 0x22C9, 0x22CA);

        register(entries, SymbolCategory.OP_H, 0x222B, 0x222C, 0x222D, 0x222E, 0x2A0C);

        register(entries, SymbolCategory.OP_J,
            0x2211, 0x220F, 0x2210, 0x22C3, 0x22C2, 0x22C1, 0x22C0, 0x2A01, 0x2A02, 0x2A00, 0x2A04,
            0x2A06);

        register(entries, SymbolCategory.ORD_D, 0x00AC, 0x2200, 0x2203, 0x2204);

        register(entries, SymbolCategory.ORD_E, '!', 0x2032, 0x2033, 0x2034, 0x2057);

        register(entries, SymbolCategory.ORD_F, '(', '[', '{', 0x27E8, 0x230A, 0x2308, 0x27E6);
        register(entries, SymbolCategory.ORD_G, ')', ']', '}', 0x27E9, 0x230B, 0x2309, 0x27E7);
        register(entries, SymbolCategory.ORD_FG, 0x2016);
        register(entries, SymbolCategory.ORD_FG_FORCE_DEFAULT, '|');

        register(entries, SymbolCategory.ORD_I,
            0x203E, 0x23DE, 0x23DF, 0x23B4, 0x23B5, '^', 0x02C6, 0x02DC, 0x00AF, 0x02D9, 0x00A8,
            0x02C7, 0x02D8, 0x02DA, 0x00B4, 0x0060);

        register(entries, SymbolCategory.ORD_K, '\\');
        register(entries, SymbolCategory.ORD_K_LEGACY_B, '/');
        register(entries, SymbolCategory.ORD_PUNCTUATION, ',', ';', ':');

        ENTRIES = Collections.unmodifiableMap(entries);
    }

    private SymbolTable() {
    }

    private static void register(Map<Integer, SymbolDescriptor> entries, SymbolCategory category, int... codepoints) {
        for (int codepoint : codepoints) {
            SymbolDescriptor previous = entries.put(codepoint, new SymbolDescriptor(codepoint, category));
            if (previous != null) {
                throw new IllegalStateException(
                    "Codepoint U+" + Integer.toHexString(codepoint).toUpperCase() + " registered twice");
            }
        }
    }

    /**
     * Classifies a codepoint.
     *
     * @param codepoint Unicode codepoint
     * @return the registered descriptor, or an {@link SymbolCategory#ORD_PLAIN} descriptor
     */
    public static SymbolDescriptor lookup(int codepoint) {
        SymbolDescriptor descriptor = ENTRIES.get(codepoint);
        return descriptor != null ? descriptor : new SymbolDescriptor(codepoint, SymbolCategory.ORD_PLAIN);
    }

    /**
     * Returns the descriptor only when the codepoint is in the dictionary.
     *
     * @param codepoint Unicode codepoint
     * @return registered descriptor
     */
    public static Optional<SymbolDescriptor> find(int codepoint) {
        return Optional.ofNullable(ENTRIES.get(codepoint));
    }

    /**
     * Returns every registered entry ordered by codepoint.
     *
     * @return unmodifiable view of the dictionary
     */
    public static Map<Integer, SymbolDescriptor> entries() {
        return ENTRIES;
    }
}
