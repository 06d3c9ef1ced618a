package com.williamcallahan.mathcore.service.mathml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered, immutable attribute maps for {@code <mo>} elements.
 */
final class OperatorAttributes {

    private OperatorAttributes() {
    }

    static Map<String, String> copyOf(Map<String, String> attributes) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    static Map<String, String> with(Map<String, String> attributes, String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(name, value);
        return Collections.unmodifiableMap(copy);
    }
}
