package io.github.cyfko.approvalql.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validation and copying of attribute blocks shared by {@link NounNode} and {@link AnonymousNode}.
 */
final class Attributes {

    private Attributes() {}

    static Map<String, String> copyOf(Map<String, String> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        Map<String, String> copy = new LinkedHashMap<>(attributes.size());
        attributes.forEach((key, value) -> {
            requireName(key, "attribute key");
            requireName(value, "attribute value");
            copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }

    static String requireName(String name, String what) {
        Objects.requireNonNull(name, what);
        if (name.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        return name;
    }
}
