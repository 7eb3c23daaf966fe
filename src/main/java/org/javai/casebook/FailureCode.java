package org.javai.casebook;

import java.util.Objects;

/**
 * A namespaced, stable code naming a kind of fault.
 *
 * <p>Codes are descriptive only. Two faults with equal codes are still different
 * faults unless they are the same {@link Fault} instance.
 *
 * @param namespace The subsystem that owns the fault (e.g., "storage", "billing")
 * @param name The fault within that namespace (e.g., "disk_full", "card_declined")
 */
public record FailureCode(String namespace, String name) {

    /**
     * The namespace given to codes owned by classes in the unnamed package.
     */
    public static final String DEFAULT_PACKAGE_NAMESPACE = "default";

    public FailureCode {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FailureCode of(String namespace, String name) {
        return new FailureCode(namespace, name);
    }

    /**
     * Creates a code using the package of the given class as the namespace, or
     * {@link #DEFAULT_PACKAGE_NAMESPACE} for a class in the unnamed package.
     */
    public static FailureCode of(Class<?> owner, String name) {
        Objects.requireNonNull(owner, "owner must not be null");
        String packageName = owner.getPackageName();
        return new FailureCode(packageName.isEmpty() ? DEFAULT_PACKAGE_NAMESPACE : packageName, name);
    }

    /**
     * Parses the {@code namespace:name} form produced by {@link #toString()}.
     * The namespace ends at the last colon.
     *
     * @throws IllegalArgumentException if the text has no colon separator
     */
    public static FailureCode parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int separator = text.lastIndexOf(':');
        if (separator <= 0 || separator == text.length() - 1) {
            throw new IllegalArgumentException("expected namespace:name but got '" + text + "'");
        }
        return new FailureCode(text.substring(0, separator), text.substring(separator + 1));
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
