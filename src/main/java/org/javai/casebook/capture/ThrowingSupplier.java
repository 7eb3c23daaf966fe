package org.javai.casebook.capture;

/**
 * A supplier that may throw a checked exception.
 * Used to wrap delegated operations in {@link Check#call} and guarded work in
 * {@link org.javai.casebook.guard.FailureGuard#call}.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
