package org.javai.deployguard.boundary;

/**
 * A deferred unit of work that may throw a checked exception.
 * This is the shape of every remote call the engine wraps: no inputs beyond
 * captured context, a value on success, an exception on failure.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
