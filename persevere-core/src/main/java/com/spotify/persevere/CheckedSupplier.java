package com.spotify.persevere;

/**
 * A computation that may throw a checked exception.
 *
 * @param <T> result type
 * @param <E> exception type the computation declares
 */
@FunctionalInterface
public interface CheckedSupplier<T, E extends Exception> {
  T get() throws E;
}
