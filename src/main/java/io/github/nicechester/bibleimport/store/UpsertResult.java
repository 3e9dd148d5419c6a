package io.github.nicechester.bibleimport.store;

/**
 * Outcome of a get-or-create call: the stored entity and whether this call inserted it.
 */
public record UpsertResult<T>(T value, boolean created) {

    public static <T> UpsertResult<T> created(T value) {
        return new UpsertResult<>(value, true);
    }

    public static <T> UpsertResult<T> existing(T value) {
        return new UpsertResult<>(value, false);
    }
}
