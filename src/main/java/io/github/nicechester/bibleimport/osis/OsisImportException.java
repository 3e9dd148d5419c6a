package io.github.nicechester.bibleimport.osis;

/**
 * Failure that aborts an import run. Always carries the underlying cause when there is one.
 */
public class OsisImportException extends RuntimeException {

    public OsisImportException(String message) {
        super(message);
    }

    public OsisImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
