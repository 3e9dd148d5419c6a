package io.github.nicechester.bibleimport.osis;

import java.nio.file.Path;

/**
 * The OSIS document to import does not exist. Raised before the store is touched.
 */
public class OsisSourceNotFoundException extends OsisImportException {

    private final Path source;

    public OsisSourceNotFoundException(Path source) {
        super("OSIS file not found: " + source);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
