package io.github.nicechester.bibleimport.service;

import io.github.nicechester.bibleimport.model.ImportSummary;
import io.github.nicechester.bibleimport.osis.OsisImportException;
import io.github.nicechester.bibleimport.osis.OsisImporter;
import io.github.nicechester.bibleimport.osis.OsisSourceNotFoundException;
import io.github.nicechester.bibleimport.osis.WoodstoxOsisEventReader;
import io.github.nicechester.bibleimport.store.ScriptureStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a full-replace import of an OSIS document into the scripture store.
 *
 * <p>The run is all-or-nothing: the wipe and every record of the new import share one
 * transaction, so a failure leaves the store exactly as it was.
 */
@Slf4j
@Service
public class OsisImportService {

    private final ScriptureStore store;
    private final Path osisPath;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ImportSummary lastSummary;

    public OsisImportService(ScriptureStore store, @Value("${bible.import.osis-path}") String osisPath) {
        this.store = store;
        this.osisPath = Path.of(osisPath);
    }

    public Path getOsisPath() {
        return osisPath;
    }

    public Optional<ImportSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Imports the configured document.
     */
    public ImportSummary runImport() {
        return runImport(osisPath);
    }

    /**
     * Replaces the store content with the content of {@code source}.
     *
     * @throws OsisSourceNotFoundException if {@code source} is not a readable file; the store is untouched
     * @throws IllegalStateException if another import is in progress
     * @throws OsisImportException if the import fails; the store is rolled back
     */
    public ImportSummary runImport(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new OsisSourceNotFoundException(source);
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("An import is already running");
        }

        try {
            log.info("Starting import of {}", source);
            long startTime = System.currentTimeMillis();

            ImportSummary summary = store.inTransaction(() -> {
                log.info("Cleaning up old data...");
                store.wipe();
                try (WoodstoxOsisEventReader reader = WoodstoxOsisEventReader.open(source)) {
                    return new OsisImporter(store).run(reader);
                }
            });

            summary = summary.withElapsedMs(System.currentTimeMillis() - startTime);
            lastSummary = summary;
            log.info("Import of {} finished in {}ms", source, summary.elapsedMs());
            log.info(summary.describe());
            return summary;
        } catch (OsisImportException e) {
            log.error("Import of {} failed, store rolled back: {}", source, e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Import of {} failed, store rolled back", source, e);
            throw new OsisImportException("A fatal error occurred while importing " + source + ": " + e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
