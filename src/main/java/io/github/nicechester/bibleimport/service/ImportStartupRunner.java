package io.github.nicechester.bibleimport.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Imports the configured OSIS document once at startup when
 * {@code bible.import.run-on-startup=true}. A failed import stops the application.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "bible.import.run-on-startup", havingValue = "true")
public class ImportStartupRunner implements CommandLineRunner {

    private final OsisImportService importService;

    @Override
    public void run(String... args) {
        log.info("Running startup import of {}", importService.getOsisPath());
        importService.runImport();
    }
}
