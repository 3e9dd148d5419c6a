package io.github.nicechester.bibleimport.model;

import lombok.Builder;
import lombok.Data;

/**
 * Response model for an import request.
 */
@Data
@Builder(toBuilder = true)
public class ImportResponse {

    /**
     * Document that was imported
     */
    private String source;

    /**
     * Counts of the run, absent when the run failed
     */
    private ImportSummary summary;

    /**
     * Printable summary lines
     */
    private String report;

    private Long importTimeMs;

    private boolean success;

    private String error;

    public static ImportResponse success(String source, ImportSummary summary) {
        return ImportResponse.builder()
            .source(source)
            .summary(summary)
            .report(summary.describe())
            .importTimeMs(summary.elapsedMs())
            .success(true)
            .build();
    }

    public static ImportResponse error(String source, String errorMessage) {
        return ImportResponse.builder()
            .source(source)
            .success(false)
            .error(errorMessage)
            .build();
    }
}
