package io.github.nicechester.bibleimport.model;

import lombok.Builder;
import lombok.Data;

/**
 * A book of the imported corpus (e.g. "Gen").
 */
@Data
@Builder(toBuilder = true)
public class Book {

    /**
     * Store-assigned identifier
     */
    private Long id;

    /**
     * OSIS book identifier (e.g., "Gen", "1Sam")
     */
    private String osisId;

    /**
     * Display title taken from the book's main title
     */
    private String name;

    /**
     * Canonical rank, 1-based; unknown books carry the unranked sentinel
     */
    private Integer bookOrder;
}
