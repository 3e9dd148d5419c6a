package io.github.nicechester.bibleimport.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Represents an imported verse as returned by the reading endpoints.
 */
@Data
@Builder(toBuilder = true)
public class VerseResult {

    /**
     * Full reference string (e.g., "Genesis 1:1")
     */
    private String reference;

    /**
     * Book name (e.g., "Genesis")
     */
    private String bookName;

    /**
     * OSIS book code (e.g., "Gen")
     */
    private String bookShort;

    private Integer chapter;

    private Integer verse;

    /**
     * Reconstructed verse text, prefixed with "[n] "
     */
    private String text;

    /**
     * Tokens in position order
     */
    private List<WordStrong> words;
}
