package io.github.nicechester.bibleimport.model;

import lombok.Builder;
import lombok.Data;

/**
 * One word or punctuation token of a verse.
 */
@Data
@Builder(toBuilder = true)
public class WordStrong {

    private Long verseId;

    /**
     * Surface form of the token
     */
    private String text;

    /**
     * 1-based position within the verse
     */
    private Integer position;

    /**
     * Comma-separated Strong's numbers (e.g., "H07225,H0853"), null for untagged tokens
     */
    private String strongIds;
}
