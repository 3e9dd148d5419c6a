package io.github.nicechester.bibleimport.model;

import lombok.Builder;
import lombok.Data;

/**
 * A chapter, unique by (book, chapter number).
 */
@Data
@Builder(toBuilder = true)
public class Chapter {

    private Long id;

    private Long bookId;

    private Integer chapterNumber;

    /**
     * OSIS identifier as found in the document (e.g., "Gen.1"), kept for diagnostics
     */
    private String osisId;
}
