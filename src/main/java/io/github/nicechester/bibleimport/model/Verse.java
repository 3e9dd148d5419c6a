package io.github.nicechester.bibleimport.model;

import lombok.Builder;
import lombok.Data;

/**
 * A verse, unique by (chapter, verse number).
 * The text holds a placeholder until the verse span closes.
 */
@Data
@Builder(toBuilder = true)
public class Verse {

    private Long id;

    private Long chapterId;

    private Integer verseNumber;

    private String osisId;

    private String text;
}
