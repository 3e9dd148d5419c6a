package io.github.nicechester.bibleimport.osis;

import io.github.nicechester.bibleimport.model.ImportSummary;

/**
 * Mutable counters of one import run.
 */
public class ImportCounters {

    private long books;
    private long chapters;
    private long verses;
    private long words;
    private long taggedWords;
    private long textFragments;

    void bookCreated() {
        books++;
    }

    void chapterCreated() {
        chapters++;
    }

    void verseCreated() {
        verses++;
    }

    void wordsEmitted(int count) {
        words += count;
    }

    void taggedWord() {
        taggedWords++;
    }

    void textFragments(int count) {
        textFragments += count;
    }

    public ImportSummary toSummary() {
        return new ImportSummary(books, chapters, verses, words, taggedWords, textFragments, 0L);
    }
}
