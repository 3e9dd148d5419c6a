package io.github.nicechester.bibleimport.store;

import io.github.nicechester.bibleimport.model.Book;
import io.github.nicechester.bibleimport.model.Chapter;
import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.WordStrong;

import java.util.List;

/**
 * Destination for the records produced by the OSIS importer.
 *
 * <p>Get-or-create operations are idempotent by key: a second call with the same key
 * returns the instance stored by the first one and reports {@code created == false}.
 */
public interface ScriptureSink {

    /**
     * Deletes every stored book, chapter, verse and word.
     */
    void wipe();

    UpsertResult<Book> getOrCreateBook(String osisId, String name, int bookOrder);

    UpsertResult<Chapter> getOrCreateChapter(Book book, int chapterNumber, String osisId);

    UpsertResult<Verse> getOrCreateVerse(Chapter chapter, int verseNumber, String osisId, String placeholderText);

    void updateVerseText(Verse verse, String text);

    /**
     * Stores all tokens of one verse in a single batch.
     */
    void bulkInsertTokens(List<WordStrong> tokens);
}
