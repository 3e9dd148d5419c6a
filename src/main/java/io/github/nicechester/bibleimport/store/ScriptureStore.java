package io.github.nicechester.bibleimport.store;

import io.github.nicechester.bibleimport.model.Book;
import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.WordStrong;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * A {@link ScriptureSink} that can also run work atomically and read imported data back.
 */
public interface ScriptureStore extends ScriptureSink {

    /**
     * Runs {@code work} in one transaction. Commits when it returns, rolls back and
     * rethrows when it throws.
     */
    <T> T inTransaction(Callable<T> work);

    /**
     * Books ordered by canonical rank.
     */
    List<Book> findBooks();

    Optional<Book> findBook(String osisId);

    /**
     * Verses of one chapter ordered by verse number.
     */
    List<Verse> findVerses(String bookOsisId, int chapterNumber);

    /**
     * Words of one verse ordered by position.
     */
    List<WordStrong> findWords(long verseId);

    /**
     * Row counts per table.
     */
    Map<String, Long> countRows();
}
