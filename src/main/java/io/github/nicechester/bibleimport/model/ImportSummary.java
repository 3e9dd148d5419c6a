package io.github.nicechester.bibleimport.model;

/**
 * Counts gathered over one import run.
 */
public record ImportSummary(
    /**
     * Books created
     */
    long books,

    /**
     * Chapters created
     */
    long chapters,

    /**
     * Verses created
     */
    long verses,

    /**
     * Tokens handed to the store
     */
    long words,

    /**
     * Tokens taken from tagged word elements
     */
    long taggedWords,

    /**
     * Whitespace-separated pieces of text found outside word elements
     */
    long textFragments,

    /**
     * Wall-clock duration of the run in milliseconds
     */
    long elapsedMs
) {

    public ImportSummary withElapsedMs(long elapsed) {
        return new ImportSummary(books, chapters, verses, words, taggedWords, textFragments, elapsed);
    }

    /**
     * Human-readable report of the run.
     */
    public String describe() {
        return String.format("Summary: %d books, %d chapters, %d verses, %d strong tokens.%n"
                + "Collected text details: %d tagged words (<w>) and %d text fragments outside tags.",
            books, chapters, verses, words, taggedWords, textFragments);
    }
}
