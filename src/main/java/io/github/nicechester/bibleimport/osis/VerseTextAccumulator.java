package io.github.nicechester.bibleimport.osis;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rebuilds the visible text of the verse span that is currently open.
 */
class VerseTextAccumulator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final ImportCounters counters;
    private final List<String> parts = new ArrayList<>();

    VerseTextAccumulator(ImportCounters counters) {
        this.counters = counters;
    }

    void reset() {
        parts.clear();
    }

    void onDirectText(OsisElement element, String directText) {
        if (directText.isEmpty()) {
            return;
        }
        parts.add(directText);
        if (!element.is(OsisVocabulary.WORD)) {
            counters.textFragments(countPieces(directText));
        }
    }

    void onTrailingText(String trailingText) {
        if (trailingText.isEmpty()) {
            return;
        }
        parts.add(trailingText);
        counters.textFragments(countPieces(trailingText));
    }

    /**
     * Joins the collected fragments, collapses whitespace and prefixes the verse number.
     */
    String finish(int verseNumber) {
        String prose = normalize(String.join("", parts));
        reset();
        return "[" + verseNumber + "] " + prose;
    }

    static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    static int countPieces(String text) {
        String normalized = normalize(text);
        return normalized.isEmpty() ? 0 : normalized.split(" ").length;
    }
}
