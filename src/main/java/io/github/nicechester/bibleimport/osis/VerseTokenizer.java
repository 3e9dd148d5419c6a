package io.github.nicechester.bibleimport.osis;

import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.WordStrong;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits the open verse span into word and punctuation tokens.
 *
 * <p>A {@code <w>} element yields one tagged token from its direct text, carrying its
 * Strong's numbers. Trailing text after any element is split into untagged tokens:
 * runs of word characters, apostrophes and hyphens, and each of {@code . , ; ! ? :}
 * on its own. Direct text of other elements is not tokenized.
 */
class VerseTokenizer {

    private static final Pattern TOKEN = Pattern.compile("[\\w'-]+|[.,;!?:]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final ImportCounters counters;
    private final List<WordStrong> words = new ArrayList<>();
    private Verse verse;
    private int position;

    VerseTokenizer(ImportCounters counters) {
        this.counters = counters;
    }

    /**
     * Starts a new token list for {@code verse}.
     */
    void reset(Verse verse) {
        this.verse = verse;
        this.position = 0;
        words.clear();
    }

    void onDirectText(OsisElement element, String directText) {
        if (!element.is(OsisVocabulary.WORD)) {
            return;
        }
        String word = directText.strip();
        if (!word.isEmpty()) {
            counters.taggedWord();
            add(word, strongIds(element.attribute(OsisVocabulary.LEMMA)));
        }
    }

    void onTrailingText(String trailingText) {
        String tail = trailingText.strip();
        if (tail.isEmpty()) {
            return;
        }
        for (String piece : split(tail)) {
            add(piece, null);
        }
    }

    /**
     * Returns the tokens collected since the last reset, in position order.
     */
    List<WordStrong> finish() {
        List<WordStrong> result = List.copyOf(words);
        reset(null);
        return result;
    }

    private void add(String text, String strongIds) {
        words.add(WordStrong.builder()
            .verseId(verse.getId())
            .text(text)
            .position(++position)
            .strongIds(strongIds)
            .build());
    }

    static List<String> split(String text) {
        List<String> pieces = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            pieces.add(matcher.group());
        }
        return pieces;
    }

    /**
     * Turns a lemma attribute such as {@code "strong:H0853 strong:H08064"} into
     * {@code "H0853,H08064"}; returns {@code null} when no code remains.
     */
    static String strongIds(String lemma) {
        if (lemma == null) {
            return null;
        }
        String codes = Arrays.stream(WHITESPACE.split(lemma.replace(OsisVocabulary.STRONG_PREFIX, "")))
            .map(String::strip)
            .filter(code -> !code.isEmpty())
            .collect(Collectors.joining(","));
        return codes.isEmpty() ? null : codes;
    }
}
