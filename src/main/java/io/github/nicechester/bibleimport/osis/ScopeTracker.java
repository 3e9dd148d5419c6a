package io.github.nicechester.bibleimport.osis;

import io.github.nicechester.bibleimport.model.Book;
import io.github.nicechester.bibleimport.model.Chapter;
import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.WordStrong;
import io.github.nicechester.bibleimport.store.ScriptureSink;
import io.github.nicechester.bibleimport.store.UpsertResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * State machine that follows book, chapter and verse scope across the event stream.
 *
 * <p>Verses are milestones: a {@code <verse sID>} opens a span and a later
 * {@code <verse eID>} closes it, with any number of unrelated elements in between.
 * While a span is open its text is fed, in document order, to the text accumulator and
 * the tokenizer; the close marker finalises the verse through the record emitter.
 *
 * <p>The direct text of an element opened inside the span is final once its first child
 * starts, or once it ends if it has no children, and is handed over at that point. Direct
 * text of elements opened before the span lies outside it and is never collected;
 * trailing text after any element that ends inside the span is. Text following a verse
 * marker itself is tokenized but left out of the verse text.
 *
 * <p>A close marker only ends a span that has a verse. A span opened with an unusable
 * verse number stays open until the next open marker and its text is counted as stray
 * fragments but never stored.
 *
 * <p>A book is stored once its title is known: at the end of its first OSIS
 * {@code <title>} child, at its first chapter, or at its own end.
 */
@Slf4j
class ScopeTracker {

    private static final Pattern NUMBER = Pattern.compile("[0-9]{1,9}");

    private final ScriptureSink sink;
    private final ImportCounters counters;
    private final VerseTextAccumulator text;
    private final VerseTokenizer tokenizer;
    private final VerseRecordEmitter emitter;
    private final Set<Long> finalizedVerseIds = new HashSet<>();
    private final Deque<SpanFrame> spanFrames = new ArrayDeque<>();

    private PendingBook pendingBook;
    private Book currentBook;
    private Chapter currentChapter;
    private Verse currentVerse;
    private boolean inVerseSpan;

    ScopeTracker(ScriptureSink sink, ImportCounters counters) {
        this.sink = sink;
        this.counters = counters;
        this.text = new VerseTextAccumulator(counters);
        this.tokenizer = new VerseTokenizer(counters);
        this.emitter = new VerseRecordEmitter(sink, counters);
    }

    void accept(OsisEvent event) {
        if (event.isStart()) {
            onStart(event.element());
        } else {
            onEnd(event);
        }
    }

    /**
     * Flushes state left over when the document ends.
     */
    void finish() {
        materializeBook(null);
        if (currentVerse != null) {
            log.warn("Document ended inside verse {}; discarding its span", currentVerse.getOsisId());
        }
        endSpan();
    }

    Book currentBook() {
        return currentBook;
    }

    Chapter currentChapter() {
        return currentChapter;
    }

    Verse currentVerse() {
        return currentVerse;
    }

    boolean inVerseSpan() {
        return inVerseSpan;
    }

    private void onStart(OsisElement element) {
        if (isBook(element)) {
            openBook(element);
        } else if (element.is(OsisVocabulary.CHAPTER)) {
            materializeBook(null);
            openChapter(element);
        } else if (element.is(OsisVocabulary.VERSE) && element.hasAttribute(OsisVocabulary.START_ID)) {
            openVerse(element);
        }

        if (inVerseSpan) {
            SpanFrame parent = spanFrames.peek();
            if (parent != null && parent.element() == element.getParent() && !parent.textCollected()) {
                spanFrames.pop();
                String parentText = parent.element().getText();
                collectDirectText(parent.element(), parentText == null ? "" : parentText);
                spanFrames.push(new SpanFrame(parent.element(), true));
            }
            spanFrames.push(new SpanFrame(element, false));
        }
    }

    private void onEnd(OsisEvent event) {
        OsisElement element = event.element();

        if (inVerseSpan) {
            SpanFrame frame = spanFrames.peek();
            if (frame != null && frame.element() == element) {
                spanFrames.pop();
                if (!frame.textCollected()) {
                    collectDirectText(element, event.directText());
                }
            }
        }

        if (element.is(OsisVocabulary.VERSE) && element.hasAttribute(OsisVocabulary.END_ID)) {
            closeVerse(element);
            return;
        }

        if (inVerseSpan) {
            collectTrailingText(element, event.trailingText());
        }

        if (pendingBook != null) {
            if (isBookTitle(element)) {
                materializeBook(event.directText());
            } else if (element == pendingBook.element()) {
                materializeBook(null);
            }
        }
    }

    // Verse milestones feed the tokenizer only
    private void collectDirectText(OsisElement element, String directText) {
        if (!element.is(OsisVocabulary.VERSE)) {
            text.onDirectText(element, directText);
        }
        if (currentVerse != null) {
            tokenizer.onDirectText(element, directText);
        }
    }

    private void collectTrailingText(OsisElement element, String trailingText) {
        if (!element.is(OsisVocabulary.VERSE)) {
            text.onTrailingText(trailingText);
        }
        if (currentVerse != null) {
            tokenizer.onTrailingText(trailingText);
        }
    }

    private void openBook(OsisElement element) {
        materializeBook(null);

        String osisId = element.trimmedAttribute(OsisVocabulary.OSIS_ID);
        if (osisId.isEmpty()) {
            log.warn("Skipping book element without {}", OsisVocabulary.OSIS_ID);
            return;
        }

        int rank = CanonicalBookOrder.rank(osisId);
        if (rank == CanonicalBookOrder.UNRANKED) {
            log.warn("Book with OSIS ID '{}' not found in canonical order; ranking it {}", osisId, rank);
        }
        pendingBook = new PendingBook(element, osisId, rank);
        currentChapter = null;
    }

    private void materializeBook(String title) {
        if (pendingBook == null) {
            return;
        }
        String name = title == null || title.isBlank() ? OsisVocabulary.MISSING_TITLE : title.strip();

        UpsertResult<Book> result = sink.getOrCreateBook(pendingBook.osisId(), name, pendingBook.rank());
        if (result.created()) {
            counters.bookCreated();
        }
        currentBook = result.value();
        pendingBook = null;
        log.info("Importing book {} ({})", currentBook.getOsisId(), currentBook.getName());
    }

    private void openChapter(OsisElement element) {
        if (currentBook == null) {
            return;
        }
        String osisId = element.trimmedAttribute(OsisVocabulary.OSIS_ID);
        if (osisId.isEmpty() || element.hasAttribute(OsisVocabulary.END_ID)) {
            log.debug("Ignoring chapter element without a chapter reference: {}", element);
            return;
        }
        String segment = osisId.substring(osisId.lastIndexOf('.') + 1).strip();

        OptionalInt number = parseNumber(segment);
        if (number.isEmpty()) {
            log.warn("Skipping chapter '{}': '{}' is not a chapter number", osisId, segment);
            return;
        }

        UpsertResult<Chapter> result = sink.getOrCreateChapter(currentBook, number.getAsInt(), osisId);
        if (result.created()) {
            counters.chapterCreated();
        }
        currentChapter = result.value();
    }

    private void openVerse(OsisElement element) {
        if (currentChapter == null) {
            log.debug("Ignoring verse {} outside any chapter", element.trimmedAttribute(OsisVocabulary.OSIS_ID));
            return;
        }
        if (currentVerse != null) {
            log.warn("Verse {} opened before {} was closed; discarding the unfinished span",
                element.trimmedAttribute(OsisVocabulary.OSIS_ID),
                currentVerse.getOsisId());
        }

        inVerseSpan = true;
        currentVerse = null;
        spanFrames.clear();
        text.reset();
        tokenizer.reset(null);

        String osisId = element.trimmedAttribute(OsisVocabulary.OSIS_ID);
        String n = element.trimmedAttribute(OsisVocabulary.NUMBER);
        OptionalInt number = parseNumber(n);
        if (number.isEmpty()) {
            log.warn("Verse {} has no usable number ('{}'); its span is not stored", osisId, n);
            return;
        }

        UpsertResult<Verse> result = sink.getOrCreateVerse(currentChapter, number.getAsInt(), osisId,
            OsisVocabulary.VERSE_PLACEHOLDER);
        if (result.created()) {
            counters.verseCreated();
        }
        Verse verse = result.value();
        if (finalizedVerseIds.contains(verse.getId())) {
            log.warn("Verse {} occurs twice in chapter {}; keeping the first occurrence",
                osisId, currentChapter.getOsisId());
            return;
        }
        currentVerse = verse;
        tokenizer.reset(verse);
    }

    /**
     * Finalises the open verse. Without one the marker is ignored and a verseless span
     * stays open, collecting stray text until the next open marker.
     */
    private void closeVerse(OsisElement element) {
        if (currentVerse == null) {
            log.debug("Ignoring close marker {} without an open verse", element.attribute(OsisVocabulary.END_ID));
            return;
        }
        String verseText = text.finish(currentVerse.getVerseNumber());
        List<WordStrong> words = tokenizer.finish();
        emitter.emit(currentVerse, verseText, words);
        finalizedVerseIds.add(currentVerse.getId());
        endSpan();
    }

    private void endSpan() {
        inVerseSpan = false;
        currentVerse = null;
        spanFrames.clear();
        text.reset();
        tokenizer.reset(null);
    }

    private boolean isBookTitle(OsisElement element) {
        return element.is(OsisVocabulary.TITLE)
            && element.getParent() == pendingBook.element()
            && OsisVocabulary.OSIS_NAMESPACE.equals(element.getNamespaceUri());
    }

    private static boolean isBook(OsisElement element) {
        return element.is(OsisVocabulary.DIV)
            && OsisVocabulary.BOOK_TYPE.equals(element.attribute(OsisVocabulary.TYPE));
    }

    static OptionalInt parseNumber(String value) {
        if (value == null || !NUMBER.matcher(value).matches()) {
            return OptionalInt.empty();
        }
        int number = Integer.parseInt(value);
        return number > 0 ? OptionalInt.of(number) : OptionalInt.empty();
    }

    private record PendingBook(OsisElement element, String osisId, int rank) {}

    private record SpanFrame(OsisElement element, boolean textCollected) {}
}
