package io.github.nicechester.bibleimport.osis;

import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.WordStrong;
import io.github.nicechester.bibleimport.store.ScriptureSink;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Hands a finished verse to the sink: its text first, then its tokens in one batch.
 */
@Slf4j
class VerseRecordEmitter {

    private final ScriptureSink sink;
    private final ImportCounters counters;

    VerseRecordEmitter(ScriptureSink sink, ImportCounters counters) {
        this.sink = sink;
        this.counters = counters;
    }

    void emit(Verse verse, String text, List<WordStrong> words) {
        sink.updateVerseText(verse, text);
        verse.setText(text);

        if (!words.isEmpty()) {
            sink.bulkInsertTokens(words);
            counters.wordsEmitted(words.size());
        }
        log.debug("Stored verse {} ({} tokens)", verse.getOsisId(), words.size());
    }
}
