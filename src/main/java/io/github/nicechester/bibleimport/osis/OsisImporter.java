package io.github.nicechester.bibleimport.osis;

import io.github.nicechester.bibleimport.model.ImportSummary;
import io.github.nicechester.bibleimport.store.ScriptureSink;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-pass import of an OSIS event stream into a {@link ScriptureSink}.
 *
 * <p>The importer neither wipes the sink nor manages transactions; callers do both
 * around {@link #run(OsisEventReader)}.
 */
@Slf4j
public class OsisImporter {

    private final ScriptureSink sink;

    public OsisImporter(ScriptureSink sink) {
        this.sink = sink;
    }

    public ImportSummary run(OsisEventReader reader) {
        long startTime = System.currentTimeMillis();
        ImportCounters counters = new ImportCounters();
        ScopeTracker scope = new ScopeTracker(sink, counters);

        long events = 0;
        while (reader.hasNext()) {
            OsisEvent event = reader.next();
            scope.accept(event);
            if (event.isEnd()) {
                reader.release(event.element());
            }
            events++;
        }
        scope.finish();

        long elapsed = System.currentTimeMillis() - startTime;
        log.debug("Consumed {} OSIS events in {}ms", events, elapsed);
        return counters.toSummary().withElapsedMs(elapsed);
    }
}
