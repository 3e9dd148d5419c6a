package io.github.nicechester.bibleimport.osis;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Forward-only, single-pass sequence of {@link OsisEvent}s in document order.
 *
 * <p>Consumers must call {@link #release(OsisElement)} once they are done with the
 * element of an end event; this drops the element's content and the siblings that
 * precede it, which keeps memory bounded independent of document size.
 */
public interface OsisEventReader extends Iterator<OsisEvent>, Closeable {

    /**
     * Releases a closed element and every earlier sibling.
     *
     * @throws IllegalStateException if the element's end event has not been produced yet
     */
    void release(OsisElement element);

    /**
     * Outermost element of the document, or {@code null} before the first start event.
     */
    OsisElement root();
}
