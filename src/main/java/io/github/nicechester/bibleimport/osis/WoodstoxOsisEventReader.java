package io.github.nicechester.bibleimport.osis;

import com.ctc.wstx.stax.WstxInputFactory;
import lombok.extern.slf4j.Slf4j;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * {@link OsisEventReader} backed by a Woodstox StAX2 stream reader.
 *
 * <p>The reader keeps the chain of open elements on a stack. An end event is held back
 * until the next tag boundary so that it can carry the element's trailing text.
 */
@Slf4j
public class WoodstoxOsisEventReader implements OsisEventReader {

    private final InputStream input;
    private final XMLStreamReader2 reader;

    private final Deque<OsisElement> open = new ArrayDeque<>();
    private final Deque<OsisEvent> ready = new ArrayDeque<>();

    // Closed element still collecting its trailing text
    private OsisElement pendingEnd;
    private OsisElement root;
    private boolean finished;

    private WoodstoxOsisEventReader(InputStream input) {
        this.input = input;
        try {
            this.reader = (XMLStreamReader2) newInputFactory().createXMLStreamReader(input);
        } catch (XMLStreamException e) {
            throw new OsisImportException("Failed to open OSIS stream: " + e.getMessage(), e);
        }
    }

    /**
     * Opens a reader over a document file. The file is closed with the reader.
     */
    public static WoodstoxOsisEventReader open(Path path) throws IOException {
        InputStream in = Files.newInputStream(path);
        try {
            return new WoodstoxOsisEventReader(in);
        } catch (RuntimeException e) {
            in.close();
            throw e;
        }
    }

    /**
     * Opens a reader over a stream. The stream is closed with the reader.
     */
    public static WoodstoxOsisEventReader of(InputStream in) {
        return new WoodstoxOsisEventReader(in);
    }

    private static XMLInputFactory2 newInputFactory() {
        XMLInputFactory2 factory = new WstxInputFactory();
        factory.configureForSpeed();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }

    @Override
    public boolean hasNext() {
        fill();
        return !ready.isEmpty();
    }

    @Override
    public OsisEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more OSIS events");
        }
        OsisEvent event = ready.poll();
        if (event.isEnd()) {
            event.element().markClosed();
        }
        return event;
    }

    @Override
    public void release(OsisElement element) {
        if (!element.isClosed()) {
            throw new IllegalStateException("Cannot release " + element + " before its end event was consumed");
        }
        element.clear();
        element.removePrecedingSiblings();
    }

    @Override
    public OsisElement root() {
        return root;
    }

    @Override
    public void close() throws IOException {
        try {
            reader.close();
        } catch (XMLStreamException e) {
            throw new IOException("Failed to close OSIS reader", e);
        } finally {
            input.close();
        }
    }

    private void fill() {
        while (ready.isEmpty() && !finished) {
            try {
                if (!reader.hasNext()) {
                    onEndDocument();
                    continue;
                }
                switch (reader.next()) {
                    case XMLStreamConstants.START_ELEMENT -> onStartElement();
                    case XMLStreamConstants.END_ELEMENT -> onEndElement();
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE ->
                        onCharacters(reader.getText());
                    case XMLStreamConstants.END_DOCUMENT -> onEndDocument();
                    default -> {
                        // comments, processing instructions and the prolog carry nothing we use
                    }
                }
            } catch (XMLStreamException e) {
                throw new OsisImportException("Malformed OSIS document" + describe(e.getLocation())
                    + ": " + e.getMessage(), e);
            }
        }
    }

    private void onStartElement() {
        flushPendingEnd();

        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }

        OsisElement parent = open.peek();
        OsisElement element = new OsisElement(reader.getNamespaceURI(), reader.getLocalName(), attributes, parent);
        if (parent != null) {
            parent.addChild(element);
        } else if (root == null) {
            root = element;
        }
        open.push(element);
        ready.add(OsisEvent.start(element));
    }

    private void onEndElement() {
        flushPendingEnd();
        pendingEnd = open.pop();
    }

    private void onCharacters(String chars) {
        if (chars.isEmpty()) {
            return;
        }
        if (pendingEnd != null) {
            pendingEnd.appendTail(chars);
        } else if (!open.isEmpty() && !open.peek().hasChildren()) {
            open.peek().appendText(chars);
        }
    }

    private void onEndDocument() {
        flushPendingEnd();
        finished = true;
        if (!open.isEmpty()) {
            log.warn("OSIS document ended with {} unclosed element(s)", open.size());
        }
    }

    private void flushPendingEnd() {
        if (pendingEnd != null) {
            ready.add(OsisEvent.end(pendingEnd));
            pendingEnd = null;
        }
    }

    private static String describe(Location location) {
        if (location == null) {
            return "";
        }
        return " at line " + location.getLineNumber() + ", column " + location.getColumnNumber();
    }
}
