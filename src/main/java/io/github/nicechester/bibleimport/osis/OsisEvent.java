package io.github.nicechester.bibleimport.osis;

/**
 * A structural event of the OSIS document.
 *
 * <p>Start events are produced as soon as the start tag is read and carry the element
 * name and attributes. End events are produced once the text following the end tag is
 * known, so both the direct text and the trailing text of the element are available.
 */
public record OsisEvent(Type type, OsisElement element) {

    public enum Type {
        START,
        END
    }

    public static OsisEvent start(OsisElement element) {
        return new OsisEvent(Type.START, element);
    }

    public static OsisEvent end(OsisElement element) {
        return new OsisEvent(Type.END, element);
    }

    public boolean isStart() {
        return type == Type.START;
    }

    public boolean isEnd() {
        return type == Type.END;
    }

    public String localName() {
        return element.getLocalName();
    }

    /**
     * Direct text of the element; never null.
     */
    public String directText() {
        String text = element.getText();
        return text == null ? "" : text;
    }

    /**
     * Text after the element's end tag; never null.
     */
    public String trailingText() {
        String tail = element.getTail();
        return tail == null ? "" : tail;
    }
}
