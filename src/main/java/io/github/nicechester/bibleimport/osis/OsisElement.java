package io.github.nicechester.bibleimport.osis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Partially built element of the document being streamed.
 *
 * <p>The reader only keeps the chain of open elements and the children that have not
 * been released yet, so the tree never grows with the size of the document as long as
 * the consumer releases every element once it has handled its end event.
 */
public final class OsisElement {

    private final String namespaceUri;
    private final String localName;
    private Map<String, String> attributes;
    private final OsisElement parent;
    private final List<OsisElement> children = new ArrayList<>();

    private String text;
    private String tail;
    private boolean closed;

    OsisElement(String namespaceUri, String localName, Map<String, String> attributes, OsisElement parent) {
        this.namespaceUri = namespaceUri == null ? "" : namespaceUri;
        this.localName = localName;
        this.attributes = attributes;
        this.parent = parent;
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public String getLocalName() {
        return localName;
    }

    public boolean is(String name) {
        return localName.equals(name);
    }

    /**
     * Attribute value by local name, or {@code null}.
     */
    public String attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Attribute value stripped of surrounding whitespace, or an empty string when absent.
     */
    public String trimmedAttribute(String name) {
        String value = attributes.get(name);
        return value == null ? "" : value.strip();
    }

    public boolean hasAttribute(String name) {
        String value = attributes.get(name);
        return value != null && !value.isEmpty();
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public OsisElement getParent() {
        return parent;
    }

    public List<OsisElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Text between the start tag and the first child, or {@code null}.
     */
    public String getText() {
        return text;
    }

    /**
     * Text between the end tag and the next tag, or {@code null}.
     */
    public String getTail() {
        return tail;
    }

    public boolean isClosed() {
        return closed;
    }

    void appendText(String chars) {
        text = text == null ? chars : text + chars;
    }

    void appendTail(String chars) {
        tail = tail == null ? chars : tail + chars;
    }

    void addChild(OsisElement child) {
        children.add(child);
    }

    void markClosed() {
        closed = true;
    }

    /**
     * Drops content, attributes and children of this element.
     */
    void clear() {
        children.clear();
        attributes = Map.of();
        text = null;
        tail = null;
    }

    /**
     * Detaches every sibling that precedes this element in its parent.
     */
    void removePrecedingSiblings() {
        if (parent == null) {
            return;
        }
        int index = parent.children.indexOf(this);
        if (index > 0) {
            parent.children.subList(0, index).clear();
        }
    }

    @Override
    public String toString() {
        return "<" + localName + attributes + ">";
    }
}
