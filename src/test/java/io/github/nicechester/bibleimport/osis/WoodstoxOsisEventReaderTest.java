package io.github.nicechester.bibleimport.osis;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class WoodstoxOsisEventReaderTest {

    @Test
    void endEventsCarryDirectAndTrailingText() throws IOException {
        List<OsisEvent> events = readAll("<a>x<b>y</b>z<c/>w</a>");

        assertThat(events)
            .extracting(OsisEvent::type, OsisEvent::localName)
            .containsExactly(
                tuple(OsisEvent.Type.START, "a"),
                tuple(OsisEvent.Type.START, "b"),
                tuple(OsisEvent.Type.END, "b"),
                tuple(OsisEvent.Type.START, "c"),
                tuple(OsisEvent.Type.END, "c"),
                tuple(OsisEvent.Type.END, "a"));

        assertThat(events.stream().filter(OsisEvent::isEnd))
            .extracting(OsisEvent::localName, OsisEvent::directText, OsisEvent::trailingText)
            .containsExactly(
                tuple("b", "y", "z"),
                tuple("c", "", "w"),
                tuple("a", "x", ""));
    }

    @Test
    void textAfterFirstChildIsNotDirectText() throws IOException {
        List<OsisEvent> events = readAll("<p>one<q>two</q>three<r>four</r>five</p>");

        OsisEvent paragraphEnd = events.get(events.size() - 1);
        assertThat(paragraphEnd.directText()).isEqualTo("one");
        assertThat(paragraphEnd.element().getChildren()).extracting(OsisElement::getTail)
            .containsExactly("three", "five");
    }

    @Test
    void attributesAndNamespacesAreExposed() throws IOException {
        List<OsisEvent> events = readAll(
            "<o:osis xmlns:o=\"http://www.bibletechnologies.net/2003/OSIS/namespace\">"
                + "<o:verse sID=\" Gen.1.1 \" n=\"1\"/><plain/></o:osis>");

        OsisElement verse = events.get(1).element();
        assertThat(verse.getLocalName()).isEqualTo("verse");
        assertThat(verse.getNamespaceUri()).isEqualTo(OsisVocabulary.OSIS_NAMESPACE);
        assertThat(verse.attribute("sID")).isEqualTo(" Gen.1.1 ");
        assertThat(verse.trimmedAttribute("sID")).isEqualTo("Gen.1.1");
        assertThat(verse.trimmedAttribute("eID")).isEmpty();
        assertThat(verse.hasAttribute("n")).isTrue();
        assertThat(verse.hasAttribute("eID")).isFalse();

        OsisElement plain = events.get(3).element();
        assertThat(plain.getNamespaceUri()).isEmpty();
    }

    @Test
    void rootIsTheOutermostElement() throws IOException {
        try (OsisEventReader reader = reader("<osis><osisText/></osis>")) {
            assertThat(reader.root()).isNull();
            OsisEvent first = reader.next();
            assertThat(reader.root()).isSameAs(first.element());
            assertThat(reader.root().getParent()).isNull();
        }
    }

    @Test
    void releasingKeepsSiblingListBounded() throws IOException {
        StringBuilder xml = new StringBuilder("<root>");
        for (int i = 0; i < 1000; i++) {
            xml.append("<v n=\"").append(i).append("\">text ").append(i).append("</v> ");
        }
        xml.append("</root>");

        int maxChildren = 0;
        int released = 0;
        try (OsisEventReader reader = reader(xml.toString())) {
            while (reader.hasNext()) {
                OsisEvent event = reader.next();
                OsisElement root = reader.root();
                maxChildren = Math.max(maxChildren, root.getChildren().size());
                if (event.isEnd() && event.element() != root) {
                    reader.release(event.element());
                    released++;
                    assertThat(event.element().getText()).isNull();
                    assertThat(event.element().getTail()).isNull();
                    assertThat(event.element().getAttributes()).isEmpty();
                }
            }
        }

        assertThat(released).isEqualTo(1000);
        assertThat(maxChildren).isLessThanOrEqualTo(3);
    }

    @Test
    void releasingAnOpenElementIsRejected() throws IOException {
        try (OsisEventReader reader = reader("<a><b/></a>")) {
            OsisEvent start = reader.next();

            assertThat(start.isStart()).isTrue();
            assertThatThrownBy(() -> reader.release(start.element()))
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void exhaustedReaderThrows() throws IOException {
        try (OsisEventReader reader = reader("<a/>")) {
            reader.next();
            reader.next();

            assertThat(reader.hasNext()).isFalse();
            assertThatThrownBy(reader::next).isInstanceOf(java.util.NoSuchElementException.class);
        }
    }

    @Test
    void mismatchedTagsReportLocation() {
        assertThatThrownBy(() -> readAll("<a>\n<b></a>"))
            .isInstanceOf(OsisImportException.class)
            .hasMessageStartingWith("Malformed OSIS document at line 2");
    }

    @Test
    void emptyInputIsRejected() {
        assertThatThrownBy(() -> readAll(""))
            .isInstanceOf(OsisImportException.class);
    }

    private static OsisEventReader reader(String xml) {
        return WoodstoxOsisEventReader.of(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static List<OsisEvent> readAll(String xml) throws IOException {
        List<OsisEvent> events = new ArrayList<>();
        try (OsisEventReader reader = reader(xml)) {
            reader.forEachRemaining(events::add);
        }
        return events;
    }
}
