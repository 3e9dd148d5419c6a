package io.github.nicechester.bibleimport.osis;

/**
 * Element and attribute names of the OSIS milestone dialect.
 */
final class OsisVocabulary {

    static final String OSIS_NAMESPACE = "http://www.bibletechnologies.net/2003/OSIS/namespace";

    static final String DIV = "div";
    static final String TITLE = "title";
    static final String CHAPTER = "chapter";
    static final String VERSE = "verse";
    static final String WORD = "w";

    static final String TYPE = "type";
    static final String BOOK_TYPE = "book";
    static final String OSIS_ID = "osisID";
    static final String START_ID = "sID";
    static final String END_ID = "eID";
    static final String NUMBER = "n";
    static final String LEMMA = "lemma";

    static final String STRONG_PREFIX = "strong:";
    static final String MISSING_TITLE = "Missing Title";
    static final String VERSE_PLACEHOLDER = "[in progress]";

    private OsisVocabulary() {
    }
}
