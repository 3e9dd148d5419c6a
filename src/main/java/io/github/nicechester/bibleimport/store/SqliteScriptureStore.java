package io.github.nicechester.bibleimport.store;

import io.github.nicechester.bibleimport.model.Book;
import io.github.nicechester.bibleimport.model.Chapter;
import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.WordStrong;
import io.github.nicechester.bibleimport.osis.OsisImportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.util.*;
import java.util.concurrent.Callable;

/**
 * SQLite-backed scripture store.
 *
 * <p>One connection is shared by all callers; every public method is synchronized, so
 * readers wait while an import transaction is running instead of seeing half a corpus.
 */
@Slf4j
public class SqliteScriptureStore implements ScriptureStore, AutoCloseable {

    private static final List<String> SCHEMA_SQL = List.of(
        """
        CREATE TABLE IF NOT EXISTS books (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            osis_id TEXT NOT NULL UNIQUE,
            name TEXT NOT NULL,
            book_order INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS chapters (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            book_id INTEGER NOT NULL REFERENCES books(id),
            chapter_number INTEGER NOT NULL,
            osis_id TEXT,
            UNIQUE (book_id, chapter_number)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS verses (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            chapter_id INTEGER NOT NULL REFERENCES chapters(id),
            verse_number INTEGER NOT NULL,
            osis_id TEXT,
            text TEXT NOT NULL,
            UNIQUE (chapter_id, verse_number)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS word_strongs (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            verse_id INTEGER NOT NULL REFERENCES verses(id),
            text TEXT NOT NULL,
            position INTEGER NOT NULL,
            strong_ids TEXT,
            UNIQUE (verse_id, position)
        )
        """
    );

    // Children first so foreign keys never dangle
    private static final List<String> TABLES = List.of("word_strongs", "verses", "chapters", "books");

    private static final String SELECT_BOOK_SQL = """
        SELECT id, osis_id, name, book_order FROM books WHERE osis_id = ?
        """;

    private static final String INSERT_BOOK_SQL = """
        INSERT INTO books (osis_id, name, book_order) VALUES (?, ?, ?)
        """;

    private static final String SELECT_CHAPTER_SQL = """
        SELECT id, book_id, chapter_number, osis_id FROM chapters WHERE book_id = ? AND chapter_number = ?
        """;

    private static final String INSERT_CHAPTER_SQL = """
        INSERT INTO chapters (book_id, chapter_number, osis_id) VALUES (?, ?, ?)
        """;

    private static final String SELECT_VERSE_SQL = """
        SELECT id, chapter_id, verse_number, osis_id, text FROM verses WHERE chapter_id = ? AND verse_number = ?
        """;

    private static final String INSERT_VERSE_SQL = """
        INSERT INTO verses (chapter_id, verse_number, osis_id, text) VALUES (?, ?, ?, ?)
        """;

    private static final String UPDATE_VERSE_TEXT_SQL = """
        UPDATE verses SET text = ? WHERE id = ?
        """;

    private static final String INSERT_WORD_SQL = """
        INSERT INTO word_strongs (verse_id, text, position, strong_ids) VALUES (?, ?, ?, ?)
        """;

    private static final String SELECT_BOOKS_SQL = """
        SELECT id, osis_id, name, book_order FROM books ORDER BY book_order, id
        """;

    private static final String SELECT_CHAPTER_VERSES_SQL = """
        SELECT v.id, v.chapter_id, v.verse_number, v.osis_id, v.text
        FROM verses v
        JOIN chapters c ON c.id = v.chapter_id
        JOIN books b ON b.id = c.book_id
        WHERE b.osis_id = ? AND c.chapter_number = ?
        ORDER BY v.verse_number
        """;

    private static final String SELECT_WORDS_SQL = """
        SELECT verse_id, text, position, strong_ids FROM word_strongs WHERE verse_id = ? ORDER BY position
        """;

    private final String dbPath;
    private Connection connection;

    /**
     * Opens (and creates if needed) the database at {@code dbPath}.
     *
     * @param dbPath Path to the SQLite database file
     */
    public SqliteScriptureStore(String dbPath) {
        this.dbPath = dbPath;
        initializeDatabase();
    }

    /**
     * Creates the parent directory of {@code path} if needed and opens the store there.
     */
    public static SqliteScriptureStore create(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new OsisImportException("Failed to create directory for SQLite database: " + parent, e);
            }
        }
        return new SqliteScriptureStore(path.toString());
    }

    private void initializeDatabase() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath + "?busy_timeout=30000");

            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA synchronous=NORMAL");
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA foreign_keys=ON");
            }
            for (String ddl : SCHEMA_SQL) {
                try (Statement stmt = connection.createStatement()) {
                    stmt.execute(ddl);
                }
            }

            log.info("SQLite scripture store initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new OsisImportException("Failed to initialize SQLite database: " + dbPath, e);
        }
    }

    @Override
    public synchronized <T> T inTransaction(Callable<T> work) {
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new OsisImportException("Failed to begin transaction", e);
        }

        try {
            T result = work.call();
            connection.commit();
            connection.setAutoCommit(true);
            return result;
        } catch (Exception e) {
            try {
                connection.rollback();
                connection.setAutoCommit(true);
                log.warn("Transaction rolled back: {}", e.getMessage());
            } catch (SQLException ex) {
                log.error("Failed to rollback transaction", ex);
                e.addSuppressed(ex);
            }
            if (e instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new OsisImportException("Transaction failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void wipe() {
        for (String table : TABLES) {
            try (Statement stmt = connection.createStatement()) {
                int deleted = stmt.executeUpdate("DELETE FROM " + table);
                log.debug("Deleted {} rows from {}", deleted, table);
            } catch (SQLException e) {
                throw new OsisImportException("Failed to wipe table " + table, e);
            }
        }
    }

    @Override
    public synchronized UpsertResult<Book> getOrCreateBook(String osisId, String name, int bookOrder) {
        try {
            try (PreparedStatement pstmt = connection.prepareStatement(SELECT_BOOK_SQL)) {
                pstmt.setString(1, osisId);
                try (ResultSet rs = pstmt.executeQuery()) {
                    if (rs.next()) {
                        return UpsertResult.existing(mapBook(rs));
                    }
                }
            }

            try (PreparedStatement pstmt = connection.prepareStatement(INSERT_BOOK_SQL, Statement.RETURN_GENERATED_KEYS)) {
                pstmt.setString(1, osisId);
                pstmt.setString(2, name);
                pstmt.setInt(3, bookOrder);
                pstmt.executeUpdate();
                return UpsertResult.created(Book.builder()
                    .id(generatedKey(pstmt))
                    .osisId(osisId)
                    .name(name)
                    .bookOrder(bookOrder)
                    .build());
            }
        } catch (SQLException e) {
            throw new OsisImportException("Failed to store book: " + osisId, e);
        }
    }

    @Override
    public synchronized UpsertResult<Chapter> getOrCreateChapter(Book book, int chapterNumber, String osisId) {
        try {
            try (PreparedStatement pstmt = connection.prepareStatement(SELECT_CHAPTER_SQL)) {
                pstmt.setLong(1, book.getId());
                pstmt.setInt(2, chapterNumber);
                try (ResultSet rs = pstmt.executeQuery()) {
                    if (rs.next()) {
                        return UpsertResult.existing(mapChapter(rs));
                    }
                }
            }

            try (PreparedStatement pstmt = connection.prepareStatement(INSERT_CHAPTER_SQL, Statement.RETURN_GENERATED_KEYS)) {
                pstmt.setLong(1, book.getId());
                pstmt.setInt(2, chapterNumber);
                pstmt.setString(3, osisId);
                pstmt.executeUpdate();
                return UpsertResult.created(Chapter.builder()
                    .id(generatedKey(pstmt))
                    .bookId(book.getId())
                    .chapterNumber(chapterNumber)
                    .osisId(osisId)
                    .build());
            }
        } catch (SQLException e) {
            throw new OsisImportException("Failed to store chapter: " + osisId, e);
        }
    }

    @Override
    public synchronized UpsertResult<Verse> getOrCreateVerse(Chapter chapter, int verseNumber, String osisId,
                                                              String placeholderText) {
        try {
            try (PreparedStatement pstmt = connection.prepareStatement(SELECT_VERSE_SQL)) {
                pstmt.setLong(1, chapter.getId());
                pstmt.setInt(2, verseNumber);
                try (ResultSet rs = pstmt.executeQuery()) {
                    if (rs.next()) {
                        return UpsertResult.existing(mapVerse(rs));
                    }
                }
            }

            try (PreparedStatement pstmt = connection.prepareStatement(INSERT_VERSE_SQL, Statement.RETURN_GENERATED_KEYS)) {
                pstmt.setLong(1, chapter.getId());
                pstmt.setInt(2, verseNumber);
                pstmt.setString(3, osisId);
                pstmt.setString(4, placeholderText);
                pstmt.executeUpdate();
                return UpsertResult.created(Verse.builder()
                    .id(generatedKey(pstmt))
                    .chapterId(chapter.getId())
                    .verseNumber(verseNumber)
                    .osisId(osisId)
                    .text(placeholderText)
                    .build());
            }
        } catch (SQLException e) {
            throw new OsisImportException("Failed to store verse: " + osisId, e);
        }
    }

    @Override
    public synchronized void updateVerseText(Verse verse, String text) {
        try (PreparedStatement pstmt = connection.prepareStatement(UPDATE_VERSE_TEXT_SQL)) {
            pstmt.setString(1, text);
            pstmt.setLong(2, verse.getId());
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new OsisImportException("Failed to update text of verse: " + verse.getOsisId(), e);
        }
    }

    @Override
    public synchronized void bulkInsertTokens(List<WordStrong> tokens) {
        if (tokens.isEmpty()) {
            return;
        }
        try (PreparedStatement pstmt = connection.prepareStatement(INSERT_WORD_SQL)) {
            for (WordStrong word : tokens) {
                pstmt.setLong(1, word.getVerseId());
                pstmt.setString(2, word.getText());
                pstmt.setInt(3, word.getPosition());
                if (word.getStrongIds() != null) {
                    pstmt.setString(4, word.getStrongIds());
                } else {
                    pstmt.setNull(4, Types.VARCHAR);
                }
                pstmt.addBatch();
            }
            pstmt.executeBatch();
            log.trace("Inserted {} words for verse {}", tokens.size(), tokens.get(0).getVerseId());
        } catch (SQLException e) {
            throw new OsisImportException("Failed to insert words for verse id " + tokens.get(0).getVerseId(), e);
        }
    }

    @Override
    public synchronized List<Book> findBooks() {
        List<Book> books = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_BOOKS_SQL)) {
            while (rs.next()) {
                books.add(mapBook(rs));
            }
        } catch (SQLException e) {
            throw new OsisImportException("Failed to list books", e);
        }
        return books;
    }

    @Override
    public synchronized Optional<Book> findBook(String osisId) {
        try (PreparedStatement pstmt = connection.prepareStatement(SELECT_BOOK_SQL)) {
            pstmt.setString(1, osisId);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? Optional.of(mapBook(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new OsisImportException("Failed to load book: " + osisId, e);
        }
    }

    @Override
    public synchronized List<Verse> findVerses(String bookOsisId, int chapterNumber) {
        List<Verse> verses = new ArrayList<>();
        try (PreparedStatement pstmt = connection.prepareStatement(SELECT_CHAPTER_VERSES_SQL)) {
            pstmt.setString(1, bookOsisId);
            pstmt.setInt(2, chapterNumber);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    verses.add(mapVerse(rs));
                }
            }
        } catch (SQLException e) {
            throw new OsisImportException("Failed to load verses of " + bookOsisId + " " + chapterNumber, e);
        }
        return verses;
    }

    @Override
    public synchronized List<WordStrong> findWords(long verseId) {
        List<WordStrong> words = new ArrayList<>();
        try (PreparedStatement pstmt = connection.prepareStatement(SELECT_WORDS_SQL)) {
            pstmt.setLong(1, verseId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    words.add(WordStrong.builder()
                        .verseId(rs.getLong("verse_id"))
                        .text(rs.getString("text"))
                        .position(rs.getInt("position"))
                        .strongIds(rs.getString("strong_ids"))
                        .build());
                }
            }
        } catch (SQLException e) {
            throw new OsisImportException("Failed to load words of verse id " + verseId, e);
        }
        return words;
    }

    @Override
    public synchronized Map<String, Long> countRows() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : List.of("books", "chapters", "verses", "word_strongs")) {
            try (Statement stmt = connection.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
                counts.put(table, rs.next() ? rs.getLong(1) : 0L);
            } catch (SQLException e) {
                throw new OsisImportException("Failed to count rows of " + table, e);
            }
        }
        return counts;
    }

    /**
     * Compacts the database after a bulk import.
     */
    public synchronized void optimize() {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA optimize");
            stmt.execute("VACUUM");
            log.info("SQLite database optimized");
        } catch (SQLException e) {
            log.warn("Failed to optimize database: {}", e.getMessage());
        }
    }

    /**
     * Closes the database connection.
     */
    @Override
    public synchronized void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                log.info("SQLite connection closed");
            }
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection", e);
        }
    }

    // --- Row mapping ---

    private static long generatedKey(PreparedStatement pstmt) throws SQLException {
        try (ResultSet keys = pstmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    private static Book mapBook(ResultSet rs) throws SQLException {
        return Book.builder()
            .id(rs.getLong("id"))
            .osisId(rs.getString("osis_id"))
            .name(rs.getString("name"))
            .bookOrder(rs.getInt("book_order"))
            .build();
    }

    private static Chapter mapChapter(ResultSet rs) throws SQLException {
        return Chapter.builder()
            .id(rs.getLong("id"))
            .bookId(rs.getLong("book_id"))
            .chapterNumber(rs.getInt("chapter_number"))
            .osisId(rs.getString("osis_id"))
            .build();
    }

    private static Verse mapVerse(ResultSet rs) throws SQLException {
        return Verse.builder()
            .id(rs.getLong("id"))
            .chapterId(rs.getLong("chapter_id"))
            .verseNumber(rs.getInt("verse_number"))
            .osisId(rs.getString("osis_id"))
            .text(rs.getString("text"))
            .build();
    }
}
