package io.github.nicechester.bibleimport.controller;

import io.github.nicechester.bibleimport.model.Book;
import io.github.nicechester.bibleimport.model.ImportResponse;
import io.github.nicechester.bibleimport.model.ImportSummary;
import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.VerseResult;
import io.github.nicechester.bibleimport.osis.OsisImportException;
import io.github.nicechester.bibleimport.osis.OsisSourceNotFoundException;
import io.github.nicechester.bibleimport.service.OsisImportService;
import io.github.nicechester.bibleimport.store.ScriptureStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for running imports and reading the imported text.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ImportController {

    private final OsisImportService importService;
    private final ScriptureStore scriptureStore;

    /**
     * Replace the store content with the configured OSIS document.
     *
     * POST /api/import
     */
    @PostMapping("/import")
    public ResponseEntity<ImportResponse> runImport() {
        String source = importService.getOsisPath().toString();
        log.info("Import requested: {}", source);

        try {
            ImportSummary summary = importService.runImport();
            return ResponseEntity.ok(ImportResponse.success(source, summary));
        } catch (OsisSourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ImportResponse.error(source, e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ImportResponse.error(source, e.getMessage()));
        } catch (OsisImportException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ImportResponse.error(source, e.getMessage()));
        }
    }

    /**
     * Summary of the last successful import.
     *
     * GET /api/import/summary
     */
    @GetMapping("/import/summary")
    public ResponseEntity<ImportResponse> lastSummary() {
        String source = importService.getOsisPath().toString();
        return importService.getLastSummary()
            .map(summary -> ResponseEntity.ok(ImportResponse.success(source, summary)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Health check endpoint.
     *
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", "bible-import");
        boolean running = importService.isRunning();
        body.put("importRunning", running);
        // the store is locked for the whole import
        if (!running) {
            body.put("rows", scriptureStore.countRows());
        }
        return ResponseEntity.ok(body);
    }

    // ==================== Bible Reading Endpoints ====================

    /**
     * All imported books in canonical order.
     *
     * GET /api/bible/books
     */
    @GetMapping("/bible/books")
    public ResponseEntity<List<Book>> getBooks() {
        return ResponseEntity.ok(scriptureStore.findBooks());
    }

    /**
     * All verses of a chapter with their words.
     *
     * GET /api/bible/{osisId}/{chapter}
     */
    @GetMapping("/bible/{osisId}/{chapter}")
    public ResponseEntity<Map<String, Object>> getChapter(
            @PathVariable String osisId,
            @PathVariable int chapter) {

        log.info("Reading chapter: {} {}", osisId, chapter);

        Optional<Book> book = scriptureStore.findBook(osisId);
        if (book.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        List<Verse> verses = scriptureStore.findVerses(osisId, chapter);
        if (verses.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        List<VerseResult> verseResults = verses.stream()
            .map(v -> toVerseResult(book.get(), chapter, v))
            .toList();

        Map<String, Object> response = Map.of(
            "bookName", book.get().getName(),
            "bookShort", book.get().getOsisId(),
            "chapter", chapter,
            "verses", verseResults
        );
        return ResponseEntity.ok(response);
    }

    private VerseResult toVerseResult(Book book, int chapter, Verse verse) {
        return VerseResult.builder()
            .reference(book.getName() + " " + chapter + ":" + verse.getVerseNumber())
            .bookName(book.getName())
            .bookShort(book.getOsisId())
            .chapter(chapter)
            .verse(verse.getVerseNumber())
            .text(verse.getText())
            .words(scriptureStore.findWords(verse.getId()))
            .build();
    }
}
