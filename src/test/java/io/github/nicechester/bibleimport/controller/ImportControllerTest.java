package io.github.nicechester.bibleimport.controller;

import io.github.nicechester.bibleimport.model.Book;
import io.github.nicechester.bibleimport.model.ImportSummary;
import io.github.nicechester.bibleimport.model.Verse;
import io.github.nicechester.bibleimport.model.WordStrong;
import io.github.nicechester.bibleimport.osis.OsisImportException;
import io.github.nicechester.bibleimport.osis.OsisSourceNotFoundException;
import io.github.nicechester.bibleimport.service.OsisImportService;
import io.github.nicechester.bibleimport.store.ScriptureStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ImportControllerTest {

    private static final Path SOURCE = Path.of("osis/bible.osis.xml");
    private static final ImportSummary SUMMARY = new ImportSummary(2, 3, 4, 55, 9, 44, 120);

    @Mock
    private OsisImportService importService;

    @Mock
    private ScriptureStore scriptureStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ImportController(importService, scriptureStore)).build();
    }

    @Test
    void importReturnsSummary() throws Exception {
        when(importService.getOsisPath()).thenReturn(SOURCE);
        when(importService.runImport()).thenReturn(SUMMARY);

        mockMvc.perform(post("/api/import"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.source").value(SOURCE.toString()))
            .andExpect(jsonPath("$.summary.books").value(2))
            .andExpect(jsonPath("$.summary.words").value(55))
            .andExpect(jsonPath("$.importTimeMs").value(120))
            .andExpect(jsonPath("$.report").value(startsWith("Summary: 2 books, 3 chapters, 4 verses, 55 strong tokens.")));
    }

    @Test
    void missingSourceIsNotFound() throws Exception {
        when(importService.getOsisPath()).thenReturn(SOURCE);
        when(importService.runImport()).thenThrow(new OsisSourceNotFoundException(SOURCE));

        mockMvc.perform(post("/api/import"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("OSIS file not found: " + SOURCE));
    }

    @Test
    void concurrentImportIsConflict() throws Exception {
        when(importService.getOsisPath()).thenReturn(SOURCE);
        when(importService.runImport()).thenThrow(new IllegalStateException("An import is already running"));

        mockMvc.perform(post("/api/import"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("An import is already running"));
    }

    @Test
    void failedImportIsServerError() throws Exception {
        when(importService.getOsisPath()).thenReturn(SOURCE);
        when(importService.runImport()).thenThrow(new OsisImportException("Malformed OSIS document at line 3, column 7: oops"));

        mockMvc.perform(post("/api/import"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value(startsWith("Malformed OSIS document")));
    }

    @Test
    void summaryBeforeFirstImportIsEmpty() throws Exception {
        when(importService.getOsisPath()).thenReturn(SOURCE);
        when(importService.getLastSummary()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/import/summary"))
            .andExpect(status().isNoContent());
    }

    @Test
    void summaryAfterImport() throws Exception {
        when(importService.getOsisPath()).thenReturn(SOURCE);
        when(importService.getLastSummary()).thenReturn(Optional.of(SUMMARY));

        mockMvc.perform(get("/api/import/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.taggedWords").value(9))
            .andExpect(jsonPath("$.summary.textFragments").value(44));
    }

    @Test
    void healthReportsRowCounts() throws Exception {
        Map<String, Long> rows = new LinkedHashMap<>();
        rows.put("books", 66L);
        rows.put("verses", 31102L);
        when(importService.isRunning()).thenReturn(false);
        when(scriptureStore.countRows()).thenReturn(rows);

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.importRunning").value(false))
            .andExpect(jsonPath("$.rows.books").value(66))
            .andExpect(jsonPath("$.rows.verses").value(31102));
    }

    @Test
    void healthAnswersWithoutTouchingStoreDuringImport() throws Exception {
        when(importService.isRunning()).thenReturn(true);

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.importRunning").value(true))
            .andExpect(jsonPath("$.rows").doesNotExist());
        verifyNoInteractions(scriptureStore);
    }

    @Test
    void listsBooks() throws Exception {
        when(scriptureStore.findBooks()).thenReturn(List.of(
            Book.builder().id(1L).osisId("Gen").name("GENESIS").bookOrder(1).build(),
            Book.builder().id(2L).osisId("Exod").name("EXODUS").bookOrder(2).build()));

        mockMvc.perform(get("/api/bible/books"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[1].osisId").value("Exod"))
            .andExpect(jsonPath("$[1].bookOrder").value(2));
    }

    @Test
    void readsChapterWithWords() throws Exception {
        Book genesis = Book.builder().id(1L).osisId("Gen").name("GENESIS").bookOrder(1).build();
        Verse verse = Verse.builder().id(10L).chapterId(5L).verseNumber(1).osisId("Gen.1.1")
            .text("[1] In the beginning.").build();
        when(scriptureStore.findBook("Gen")).thenReturn(Optional.of(genesis));
        when(scriptureStore.findVerses("Gen", 1)).thenReturn(List.of(verse));
        when(scriptureStore.findWords(10L)).thenReturn(List.of(
            WordStrong.builder().verseId(10L).text("In the beginning").position(1).strongIds("H07225").build()));

        mockMvc.perform(get("/api/bible/Gen/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bookName").value("GENESIS"))
            .andExpect(jsonPath("$.chapter").value(1))
            .andExpect(jsonPath("$.verses", hasSize(1)))
            .andExpect(jsonPath("$.verses[0].reference").value("GENESIS 1:1"))
            .andExpect(jsonPath("$.verses[0].words[0].strongIds").value("H07225"));
    }

    @Test
    void unknownBookIsNotFound() throws Exception {
        when(scriptureStore.findBook("Tob")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/bible/Tob/1"))
            .andExpect(status().isNotFound());
    }

    @Test
    void missingChapterIsNotFound() throws Exception {
        when(scriptureStore.findBook("Gen"))
            .thenReturn(Optional.of(Book.builder().id(1L).osisId("Gen").name("GENESIS").bookOrder(1).build()));
        when(scriptureStore.findVerses("Gen", 99)).thenReturn(List.of());

        mockMvc.perform(get("/api/bible/Gen/99"))
            .andExpect(status().isNotFound());
    }
}
