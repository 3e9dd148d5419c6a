package io.github.nicechester.bibleimport.tool;

import io.github.nicechester.bibleimport.model.ImportSummary;
import io.github.nicechester.bibleimport.osis.OsisImportException;
import io.github.nicechester.bibleimport.service.OsisImportService;
import io.github.nicechester.bibleimport.store.SqliteScriptureStore;

import java.nio.file.Path;
import java.util.Map;

/**
 * Standalone tool to build the SQLite Bible database from an OSIS file.
 *
 * <p>Usage:
 * <pre>
 * mvn exec:java -Dexec.mainClass="io.github.nicechester.bibleimport.tool.OsisDatabaseBuilder" \
 *     -Dexec.args="--input osis/bible.osis.xml --output data/bible.db"
 * </pre>
 */
public class OsisDatabaseBuilder {

    private static final String DEFAULT_INPUT = "osis/bible.osis.xml";
    private static final String DEFAULT_OUTPUT = "data/bible.db";

    public static void main(String[] args) {
        String inputPath = DEFAULT_INPUT;
        String outputPath = DEFAULT_OUTPUT;

        for (int i = 0; i < args.length; i++) {
            if ("--input".equals(args[i]) && i + 1 < args.length) {
                inputPath = args[++i];
            } else if ("--output".equals(args[i]) && i + 1 < args.length) {
                outputPath = args[++i];
            } else if ("--help".equals(args[i])) {
                printHelp();
                return;
            } else {
                System.err.println("Unknown argument: " + args[i]);
                printHelp();
                System.exit(2);
            }
        }

        System.out.println("╔════════════════════════════════════════════════════════════╗");
        System.out.println("║              OSIS Bible Database Builder                   ║");
        System.out.println("╚════════════════════════════════════════════════════════════╝");
        System.out.println();

        try {
            new OsisDatabaseBuilder().build(Path.of(inputPath), Path.of(outputPath));
        } catch (OsisImportException e) {
            System.err.println();
            System.err.println("Import failed: " + e.getMessage());
            if (e.getCause() != null) {
                System.err.println("Caused by: " + e.getCause());
            }
            System.exit(1);
        }
    }

    private static void printHelp() {
        System.out.println("Usage: OsisDatabaseBuilder [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --input <path>   OSIS XML document to import");
        System.out.println("                   Default: " + DEFAULT_INPUT);
        System.out.println("  --output <path>  SQLite database to (re)fill");
        System.out.println("                   Default: " + DEFAULT_OUTPUT);
        System.out.println("  --help           Show this help message");
    }

    public ImportSummary build(Path input, Path output) {
        System.out.println("Opening SQLite database: " + output);
        try (SqliteScriptureStore store = SqliteScriptureStore.create(output)) {
            System.out.println("✓ Database ready");

            System.out.println("Importing " + input + " ...");
            ImportSummary summary = new OsisImportService(store, input.toString()).runImport();
            System.out.println("✓ Import committed");

            System.out.println("Optimizing database...");
            store.optimize();
            System.out.println("✓ Database optimized");

            printStats(output, summary, store.countRows());
            return summary;
        }
    }

    private void printStats(Path output, ImportSummary summary, Map<String, Long> rows) {
        long fileSize = output.toFile().length();

        System.out.println();
        System.out.println("════════════════════════════════════════════════════════════");
        System.out.println("Build complete!");
        System.out.println("────────────────────────────────────────────────────────────");
        System.out.printf("  Output:     %s%n", output);
        System.out.printf("  Books:      %,d%n", rows.getOrDefault("books", 0L));
        System.out.printf("  Chapters:   %,d%n", rows.getOrDefault("chapters", 0L));
        System.out.printf("  Verses:     %,d%n", rows.getOrDefault("verses", 0L));
        System.out.printf("  Words:      %,d%n", rows.getOrDefault("word_strongs", 0L));
        System.out.printf("  File size:  %,.1f MB%n", fileSize / (1024.0 * 1024.0));
        System.out.printf("  Time:       %d min %d sec%n", summary.elapsedMs() / 60000, (summary.elapsedMs() % 60000) / 1000);
        System.out.println("────────────────────────────────────────────────────────────");
        System.out.println(summary.describe());
        System.out.println("════════════════════════════════════════════════════════════");
    }
}
