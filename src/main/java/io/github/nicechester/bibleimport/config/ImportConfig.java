package io.github.nicechester.bibleimport.config;

import io.github.nicechester.bibleimport.store.SqliteScriptureStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Configuration for the scripture store.
 */
@Slf4j
@Configuration
public class ImportConfig {

    @Value("${bible.import.sqlite.path:data/bible.db}")
    private String sqlitePath;

    @Bean(destroyMethod = "close")
    public SqliteScriptureStore scriptureStore() {
        log.info("Opening scripture database: {}", sqlitePath);
        return SqliteScriptureStore.create(Path.of(sqlitePath));
    }
}
