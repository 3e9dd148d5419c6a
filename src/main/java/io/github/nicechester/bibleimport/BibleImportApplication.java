package io.github.nicechester.bibleimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BibleImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(BibleImportApplication.class, args);
    }
}
