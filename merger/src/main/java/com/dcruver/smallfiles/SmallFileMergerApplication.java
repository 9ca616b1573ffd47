package com.dcruver.smallfiles;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the small file merger.
 *
 * Groups many small files into a few containers no larger than a configured
 * ceiling using capacity-bounded single-linkage agglomerative clustering, then
 * writes the containers, their metadata and an index to locate each original file.
 */
@SpringBootApplication
@Slf4j
public class SmallFileMergerApplication {

    public static void main(String[] args) {
        log.info("Starting Small File Merger...");
        SpringApplication.run(SmallFileMergerApplication.class, args);
    }
}
