package com.dcruver.clippets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Clippets.
 *
 * Loads a snippet file into a tree of groups and snippets, lets the tree be
 * edited and reordered from an interactive shell and saves it back with
 * numbered backups.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ClippetsApplication {

    public static void main(String[] args) {
        log.info("Starting Clippets...");
        SpringApplication.run(ClippetsApplication.class, args);
    }
}
