package com.dcruver.clippets.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code clippets} prefix.
 */
@Data
@ConfigurationProperties(prefix = "clippets")
public class ClippetsProperties {

    /**
     * Snippet file loaded at startup, if set.
     */
    private String file;

    /**
     * Number of numbered backups kept next to the snippet file.
     */
    private int backupCount = 10;

    /**
     * Whether saving first rotates the backups.
     */
    private boolean backupOnSave = true;

    /**
     * Lines of context in diff output.
     */
    private int diffContext = 3;
}
