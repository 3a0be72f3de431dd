package com.dcruver.clippets.io;

import com.dcruver.clippets.config.ClippetsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps numbered backups of a file: {@code name.bak1} is the newest and the
 * oldest is dropped once the configured count is reached.
 *
 * Backups are best effort. A failed step is logged and never stops a save.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BackupRotator {

    private final ClippetsProperties properties;

    /**
     * Shift existing backups up by one and copy the file to {@code name.bak1}.
     */
    public void backupFile(Path path) {
        int count = properties.getBackupCount();
        if (count < 1) {
            return;
        }
        for (int n = count - 1; n >= 1; n--) {
            Path src = backupPath(path, n);
            if (Files.exists(src)) {
                try {
                    Files.move(src, backupPath(path, n + 1), StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    log.warn("Could not rotate backup {}: {}", src, e.getMessage());
                }
            }
        }

        if (!Files.exists(path)) {
            log.debug("Nothing to back up, {} does not exist", path);
            return;
        }
        Path newest = backupPath(path, 1);
        try {
            Files.copy(path, newest, StandardCopyOption.REPLACE_EXISTING);
            log.info("Created backup: {}", newest);
        } catch (IOException e) {
            log.warn("Could not create backup {}: {}", newest, e.getMessage());
        }
    }

    public static Path backupPath(Path path, int n) {
        return path.resolveSibling(path.getFileName() + ".bak" + n);
    }
}
