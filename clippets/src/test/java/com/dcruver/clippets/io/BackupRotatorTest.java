package com.dcruver.clippets.io;

import com.dcruver.clippets.config.ClippetsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BackupRotatorTest {

    private ClippetsProperties properties;
    private BackupRotator rotator;

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() {
        properties = new ClippetsProperties();
        rotator = new BackupRotator(properties);
        file = tempDir.resolve("snippets.txt");
    }

    @Test
    void testFirstBackup() throws Exception {
        Files.writeString(file, "v1");

        rotator.backupFile(file);

        assertEquals("v1", Files.readString(tempDir.resolve("snippets.txt.bak1")));
        assertEquals("v1", Files.readString(file));
    }

    @Test
    void testBackupsShiftUp() throws Exception {
        Files.writeString(file, "v1");
        rotator.backupFile(file);
        Files.writeString(file, "v2");
        rotator.backupFile(file);
        Files.writeString(file, "v3");
        rotator.backupFile(file);

        assertEquals("v3", Files.readString(BackupRotator.backupPath(file, 1)));
        assertEquals("v2", Files.readString(BackupRotator.backupPath(file, 2)));
        assertEquals("v1", Files.readString(BackupRotator.backupPath(file, 3)));
    }

    @Test
    void testOldestIsDropped() throws Exception {
        properties.setBackupCount(3);
        Files.writeString(file, "current");
        Files.writeString(BackupRotator.backupPath(file, 1), "b1");
        Files.writeString(BackupRotator.backupPath(file, 2), "b2");
        Files.writeString(BackupRotator.backupPath(file, 3), "b3");

        rotator.backupFile(file);

        assertEquals("current", Files.readString(BackupRotator.backupPath(file, 1)));
        assertEquals("b1", Files.readString(BackupRotator.backupPath(file, 2)));
        assertEquals("b2", Files.readString(BackupRotator.backupPath(file, 3)));
        assertFalse(Files.exists(BackupRotator.backupPath(file, 4)));
    }

    @Test
    void testDefaultKeepsTen() throws Exception {
        for (int i = 1; i <= 12; i++) {
            Files.writeString(file, "v" + i);
            rotator.backupFile(file);
        }

        assertEquals("v12", Files.readString(BackupRotator.backupPath(file, 1)));
        assertEquals("v3", Files.readString(BackupRotator.backupPath(file, 10)));
        assertFalse(Files.exists(BackupRotator.backupPath(file, 11)));
    }

    @Test
    void testMissingFileIsIgnored() {
        assertDoesNotThrow(() -> rotator.backupFile(file));
        assertFalse(Files.exists(BackupRotator.backupPath(file, 1)));
    }
}
