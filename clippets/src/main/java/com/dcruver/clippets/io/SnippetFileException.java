package com.dcruver.clippets.io;

import java.io.IOException;

/**
 * A snippet file could not be read, or did not describe a usable tree.
 */
public class SnippetFileException extends IOException {

    public SnippetFileException(String message) {
        super(message);
    }

    public SnippetFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
