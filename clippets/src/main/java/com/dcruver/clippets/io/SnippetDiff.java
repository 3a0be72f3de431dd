package com.dcruver.clippets.io;

import com.dcruver.clippets.config.ClippetsProperties;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Unified diffs between two renderings of a snippet file.
 */
@Component
@RequiredArgsConstructor
public class SnippetDiff {

    private final ClippetsProperties properties;

    /**
     * Generate a unified diff, or an empty string when nothing changed.
     */
    public String generateDiff(String original, String revised, String fileName) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "saved/" + fileName,
            "edited/" + fileName,
            originalLines,
            patch,
            properties.getDiffContext()
        );
        return String.join("\n", unifiedDiff);
    }
}
