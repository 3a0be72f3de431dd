package com.dcruver.clippets.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Line level text helpers shared by the textual elements.
 */
public final class TextBlocks {

    private static final int TAB_SIZE = 8;

    private TextBlocks() {
    }

    /**
     * Replace tabs with spaces, using tab stops every eight columns.
     */
    public static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length() + TAB_SIZE);
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int pad = TAB_SIZE - (column % TAB_SIZE);
                sb.append(" ".repeat(pad));
                column += pad;
            } else {
                sb.append(c);
                column = (c == '\n' || c == '\r') ? 0 : column + 1;
            }
        }
        return sb.toString();
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    /**
     * Remove the whitespace prefix common to every non-blank line.
     * Blank lines come back empty.
     */
    public static List<String> dedent(List<String> lines) {
        String margin = null;
        for (String line : lines) {
            if (isBlank(line)) {
                continue;
            }
            String indent = leadingWhitespace(line);
            if (margin == null) {
                margin = indent;
            } else {
                margin = commonPrefix(margin, indent);
            }
        }

        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (isBlank(line)) {
                result.add("");
            } else if (margin != null) {
                result.add(line.substring(margin.length()));
            } else {
                result.add(line);
            }
        }
        return result;
    }

    public static String dedent(String text) {
        return String.join("\n", dedent(text.lines().toList()));
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    private static String commonPrefix(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return a.substring(0, i);
    }
}
