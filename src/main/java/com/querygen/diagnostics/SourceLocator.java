package com.querygen.diagnostics;

import java.nio.charset.StandardCharsets;

/**
 * Maps a byte offset in a module's source text to a 1-based line/column and the
 * text of the containing line.
 */
public final class SourceLocator {

    private SourceLocator() {
    }

    public record Location(int line, int column, String lineText) {
    }

    /**
     * Offsets beyond the end of the source are clamped to the end.
     */
    public static Location locate(String source, int byteOffset) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        int pos = Math.max(0, Math.min(byteOffset, bytes.length));

        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < pos; i++) {
            if (bytes[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }

        // Column counts characters, not bytes
        String beforeCursor = new String(bytes, lineStart, pos - lineStart, StandardCharsets.UTF_8);
        int column = beforeCursor.codePointCount(0, beforeCursor.length()) + 1;

        int lineEnd = lineStart;
        while (lineEnd < bytes.length && bytes[lineEnd] != '\n') {
            lineEnd++;
        }
        String lineText = new String(bytes, lineStart, lineEnd - lineStart, StandardCharsets.UTF_8);
        if (lineText.endsWith("\r")) {
            lineText = lineText.substring(0, lineText.length() - 1);
        }

        return new Location(line, column, lineText);
    }
}
