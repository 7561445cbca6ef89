package org.dxworks.scoreframe.lilypond.parser;

/**
 * Structural error in LilyPond source. Parsing stops at the first one; there is never a partial tree.
 */
public class ParseException extends Exception {
    private final int position;
    private final int line;
    private final int column;
    private final String expected;
    private final String found;

    public ParseException(String source, int position, String expected, String found) {
        super(describe(source, position, expected, found));
        this.position = position;
        this.line = lineOf(source, position);
        this.column = columnOf(source, position);
        this.expected = expected;
        this.found = found;
    }

    /**
     * Character offset into the source.
     */
    public int getPosition() {
        return position;
    }

    /**
     * 1-based.
     */
    public int getLine() {
        return line;
    }

    /**
     * 1-based.
     */
    public int getColumn() {
        return column;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    private static String describe(String source, int position, String expected, String found) {
        return "Parse error at line " + lineOf(source, position) + ", column " + columnOf(source, position)
                + " (offset " + position + "): expected " + expected + ", found " + found;
    }

    private static int lineOf(String source, int position) {
        int line = 1;
        int end = Math.min(position, source.length());
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') line++;
        }
        return line;
    }

    private static int columnOf(String source, int position) {
        int end = Math.min(position, source.length());
        int lineStart = source.lastIndexOf('\n', end - 1) + 1;
        return end - lineStart + 1;
    }
}
