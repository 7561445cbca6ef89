package org.dxworks.scoreframe.lilypond.model;

/**
 * {@code key = value} inside \header, \with, \layout or \midi. The value is kept as written,
 * strings with their quotes.
 */
public class Assignment {
    public String key;
    public String value;

    public Assignment(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public static Assignment quoted(String key, String text) {
        return new Assignment(key, quote(text));
    }

    public boolean isQuoted() {
        return value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"");
    }

    /**
     * The string content for quoted values, the raw value otherwise.
     */
    public String text() {
        if (!isQuoted()) {
            return value;
        }
        return value.substring(1, value.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
    }

    public static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
