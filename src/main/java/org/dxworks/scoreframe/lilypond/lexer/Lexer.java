package org.dxworks.scoreframe.lilypond.lexer;

import org.dxworks.scoreframe.lilypond.parser.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns LilyPond source into a flat token list. Whitespace and comments are dropped; every token keeps
 * the offset it started at.
 */
public final class Lexer {

    private final String source;
    private int pos;

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() throws ParseException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() throws ParseException {
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isLetter(c)) {
            return word(start);
        }
        if (Character.isDigit(c)) {
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            return new Token(TokenType.NUMBER, source.substring(start, pos), start);
        }
        switch (c) {
            case '\\':
                return backslash(start);
            case '"':
                return string(start);
            case '#':
                return scheme(start);
            case '<':
                if (peekAt(1) == '<') {
                    pos += 2;
                    return new Token(TokenType.DOUBLE_ANGLE_OPEN, "<<", start);
                }
                return single(TokenType.ANGLE_OPEN, start);
            case '>':
                if (peekAt(1) == '>') {
                    pos += 2;
                    return new Token(TokenType.DOUBLE_ANGLE_CLOSE, ">>", start);
                }
                return single(TokenType.ANGLE_CLOSE, start);
            case '{': return single(TokenType.OPEN_BRACE, start);
            case '}': return single(TokenType.CLOSE_BRACE, start);
            case '[': return single(TokenType.OPEN_BRACKET, start);
            case ']': return single(TokenType.CLOSE_BRACKET, start);
            case '(': return single(TokenType.OPEN_PAREN, start);
            case ')': return single(TokenType.CLOSE_PAREN, start);
            case '~': return single(TokenType.TILDE, start);
            case '|': return single(TokenType.PIPE, start);
            case '=': return single(TokenType.EQUALS, start);
            case '.': return single(TokenType.DOT, start);
            case '\'': return single(TokenType.APOSTROPHE, start);
            case ',': return single(TokenType.COMMA, start);
            case '!': return single(TokenType.EXCLAMATION, start);
            case '?': return single(TokenType.QUESTION, start);
            case '-': return single(TokenType.DASH, start);
            case '^': return single(TokenType.CARET, start);
            case '_': return single(TokenType.UNDERSCORE, start);
            case '+': return single(TokenType.PLUS, start);
            case ':': return single(TokenType.COLON, start);
            case '/': return single(TokenType.SLASH, start);
            case '*': return single(TokenType.STAR, start);
            default:
                throw new ParseException(source, start, "a token", "'" + c + "'");
        }
    }

    private Token word(int start) {
        while (pos < source.length() && Character.isLetter(source.charAt(pos))) pos++;
        String text = source.substring(start, pos);
        TokenType type = NoteNames.isNoteName(text) ? TokenType.NOTE_NAME : TokenType.WORD;
        return new Token(type, text, start);
    }

    private Token backslash(int start) throws ParseException {
        char c = peekAt(1);
        switch (c) {
            case '\\':
                pos += 2;
                return new Token(TokenType.DOUBLE_BACKSLASH, "\\\\", start);
            case '(':
                pos += 2;
                return new Token(TokenType.PHRASING_OPEN, "\\(", start);
            case ')':
                pos += 2;
                return new Token(TokenType.PHRASING_CLOSE, "\\)", start);
            case '<':
                pos += 2;
                return new Token(TokenType.CRESCENDO, "\\<", start);
            case '>':
                pos += 2;
                return new Token(TokenType.DECRESCENDO, "\\>", start);
            case '!':
                pos += 2;
                return new Token(TokenType.HAIRPIN_END, "\\!", start);
            default:
                break;
        }
        if (Character.isDigit(c)) {
            pos++;
            int digitsStart = pos;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            return new Token(TokenType.ESCAPED_NUMBER, source.substring(digitsStart, pos), start);
        }
        if (Character.isLetter(c)) {
            pos++;
            int nameStart = pos;
            while (pos < source.length()) {
                char ch = source.charAt(pos);
                if (Character.isLetter(ch)) {
                    pos++;
                } else if (ch == '-' && pos + 1 < source.length() && Character.isLetter(source.charAt(pos + 1))) {
                    // markup commands like \column-lines
                    pos++;
                } else {
                    break;
                }
            }
            return new Token(TokenType.COMMAND, source.substring(nameStart, pos), start);
        }
        throw new ParseException(source, start, "a command name after '\\'",
                pos + 1 < source.length() ? "'" + c + "'" : "end of input");
    }

    private Token string(int start) throws ParseException {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char escaped = source.charAt(pos + 1);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw new ParseException(source, start, "closing '\"'", "end of input");
    }

    /**
     * Scheme values are kept as raw text: {@code #t}, {@code #'sym}, {@code #"str"}, {@code #(...)}.
     */
    private Token scheme(int start) throws ParseException {
        pos++;
        if (pos < source.length() && source.charAt(pos) == '\'') pos++;
        if (pos < source.length() && source.charAt(pos) == '(') {
            int depth = 0;
            while (pos < source.length()) {
                char c = source.charAt(pos++);
                if (c == '(') depth++;
                else if (c == ')' && --depth == 0) {
                    return new Token(TokenType.SCHEME, source.substring(start, pos), start);
                }
            }
            throw new ParseException(source, start, "closing ')' of Scheme expression", "end of input");
        }
        if (pos < source.length() && source.charAt(pos) == '"') {
            string(pos);
            return new Token(TokenType.SCHEME, source.substring(start, pos), start);
        }
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == '}' || c == '{' || c == ')') break;
            pos++;
        }
        if (pos == start + 1) {
            throw new ParseException(source, start, "a Scheme value after '#'", "'#'");
        }
        return new Token(TokenType.SCHEME, source.substring(start, pos), start);
    }

    private void skipWhitespaceAndComments() throws ParseException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '%') {
                if (peekAt(1) == '{') {
                    int start = pos;
                    int end = source.indexOf("%}", pos + 2);
                    if (end < 0) {
                        throw new ParseException(source, start, "closing '%}'", "end of input");
                    }
                    pos = end + 2;
                } else {
                    while (pos < source.length() && source.charAt(pos) != '\n') pos++;
                }
            } else {
                return;
            }
        }
    }

    private Token single(TokenType type, int start) {
        pos++;
        return new Token(type, source.substring(start, pos), start);
    }

    private char peekAt(int ahead) {
        int i = pos + ahead;
        return i < source.length() ? source.charAt(i) : '\0';
    }
}
