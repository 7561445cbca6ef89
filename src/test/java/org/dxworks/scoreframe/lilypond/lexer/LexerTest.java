package org.dxworks.scoreframe.lilypond.lexer;

import org.dxworks.scoreframe.lilypond.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) throws ParseException {
        return new Lexer(source).tokenize().stream().map(t -> t.type).collect(Collectors.toList());
    }

    @Test
    void noteWithOctaveDurationAndScript() throws ParseException {
        List<Token> tokens = new Lexer("cis'4.-. \\f").tokenize();

        assertEquals(List.of(TokenType.NOTE_NAME, TokenType.APOSTROPHE, TokenType.NUMBER, TokenType.DOT,
                TokenType.DASH, TokenType.DOT, TokenType.COMMAND, TokenType.EOF),
                tokens.stream().map(t -> t.type).collect(Collectors.toList()));
        assertEquals("cis", tokens.get(0).text);
        assertEquals("f", tokens.get(6).text);
        assertEquals(9, tokens.get(6).offset);
        assertEquals(11, tokens.get(7).offset);
    }

    @Test
    void wordsThatAreNotNoteNames() throws ParseException {
        List<Token> tokens = new Lexer("r s q cas as x").tokenize();

        assertEquals(TokenType.WORD, tokens.get(0).type);
        assertEquals(TokenType.WORD, tokens.get(1).type);
        assertEquals(TokenType.WORD, tokens.get(2).type);
        assertEquals(TokenType.WORD, tokens.get(3).type);
        assertEquals(TokenType.NOTE_NAME, tokens.get(4).type);
        assertEquals(TokenType.WORD, tokens.get(5).type);
    }

    @Test
    void commentsAreSkipped() throws ParseException {
        assertEquals(List.of(TokenType.NOTE_NAME, TokenType.NOTE_NAME, TokenType.EOF),
                types("c % line comment\n%{ block\ncomment %} d"));
    }

    @Test
    void unterminatedBlockCommentFails() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("c %{ open").tokenize());
        assertEquals(2, e.getPosition());
        assertEquals("closing '%}'", e.getExpected());
    }

    @Test
    void backslashTokens() throws ParseException {
        assertEquals(List.of(TokenType.DOUBLE_BACKSLASH, TokenType.PHRASING_OPEN, TokenType.PHRASING_CLOSE,
                TokenType.CRESCENDO, TokenType.DECRESCENDO, TokenType.HAIRPIN_END, TokenType.ESCAPED_NUMBER,
                TokenType.COMMAND, TokenType.EOF),
                types("\\\\ \\( \\) \\< \\> \\! \\3 \\column-lines"));
    }

    @Test
    void escapedNumberKeepsOnlyTheDigits() throws ParseException {
        Token token = new Lexer("\\12").tokenize().get(0);
        assertEquals(TokenType.ESCAPED_NUMBER, token.type);
        assertEquals("12", token.text);
        assertEquals("'\\12'", token.describe());
    }

    @Test
    void hyphenatedMarkupCommand() throws ParseException {
        Token token = new Lexer("\\column-lines { }").tokenize().get(0);
        assertEquals("column-lines", token.text);
    }

    @Test
    void stringsResolveEscapes() throws ParseException {
        Token token = new Lexer("\"say \\\"hi\\\"\"").tokenize().get(0);
        assertEquals(TokenType.STRING, token.type);
        assertEquals("say \"hi\"", token.text);
    }

    @Test
    void unterminatedStringFails() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("c \"open").tokenize());
        assertEquals(2, e.getPosition());
        assertEquals("end of input", e.getFound());
    }

    @Test
    void schemeValuesAreKeptRaw() throws ParseException {
        List<Token> tokens = new Lexer("##f #'sym #(set-octavation 1) #\"str\" #-2}").tokenize();

        assertEquals("##f", tokens.get(0).text);
        assertEquals("#'sym", tokens.get(1).text);
        assertEquals("#(set-octavation 1)", tokens.get(2).text);
        assertEquals("#\"str\"", tokens.get(3).text);
        assertEquals("#-2", tokens.get(4).text);
        assertEquals(TokenType.CLOSE_BRACE, tokens.get(5).type);
    }

    @Test
    void unbalancedSchemeExpressionFails() {
        assertThrows(ParseException.class, () -> new Lexer("#(a (b)").tokenize());
    }

    @Test
    void unknownCharacterFails() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("c4 @").tokenize());
        assertEquals(3, e.getPosition());
        assertEquals("'@'", e.getFound());
    }
}
