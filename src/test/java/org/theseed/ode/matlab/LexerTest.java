/**
 *
 */
package org.theseed.ode.matlab;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

/**
 * Tests for the MATLAB lexer and parser.
 */
public class LexerTest {

    /**
     * @return the token types for a string of source text
     *
     * @param text		source text to tokenize
     *
     * @throws MatlabSyntaxException
     */
    private static List<TokenType> types(String text) throws MatlabSyntaxException {
        SourceText source = new SourceText("test", text);
        List<Token> tokens = new Lexer(source).tokenize();
        return tokens.stream().map(x -> x.getType()).collect(Collectors.toList());
    }

    @Test
    public void testQuotes() throws MatlabSyntaxException {
        List<TokenType> found = types("y = x';");
        assertThat(found, contains(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.IDENTIFIER,
                TokenType.TRANSPOSE, TokenType.SEMICOLON, TokenType.EOF));
        found = types("s = 'abc';");
        assertThat(found, hasItem(TokenType.STRING));
        assertThat(found, not(hasItem(TokenType.TRANSPOSE)));
        found = types("m = [a' 'b'];");
        assertThat(found, contains(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.LBRACKET, TokenType.IDENTIFIER,
                TokenType.TRANSPOSE, TokenType.STRING, TokenType.RBRACKET, TokenType.SEMICOLON, TokenType.EOF));
    }

    @Test
    public void testComments() throws MatlabSyntaxException {
        List<TokenType> found = types("% comment\nk = 1; # another\n");
        assertThat(found, contains(TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER,
                TokenType.SEMICOLON, TokenType.NEWLINE, TokenType.EOF));
        SourceText source = new SourceText("test", "%{\nblock\n%}\nk = 1;\n");
        List<Token> tokens = new Lexer(source).tokenize();
        Token k = tokens.stream().filter(x -> x.is(TokenType.IDENTIFIER)).findFirst().get();
        assertThat(k.getText(), equalTo("k"));
        assertThat(k.getLine(), equalTo(4));
    }

    @Test
    public void testErrors() {
        var e = assertThrows(MatlabSyntaxException.class, () -> types("z = 3i;"));
        assertThat(e.getKind(), equalTo(MatlabSyntaxException.Kind.UNSUPPORTED_CONSTRUCT));
        e = assertThrows(MatlabSyntaxException.class, () -> MatlabParser.parse(SourceText.read(new File("data", "cells.m"))));
        assertThat(e.getKind(), equalTo(MatlabSyntaxException.Kind.UNSUPPORTED_CONSTRUCT));
        assertThat(e.getLine(), equalTo(2));
        assertThat(e.getMessage(), containsString("cell arrays"));
        e = assertThrows(MatlabSyntaxException.class, () -> MatlabParser.parse(new SourceText("bad", "x = (1 + ;\n")));
        assertThat(e.getKind(), equalTo(MatlabSyntaxException.Kind.SYNTAX));
    }

    @Test
    public void testParse() throws IOException, MatlabSyntaxException {
        SourceText source = SourceText.read(new File("data", "bimolecular.m"));
        assertThat(source.getName(), equalTo("bimolecular"));
        String tree1 = ParseTreePrinter.print(MatlabParser.parse(source));
        String tree2 = ParseTreePrinter.print(MatlabParser.parse(source));
        assertThat(tree1, equalTo(tree2));
        assertThat(tree1, startsWith("script bimolecular"));
        assertThat(tree1, containsString("rates"));
    }

}
