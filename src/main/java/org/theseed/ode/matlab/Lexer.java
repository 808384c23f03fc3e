/**
 *
 */
package org.theseed.ode.matlab;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class converts the cleaned text of a MATLAB source file into tokens.  The
 * comment and continuation pre-pass has already been done by the {@link SourceText}.
 *
 * The lexer is aware of bracket nesting.  Inside parentheses, a line break is just white
 * space; inside square brackets it separates matrix rows and is passed to the parser.
 * A single quote is a transpose operator when it directly follows something that has a
 * value (a name, a number, a closing bracket, or another transpose); otherwise it
 * starts a string.  Inside a matrix, a quote preceded by white space always starts a
 * string, so that "[a 'b']" is a two-element row.
 */
public class Lexer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(Lexer.class);
    /** source being tokenized */
    private final SourceText source;
    /** cleaned text */
    private final String text;
    /** current position in the text */
    private int pos;
    /** current cleaned line number (1-based) */
    private int line;
    /** position of the start of the current line */
    private int lineStart;
    /** TRUE if white space was seen since the last token */
    private boolean spaceBefore;
    /** stack of open bracket characters */
    private final Deque<Character> brackets;
    /** output token list */
    private final List<Token> tokens;
    /** keyword table */
    private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();
    /** token types after which a quote is a transpose */
    private static final Set<TokenType> VALUE_ENDS = EnumSet.of(TokenType.IDENTIFIER, TokenType.NUMBER,
            TokenType.RPAREN, TokenType.RBRACKET, TokenType.RBRACE, TokenType.TRANSPOSE,
            TokenType.DOT_TRANSPOSE, TokenType.END);

    static {
        KEYWORDS.put("function", TokenType.FUNCTION);
        KEYWORDS.put("end", TokenType.END);
        KEYWORDS.put("endfunction", TokenType.END);
        KEYWORDS.put("endif", TokenType.END);
        KEYWORDS.put("endfor", TokenType.END);
        KEYWORDS.put("endwhile", TokenType.END);
        KEYWORDS.put("endswitch", TokenType.END);
        KEYWORDS.put("end_try_catch", TokenType.END);
        KEYWORDS.put("if", TokenType.IF);
        KEYWORDS.put("elseif", TokenType.ELSEIF);
        KEYWORDS.put("else", TokenType.ELSE);
        KEYWORDS.put("for", TokenType.FOR);
        KEYWORDS.put("parfor", TokenType.FOR);
        KEYWORDS.put("while", TokenType.WHILE);
        KEYWORDS.put("do", TokenType.WHILE);
        KEYWORDS.put("switch", TokenType.SWITCH);
        KEYWORDS.put("case", TokenType.CASE);
        KEYWORDS.put("otherwise", TokenType.OTHERWISE);
        KEYWORDS.put("try", TokenType.TRY);
        KEYWORDS.put("catch", TokenType.CATCH);
        KEYWORDS.put("return", TokenType.RETURN);
        KEYWORDS.put("break", TokenType.BREAK);
        KEYWORDS.put("continue", TokenType.CONTINUE);
        KEYWORDS.put("global", TokenType.GLOBAL);
        KEYWORDS.put("persistent", TokenType.PERSISTENT);
        KEYWORDS.put("classdef", TokenType.CLASSDEF);
    }

    /**
     * Construct a lexer for a source text.
     *
     * @param source	source text to tokenize
     */
    public Lexer(SourceText source) {
        this.source = source;
        this.text = source.getCleanText();
        this.brackets = new ArrayDeque<Character>();
        this.tokens = new ArrayList<Token>();
    }

    /**
     * Convert the source text into a token list.  The list always ends with an EOF token.
     *
     * @return the list of tokens
     *
     * @throws MatlabSyntaxException
     */
    public List<Token> tokenize() throws MatlabSyntaxException {
        this.pos = 0;
        this.line = 1;
        this.lineStart = 0;
        this.spaceBefore = false;
        this.brackets.clear();
        this.tokens.clear();
        while (this.pos < this.text.length()) {
            char c = this.peek();
            if (c == '\n') {
                // Line breaks inside parentheses are white space.
                if (! this.brackets.isEmpty() && this.brackets.peek() == '(')
                    this.spaceBefore = true;
                else
                    this.addToken(TokenType.NEWLINE, "\n", this.pos);
                this.advance();
                this.line++;
                this.lineStart = this.pos;
            } else if (Character.isWhitespace(c)) {
                this.spaceBefore = true;
                this.advance();
            } else if (Character.isLetter(c))
                this.scanWord();
            else if (Character.isDigit(c) || (c == '.' && Character.isDigit(this.peekNext())))
                this.scanNumber();
            else if (c == '"')
                this.scanString('"');
            else if (c == '\'' && this.quoteStartsString())
                this.scanString('\'');
            else
                this.scanOperator();
        }
        this.addToken(TokenType.EOF, "", this.pos);
        log.debug("{} tokens found in {}.", this.tokens.size(), this.source.getName());
        return this.tokens;
    }

    /**
     * @return TRUE if a single quote at the current position starts a string
     */
    private boolean quoteStartsString() {
        boolean retVal;
        Token prev = this.lastToken();
        if (prev == null || prev.is(TokenType.NEWLINE) || ! VALUE_ENDS.contains(prev.getType()))
            retVal = true;
        else
            retVal = (this.spaceBefore && this.inMatrix());
        return retVal;
    }

    /**
     * @return TRUE if the innermost open bracket is a matrix or cell bracket
     */
    private boolean inMatrix() {
        return (! this.brackets.isEmpty() && this.brackets.peek() != '(');
    }

    /**
     * @return the most recent token, or NULL if there is none
     */
    private Token lastToken() {
        Token retVal = null;
        if (! this.tokens.isEmpty())
            retVal = this.tokens.get(this.tokens.size() - 1);
        return retVal;
    }

    /**
     * Scan an identifier or keyword.
     */
    private void scanWord() {
        int start = this.pos;
        while (this.pos < this.text.length() && isWordChar(this.peek()))
            this.advance();
        String word = this.text.substring(start, this.pos);
        TokenType type = KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER);
        this.addToken(type, word, start);
    }

    /**
     * @return TRUE if the specified character can occur inside an identifier
     *
     * @param c		character to check
     */
    private static boolean isWordChar(char c) {
        return (Character.isLetterOrDigit(c) || c == '_');
    }

    /**
     * Scan a numeric literal.
     *
     * @throws MatlabSyntaxException
     */
    private void scanNumber() throws MatlabSyntaxException {
        int start = this.pos;
        while (Character.isDigit(this.peek()))
            this.advance();
        if (this.peek() == '.') {
            // A dot followed by an operator character belongs to an element-wise operator.
            char next = this.peekNext();
            if (next != '*' && next != '/' && next != '\\' && next != '^' && next != '\'') {
                this.advance();
                while (Character.isDigit(this.peek()))
                    this.advance();
            }
        }
        char e = this.peek();
        if (e == 'e' || e == 'E' || e == 'd' || e == 'D') {
            int mark = this.pos;
            this.advance();
            if (this.peek() == '+' || this.peek() == '-')
                this.advance();
            if (Character.isDigit(this.peek())) {
                while (Character.isDigit(this.peek()))
                    this.advance();
            } else
                this.pos = mark;
        }
        char suffix = this.peek();
        if ((suffix == 'i' || suffix == 'j' || suffix == 'I' || suffix == 'J') && ! isWordChar(this.peekNext()))
            throw this.error(MatlabSyntaxException.Kind.UNSUPPORTED_CONSTRUCT, "complex number literals are not supported",
                    start);
        if (isWordChar(suffix))
            throw this.error(MatlabSyntaxException.Kind.SYNTAX, "malformed number", start);
        this.addToken(TokenType.NUMBER, this.text.substring(start, this.pos), start);
    }

    /**
     * Scan a string literal.  A doubled delimiter inside the string stands for a single one.
     *
     * @param delim		delimiter character
     *
     * @throws MatlabSyntaxException
     */
    private void scanString(char delim) throws MatlabSyntaxException {
        int start = this.pos;
        this.advance();
        StringBuilder value = new StringBuilder();
        boolean closed = false;
        while (! closed) {
            if (this.pos >= this.text.length() || this.peek() == '\n')
                throw this.error(MatlabSyntaxException.Kind.SYNTAX, "unterminated string", start);
            char c = this.peek();
            this.advance();
            if (c == delim) {
                if (this.peek() == delim) {
                    value.append(delim);
                    this.advance();
                } else
                    closed = true;
            } else
                value.append(c);
        }
        this.addToken(TokenType.STRING, value.toString(), start);
    }

    /**
     * Scan an operator or punctuation mark.
     *
     * @throws MatlabSyntaxException
     */
    private void scanOperator() throws MatlabSyntaxException {
        int start = this.pos;
        char c = this.peek();
        char next = this.peekNext();
        TokenType type = null;
        int length = 2;
        switch (c) {
        case '.' :
            switch (next) {
            case '*' :
                type = TokenType.ELEM_TIMES;
                break;
            case '/' :
                type = TokenType.ELEM_DIVIDE;
                break;
            case '\\' :
                type = TokenType.ELEM_LEFT_DIVIDE;
                break;
            case '^' :
                type = TokenType.ELEM_POWER;
                break;
            case '\'' :
                type = TokenType.DOT_TRANSPOSE;
                break;
            default :
                type = TokenType.DOT;
                length = 1;
            }
            break;
        case '=' :
            if (next == '=')
                type = TokenType.EQUAL;
            else {
                type = TokenType.ASSIGN;
                length = 1;
            }
            break;
        case '~' :
        case '!' :
            if (next == '=')
                type = TokenType.NOT_EQUAL;
            else {
                type = TokenType.NOT;
                length = 1;
            }
            break;
        case '<' :
            if (next == '=')
                type = TokenType.LESS_EQUAL;
            else {
                type = TokenType.LESS;
                length = 1;
            }
            break;
        case '>' :
            if (next == '=')
                type = TokenType.GREATER_EQUAL;
            else {
                type = TokenType.GREATER;
                length = 1;
            }
            break;
        case '&' :
            if (next == '&')
                type = TokenType.AND_AND;
            else {
                type = TokenType.AND;
                length = 1;
            }
            break;
        case '|' :
            if (next == '|')
                type = TokenType.OR_OR;
            else {
                type = TokenType.OR;
                length = 1;
            }
            break;
        default :
            length = 1;
            type = singleCharType(c);
        }
        if (type == null)
            throw this.error(MatlabSyntaxException.Kind.SYNTAX, "unexpected character '" + c + "'", start);
        // Maintain the bracket stack.
        switch (type) {
        case LPAREN :
            this.brackets.push('(');
            break;
        case LBRACKET :
            this.brackets.push('[');
            break;
        case LBRACE :
            this.brackets.push('{');
            break;
        case RPAREN :
        case RBRACKET :
        case RBRACE :
            if (! this.brackets.isEmpty())
                this.brackets.pop();
            break;
        default :
        }
        this.pos += length;
        this.addToken(type, this.text.substring(start, this.pos), start);
    }

    /**
     * @return the token type for a single-character operator, or NULL if the character is invalid
     *
     * @param c		character to check
     */
    private static TokenType singleCharType(char c) {
        TokenType retVal;
        switch (c) {
        case '+' :
            retVal = TokenType.PLUS;
            break;
        case '-' :
            retVal = TokenType.MINUS;
            break;
        case '*' :
            retVal = TokenType.TIMES;
            break;
        case '/' :
            retVal = TokenType.DIVIDE;
            break;
        case '\\' :
            retVal = TokenType.LEFT_DIVIDE;
            break;
        case '^' :
            retVal = TokenType.POWER;
            break;
        case '\'' :
            retVal = TokenType.TRANSPOSE;
            break;
        case ':' :
            retVal = TokenType.COLON;
            break;
        case ',' :
            retVal = TokenType.COMMA;
            break;
        case ';' :
            retVal = TokenType.SEMICOLON;
            break;
        case '(' :
            retVal = TokenType.LPAREN;
            break;
        case ')' :
            retVal = TokenType.RPAREN;
            break;
        case '[' :
            retVal = TokenType.LBRACKET;
            break;
        case ']' :
            retVal = TokenType.RBRACKET;
            break;
        case '{' :
            retVal = TokenType.LBRACE;
            break;
        case '}' :
            retVal = TokenType.RBRACE;
            break;
        case '@' :
            retVal = TokenType.AT;
            break;
        default :
            retVal = null;
        }
        return retVal;
    }

    /**
     * Add a token to the output list.
     *
     * @param type		token type
     * @param text		token text
     * @param start		starting position of the token in the cleaned text
     */
    private void addToken(TokenType type, String text, int start) {
        int column = start - this.lineStart + 1;
        this.tokens.add(new Token(type, text, this.source.originalLine(this.line), column, this.spaceBefore));
        this.spaceBefore = false;
    }

    /**
     * @return a syntax exception for a problem at the specified position
     *
     * @param kind		type of error
     * @param detail	description of the problem
     * @param start		position of the offending text
     */
    private MatlabSyntaxException error(MatlabSyntaxException.Kind kind, String detail, int start) {
        int origLine = this.source.originalLine(this.line);
        return new MatlabSyntaxException(kind, detail, origLine, start - this.lineStart + 1,
                this.source.quote(origLine));
    }

    /**
     * @return the current character, or a NUL if we are at the end
     */
    private char peek() {
        return (this.pos < this.text.length() ? this.text.charAt(this.pos) : '\0');
    }

    /**
     * @return the character after the current one, or a NUL if there is none
     */
    private char peekNext() {
        return (this.pos + 1 < this.text.length() ? this.text.charAt(this.pos + 1) : '\0');
    }

    /**
     * Move to the next character.
     */
    private void advance() {
        this.pos++;
    }

}
