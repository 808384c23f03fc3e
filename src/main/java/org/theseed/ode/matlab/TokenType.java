package org.theseed.ode.matlab;

/**
 * This enumeration lists the token types of the supported MATLAB subset.
 */
public enum TokenType {
    // literals and names
    IDENTIFIER("identifier"), NUMBER("number"), STRING("string"),
    // keywords
    FUNCTION("function"), END("end"), IF("if"), ELSEIF("elseif"), ELSE("else"), FOR("for"),
    WHILE("while"), SWITCH("switch"), CASE("case"), OTHERWISE("otherwise"), TRY("try"),
    CATCH("catch"), RETURN("return"), BREAK("break"), CONTINUE("continue"), GLOBAL("global"),
    PERSISTENT("persistent"), CLASSDEF("classdef"),
    // arithmetic operators
    PLUS("+"), MINUS("-"), TIMES("*"), DIVIDE("/"), LEFT_DIVIDE("\\"), POWER("^"),
    ELEM_TIMES(".*"), ELEM_DIVIDE("./"), ELEM_LEFT_DIVIDE(".\\"), ELEM_POWER(".^"),
    TRANSPOSE("'"), DOT_TRANSPOSE(".'"),
    // relational and logical operators
    EQUAL("=="), NOT_EQUAL("~="), LESS("<"), LESS_EQUAL("<="), GREATER(">"), GREATER_EQUAL(">="),
    AND("&"), OR("|"), AND_AND("&&"), OR_OR("||"), NOT("~"),
    // punctuation
    ASSIGN("="), COLON(":"), COMMA(","), SEMICOLON(";"), NEWLINE("end of line"),
    LPAREN("("), RPAREN(")"), LBRACKET("["), RBRACKET("]"), LBRACE("{"), RBRACE("}"),
    AT("@"), DOT("."), EOF("end of file");

    /** display text for error messages */
    private final String display;

    private TokenType(String display) {
        this.display = display;
    }

    /**
     * @return the display text for this token type
     */
    public String getDisplay() {
        return this.display;
    }

    /**
     * @return TRUE if this token type ends a statement
     */
    public boolean isTerminator() {
        return (this == COMMA || this == SEMICOLON || this == NEWLINE || this == EOF);
    }

}
