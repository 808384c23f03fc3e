/**
 *
 */
package org.theseed.ode.matlab;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.matlab.ast.AnonymousFunctionNode;
import org.theseed.ode.matlab.ast.AssignmentNode;
import org.theseed.ode.matlab.ast.BinaryNode;
import org.theseed.ode.matlab.ast.BinaryOperator;
import org.theseed.ode.matlab.ast.CallNode;
import org.theseed.ode.matlab.ast.ColonNode;
import org.theseed.ode.matlab.ast.CommandNode;
import org.theseed.ode.matlab.ast.Expression;
import org.theseed.ode.matlab.ast.ExpressionStatementNode;
import org.theseed.ode.matlab.ast.ForNode;
import org.theseed.ode.matlab.ast.FunctionDefinitionNode;
import org.theseed.ode.matlab.ast.FunctionHandleNode;
import org.theseed.ode.matlab.ast.IdentifierNode;
import org.theseed.ode.matlab.ast.IfNode;
import org.theseed.ode.matlab.ast.MatrixNode;
import org.theseed.ode.matlab.ast.NumberNode;
import org.theseed.ode.matlab.ast.RangeNode;
import org.theseed.ode.matlab.ast.ScriptNode;
import org.theseed.ode.matlab.ast.Statement;
import org.theseed.ode.matlab.ast.StringNode;
import org.theseed.ode.matlab.ast.UnaryNode;
import org.theseed.ode.matlab.ast.UnaryOperator;

/**
 * This is a recursive-descent parser for the supported MATLAB subset.  It consumes the
 * token list produced by the {@link Lexer} and builds a {@link ScriptNode}.
 *
 * Operator precedence, from lowest to highest, is
 *
 * 	||
 * 	&&
 * 	|
 * 	&
 * 	relational (== ~= < <= > >=)
 * 	range (:)
 * 	additive (+ -)
 * 	multiplicative (* / \ .* ./ .\)
 * 	prefix unary (- + ~)
 * 	power (^ .^), right-associative, with an optional sign on the exponent
 * 	postfix (transposes)
 *
 * Inside square brackets, white space separates elements, so "[a -b]" is a two-element
 * row while "[a - b]" and "[a-b]" each have one element.  The parser keeps a stack of
 * bracket contexts to know when this rule applies.
 *
 * Constructs outside the subset produce a {@link MatlabSyntaxException} of kind
 * UNSUPPORTED_CONSTRUCT that names the construct.
 */
public class MatlabParser {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MatlabParser.class);
    /** source being parsed */
    private final SourceText source;
    /** token list */
    private List<Token> tokens;
    /** index of the current token */
    private int current;
    /** bracket context stack:  TRUE for a matrix, FALSE for parentheses */
    private final Deque<Boolean> contexts;
    /** number of function definitions parsed */
    private int functionCount;
    /** names of string formatting functions */
    private static final Set<String> FORMAT_FUNCTIONS = Set.of("sprintf", "fprintf", "printf",
            "num2str", "mat2str", "int2str");
    /** statement keywords that are not supported */
    private static final Set<TokenType> UNSUPPORTED_KEYWORDS = EnumSet.of(TokenType.WHILE, TokenType.SWITCH,
            TokenType.CASE, TokenType.OTHERWISE, TokenType.TRY, TokenType.CATCH, TokenType.RETURN,
            TokenType.BREAK, TokenType.CONTINUE, TokenType.GLOBAL, TokenType.PERSISTENT, TokenType.CLASSDEF);
    /** tokens that end a function body */
    private static final Set<TokenType> FUNCTION_ENDS = EnumSet.of(TokenType.END, TokenType.FUNCTION,
            TokenType.EOF);
    /** tokens that end an if-branch */
    private static final Set<TokenType> BRANCH_ENDS = EnumSet.of(TokenType.ELSEIF, TokenType.ELSE,
            TokenType.END);
    /** tokens that end a simple block */
    private static final Set<TokenType> BLOCK_ENDS = EnumSet.of(TokenType.END);

    /**
     * Construct a parser for a source text.
     *
     * @param source	source text to parse
     */
    public MatlabParser(SourceText source) {
        this.source = source;
        this.contexts = new ArrayDeque<Boolean>();
    }

    /**
     * Parse a source text.
     *
     * @param source	source text to parse
     *
     * @return the root of the parse tree
     *
     * @throws MatlabSyntaxException
     */
    public static ScriptNode parse(SourceText source) throws MatlabSyntaxException {
        MatlabParser parser = new MatlabParser(source);
        return parser.parseScript();
    }

    /**
     * Parse the entire source text.
     *
     * @return the root of the parse tree
     *
     * @throws MatlabSyntaxException
     */
    public ScriptNode parseScript() throws MatlabSyntaxException {
        Lexer lexer = new Lexer(this.source);
        this.tokens = lexer.tokenize();
        this.current = 0;
        this.contexts.clear();
        this.functionCount = 0;
        List<Statement> statements = new ArrayList<Statement>();
        while (! this.check(TokenType.EOF)) {
            if (! this.skipTerminator()) {
                if (this.check(TokenType.FUNCTION))
                    statements.add(this.parseFunction());
                else if (this.check(TokenType.END) && this.functionCount > 0)
                    throw this.unsupported("nested function definitions are not supported", this.peek());
                else
                    statements.add(this.parseStatement());
            }
        }
        log.debug("Parsed {} top-level statements ({} functions) from {}.", statements.size(),
                this.functionCount, this.source.getName());
        return new ScriptNode(this.source.getName(), statements);
    }

    /**
     * Parse a function definition.
     *
     * @return the function definition node
     *
     * @throws MatlabSyntaxException
     */
    private FunctionDefinitionNode parseFunction() throws MatlabSyntaxException {
        Token start = this.advance();
        List<String> outputs = new ArrayList<String>();
        List<String> params = new ArrayList<String>();
        String name;
        if (this.match(TokenType.LBRACKET)) {
            while (! this.match(TokenType.RBRACKET)) {
                if (! this.match(TokenType.COMMA))
                    outputs.add(this.consume(TokenType.IDENTIFIER, "output name").getText());
            }
            this.consume(TokenType.ASSIGN, "'='");
            name = this.consume(TokenType.IDENTIFIER, "function name").getText();
        } else {
            String first = this.consume(TokenType.IDENTIFIER, "function name").getText();
            if (this.match(TokenType.ASSIGN)) {
                outputs.add(first);
                name = this.consume(TokenType.IDENTIFIER, "function name").getText();
            } else
                name = first;
        }
        if (this.match(TokenType.LPAREN)) {
            if (! this.check(TokenType.RPAREN)) {
                do {
                    if (this.match(TokenType.NOT))
                        params.add(null);
                    else
                        params.add(this.consume(TokenType.IDENTIFIER, "parameter name").getText());
                } while (this.match(TokenType.COMMA));
            }
            this.consume(TokenType.RPAREN, "')'");
        }
        this.functionCount++;
        List<Statement> body = this.parseBlock(FUNCTION_ENDS, start);
        this.match(TokenType.END);
        return new FunctionDefinitionNode(start.getLine(), start.getColumn(), name, outputs, params, body);
    }

    /**
     * Parse a list of statements up to one of the specified terminating tokens.  The
     * terminating token is not consumed.
     *
     * @param ends		set of terminating token types
     * @param start		token that began the block, for error messages
     *
     * @return the list of statements in the block
     *
     * @throws MatlabSyntaxException
     */
    private List<Statement> parseBlock(Set<TokenType> ends, Token start) throws MatlabSyntaxException {
        List<Statement> retVal = new ArrayList<Statement>();
        while (! ends.contains(this.peek().getType())) {
            if (this.check(TokenType.EOF))
                throw this.syntax("missing 'end' for '" + start.getText() + "'", start);
            if (! this.skipTerminator())
                retVal.add(this.parseStatement());
        }
        return retVal;
    }

    /**
     * Parse a single statement.
     *
     * @return the statement node
     *
     * @throws MatlabSyntaxException
     */
    private Statement parseStatement() throws MatlabSyntaxException {
        Token t = this.peek();
        Statement retVal = null;
        if (UNSUPPORTED_KEYWORDS.contains(t.getType()))
            throw this.unsupported("'" + t.getText() + "' statements are not supported", t);
        switch (t.getType()) {
        case IF :
            retVal = this.parseIf();
            break;
        case FOR :
            retVal = this.parseFor();
            break;
        case FUNCTION :
            throw this.syntax("function definitions are not allowed inside a control block", t);
        case ELSE :
        case ELSEIF :
        case END :
            throw this.syntax("unexpected '" + t.getText() + "'", t);
        case LBRACKET :
            if (this.isMultiAssignment())
                retVal = this.parseMultiAssignment();
            break;
        case IDENTIFIER :
            if (this.isCommandSyntax())
                retVal = this.parseCommand();
            break;
        default :
        }
        if (retVal == null) {
            Expression expr = this.parseExpression();
            if (this.check(TokenType.ASSIGN)) {
                AssignmentNode.Target target = this.toTarget(expr);
                this.advance();
                Expression value = this.parseExpression();
                retVal = new AssignmentNode(t.getLine(), t.getColumn(), List.of(target), value);
            } else
                retVal = new ExpressionStatementNode(t.getLine(), t.getColumn(), expr);
            this.endStatement();
        }
        return retVal;
    }

    /**
     * Convert an expression on the left side of an assignment into an assignment target.
     *
     * @param expr		expression to convert
     *
     * @return the assignment target
     *
     * @throws MatlabSyntaxException
     */
    private AssignmentNode.Target toTarget(Expression expr) throws MatlabSyntaxException {
        AssignmentNode.Target retVal;
        if (expr instanceof IdentifierNode)
            retVal = new AssignmentNode.Target(((IdentifierNode) expr).getName(), List.of());
        else if (expr instanceof CallNode) {
            CallNode call = (CallNode) expr;
            retVal = new AssignmentNode.Target(call.getName(), call.getArgs());
        } else
            throw this.syntax("invalid assignment target", this.peek());
        return retVal;
    }

    /**
     * @return TRUE if the current statement is a bracketed multiple assignment
     */
    private boolean isMultiAssignment() {
        boolean retVal = false;
        int i = this.current + 1;
        boolean scanning = true;
        while (scanning) {
            TokenType type = this.tokens.get(i).getType();
            if (type == TokenType.IDENTIFIER || type == TokenType.NOT || type == TokenType.COMMA)
                i++;
            else {
                scanning = false;
                retVal = (type == TokenType.RBRACKET && this.tokens.get(i + 1).is(TokenType.ASSIGN));
            }
        }
        return retVal;
    }

    /**
     * Parse a multiple assignment.
     *
     * @return the assignment node
     *
     * @throws MatlabSyntaxException
     */
    private AssignmentNode parseMultiAssignment() throws MatlabSyntaxException {
        Token start = this.advance();
        List<AssignmentNode.Target> targets = new ArrayList<AssignmentNode.Target>();
        while (! this.match(TokenType.RBRACKET)) {
            if (this.match(TokenType.NOT))
                targets.add(new AssignmentNode.Target(null, List.of()));
            else if (! this.match(TokenType.COMMA))
                targets.add(new AssignmentNode.Target(this.advance().getText(), List.of()));
        }
        this.consume(TokenType.ASSIGN, "'='");
        Expression value = this.parseExpression();
        this.endStatement();
        return new AssignmentNode(start.getLine(), start.getColumn(), targets, value);
    }

    /**
     * @return TRUE if the current statement uses command syntax ("hold on")
     */
    private boolean isCommandSyntax() {
        Token next = this.tokens.get(this.current + 1);
        return (next.hasSpaceBefore() && next.is(TokenType.IDENTIFIER));
    }

    /**
     * Parse a command-syntax statement.
     *
     * @return the command node
     *
     * @throws MatlabSyntaxException
     */
    private CommandNode parseCommand() throws MatlabSyntaxException {
        Token start = this.advance();
        List<String> words = new ArrayList<String>();
        while (! this.peek().getType().isTerminator())
            words.add(this.advance().getText());
        this.endStatement();
        return new CommandNode(start.getLine(), start.getColumn(), start.getText(), words);
    }

    /**
     * Parse an if statement.
     *
     * @return the if node
     *
     * @throws MatlabSyntaxException
     */
    private IfNode parseIf() throws MatlabSyntaxException {
        Token start = this.advance();
        List<IfNode.Branch> branches = new ArrayList<IfNode.Branch>();
        List<Statement> elseBody = List.of();
        Expression condition = this.parseExpression();
        List<Statement> body = this.parseBlock(BRANCH_ENDS, start);
        branches.add(new IfNode.Branch(condition, body));
        while (this.match(TokenType.ELSEIF)) {
            condition = this.parseExpression();
            body = this.parseBlock(BRANCH_ENDS, start);
            branches.add(new IfNode.Branch(condition, body));
        }
        if (this.match(TokenType.ELSE))
            elseBody = this.parseBlock(BLOCK_ENDS, start);
        this.consume(TokenType.END, "'end'");
        this.endStatement();
        return new IfNode(start.getLine(), start.getColumn(), branches, elseBody);
    }

    /**
     * Parse a for loop.
     *
     * @return the for node
     *
     * @throws MatlabSyntaxException
     */
    private ForNode parseFor() throws MatlabSyntaxException {
        Token start = this.advance();
        boolean paren = this.match(TokenType.LPAREN);
        if (paren)
            this.contexts.push(false);
        String variable = this.consume(TokenType.IDENTIFIER, "loop variable").getText();
        this.consume(TokenType.ASSIGN, "'='");
        Expression range = this.parseExpression();
        if (paren) {
            this.consume(TokenType.RPAREN, "')'");
            this.contexts.pop();
        }
        List<Statement> body = this.parseBlock(BLOCK_ENDS, start);
        this.consume(TokenType.END, "'end'");
        this.endStatement();
        return new ForNode(start.getLine(), start.getColumn(), variable, range, body);
    }

    /**
     * Parse an expression at the lowest precedence level.
     *
     * @return the expression node
     *
     * @throws MatlabSyntaxException
     */
    private Expression parseExpression() throws MatlabSyntaxException {
        return this.parseShortOr();
    }

    private Expression parseShortOr() throws MatlabSyntaxException {
        Expression retVal = this.parseShortAnd();
        while (this.check(TokenType.OR_OR)) {
            Token op = this.advance();
            retVal = new BinaryNode(op.getLine(), op.getColumn(), BinaryOperator.SHORT_OR, retVal, this.parseShortAnd());
        }
        return retVal;
    }

    private Expression parseShortAnd() throws MatlabSyntaxException {
        Expression retVal = this.parseOr();
        while (this.check(TokenType.AND_AND)) {
            Token op = this.advance();
            retVal = new BinaryNode(op.getLine(), op.getColumn(), BinaryOperator.SHORT_AND, retVal, this.parseOr());
        }
        return retVal;
    }

    private Expression parseOr() throws MatlabSyntaxException {
        Expression retVal = this.parseAnd();
        while (this.check(TokenType.OR)) {
            Token op = this.advance();
            retVal = new BinaryNode(op.getLine(), op.getColumn(), BinaryOperator.OR, retVal, this.parseAnd());
        }
        return retVal;
    }

    private Expression parseAnd() throws MatlabSyntaxException {
        Expression retVal = this.parseRelational();
        while (this.check(TokenType.AND)) {
            Token op = this.advance();
            retVal = new BinaryNode(op.getLine(), op.getColumn(), BinaryOperator.AND, retVal, this.parseRelational());
        }
        return retVal;
    }

    private Expression parseRelational() throws MatlabSyntaxException {
        Expression retVal = this.parseRange();
        BinaryOperator op = relationalOperator(this.peek().getType());
        while (op != null) {
            Token t = this.advance();
            retVal = new BinaryNode(t.getLine(), t.getColumn(), op, retVal, this.parseRange());
            op = relationalOperator(this.peek().getType());
        }
        return retVal;
    }

    /**
     * @return the relational operator for a token type, or NULL if the token is not relational
     *
     * @param type		token type to check
     */
    private static BinaryOperator relationalOperator(TokenType type) {
        BinaryOperator retVal;
        switch (type) {
        case EQUAL :
            retVal = BinaryOperator.EQUAL;
            break;
        case NOT_EQUAL :
            retVal = BinaryOperator.NOT_EQUAL;
            break;
        case LESS :
            retVal = BinaryOperator.LESS;
            break;
        case LESS_EQUAL :
            retVal = BinaryOperator.LESS_EQUAL;
            break;
        case GREATER :
            retVal = BinaryOperator.GREATER;
            break;
        case GREATER_EQUAL :
            retVal = BinaryOperator.GREATER_EQUAL;
            break;
        default :
            retVal = null;
        }
        return retVal;
    }

    private Expression parseRange() throws MatlabSyntaxException {
        Expression retVal = this.parseAdditive();
        if (this.check(TokenType.COLON)) {
            Token t = this.advance();
            Expression second = this.parseAdditive();
            if (this.match(TokenType.COLON)) {
                Expression third = this.parseAdditive();
                retVal = new RangeNode(t.getLine(), t.getColumn(), retVal, second, third);
            } else
                retVal = new RangeNode(t.getLine(), t.getColumn(), retVal, null, second);
        }
        return retVal;
    }

    private Expression parseAdditive() throws MatlabSyntaxException {
        Expression retVal = this.parseMultiplicative();
        boolean more = true;
        while (more && (this.check(TokenType.PLUS) || this.check(TokenType.MINUS))) {
            Token op = this.peek();
            // In a matrix, "a -b" is two elements.
            if (this.inMatrix() && op.hasSpaceBefore() && ! this.peekAt(1).hasSpaceBefore())
                more = false;
            else {
                this.advance();
                BinaryOperator bop = (op.is(TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT);
                retVal = new BinaryNode(op.getLine(), op.getColumn(), bop, retVal, this.parseMultiplicative());
            }
        }
        return retVal;
    }

    private Expression parseMultiplicative() throws MatlabSyntaxException {
        Expression retVal = this.parseUnary();
        BinaryOperator op = multiplicativeOperator(this.peek().getType());
        while (op != null) {
            Token t = this.advance();
            retVal = new BinaryNode(t.getLine(), t.getColumn(), op, retVal, this.parseUnary());
            op = multiplicativeOperator(this.peek().getType());
        }
        return retVal;
    }

    /**
     * @return the multiplicative operator for a token type, or NULL if the token is not multiplicative
     *
     * @param type		token type to check
     */
    private static BinaryOperator multiplicativeOperator(TokenType type) {
        BinaryOperator retVal;
        switch (type) {
        case TIMES :
            retVal = BinaryOperator.TIMES;
            break;
        case DIVIDE :
            retVal = BinaryOperator.DIVIDE;
            break;
        case LEFT_DIVIDE :
            retVal = BinaryOperator.LEFT_DIVIDE;
            break;
        case ELEM_TIMES :
            retVal = BinaryOperator.ELEM_TIMES;
            break;
        case ELEM_DIVIDE :
            retVal = BinaryOperator.ELEM_DIVIDE;
            break;
        case ELEM_LEFT_DIVIDE :
            retVal = BinaryOperator.ELEM_LEFT_DIVIDE;
            break;
        default :
            retVal = null;
        }
        return retVal;
    }

    private Expression parseUnary() throws MatlabSyntaxException {
        Expression retVal;
        UnaryOperator op = prefixOperator(this.peek().getType());
        if (op != null) {
            Token t = this.advance();
            retVal = new UnaryNode(t.getLine(), t.getColumn(), op, this.parseUnary());
        } else
            retVal = this.parsePower();
        return retVal;
    }

    /**
     * @return the prefix operator for a token type, or NULL if the token is not a prefix operator
     *
     * @param type		token type to check
     */
    private static UnaryOperator prefixOperator(TokenType type) {
        UnaryOperator retVal;
        switch (type) {
        case MINUS :
            retVal = UnaryOperator.NEGATE;
            break;
        case PLUS :
            retVal = UnaryOperator.PLUS;
            break;
        case NOT :
            retVal = UnaryOperator.NOT;
            break;
        default :
            retVal = null;
        }
        return retVal;
    }

    private Expression parsePower() throws MatlabSyntaxException {
        Expression retVal = this.parsePostfix();
        if (this.check(TokenType.POWER) || this.check(TokenType.ELEM_POWER)) {
            Token t = this.advance();
            BinaryOperator op = (t.is(TokenType.POWER) ? BinaryOperator.POWER : BinaryOperator.ELEM_POWER);
            retVal = new BinaryNode(t.getLine(), t.getColumn(), op, retVal, this.parsePowerOperand());
        }
        return retVal;
    }

    /**
     * Parse the exponent of a power operation.  This may have a sign prefix ("2^-1").
     *
     * @return the exponent expression
     *
     * @throws MatlabSyntaxException
     */
    private Expression parsePowerOperand() throws MatlabSyntaxException {
        Expression retVal;
        UnaryOperator op = prefixOperator(this.peek().getType());
        if (op != null) {
            Token t = this.advance();
            retVal = new UnaryNode(t.getLine(), t.getColumn(), op, this.parsePowerOperand());
        } else
            retVal = this.parsePower();
        return retVal;
    }

    private Expression parsePostfix() throws MatlabSyntaxException {
        Expression retVal = this.parsePrimary();
        boolean more = true;
        while (more) {
            Token t = this.peek();
            switch (t.getType()) {
            case TRANSPOSE :
                this.advance();
                retVal = new UnaryNode(t.getLine(), t.getColumn(), UnaryOperator.TRANSPOSE, retVal);
                break;
            case DOT_TRANSPOSE :
                this.advance();
                retVal = new UnaryNode(t.getLine(), t.getColumn(), UnaryOperator.DOT_TRANSPOSE, retVal);
                break;
            case DOT :
                throw this.unsupported("struct field references are not supported", t);
            case LBRACE :
                if (! this.inMatrix() || ! t.hasSpaceBefore())
                    throw this.unsupported("cell array indexing is not supported", t);
                more = false;
                break;
            default :
                more = false;
            }
        }
        return retVal;
    }

    private Expression parsePrimary() throws MatlabSyntaxException {
        Token t = this.peek();
        Expression retVal;
        switch (t.getType()) {
        case NUMBER :
            this.advance();
            retVal = new NumberNode(t.getLine(), t.getColumn(), t.getText());
            break;
        case STRING :
            this.advance();
            retVal = new StringNode(t.getLine(), t.getColumn(), t.getText());
            break;
        case IDENTIFIER :
            this.advance();
            if (this.check(TokenType.LPAREN) && ! (this.inMatrix() && this.peek().hasSpaceBefore())) {
                if (FORMAT_FUNCTIONS.contains(t.getText()))
                    throw this.unsupported("string formatting with '" + t.getText() + "' is not supported", t);
                List<Expression> args = this.parseArguments();
                retVal = new CallNode(t.getLine(), t.getColumn(), t.getText(), args);
            } else
                retVal = new IdentifierNode(t.getLine(), t.getColumn(), t.getText());
            break;
        case LPAREN :
            this.advance();
            this.contexts.push(false);
            retVal = this.parseExpression();
            this.consume(TokenType.RPAREN, "')'");
            this.contexts.pop();
            break;
        case LBRACKET :
            retVal = this.parseMatrix();
            break;
        case LBRACE :
            throw this.unsupported("cell arrays are not supported", t);
        case AT :
            retVal = this.parseHandle();
            break;
        case END :
            if (this.contexts.isEmpty())
                throw this.syntax("unexpected 'end'", t);
            throw this.unsupported("'end' inside an index is not supported", t);
        default :
            throw this.syntax("unexpected " + describe(t), t);
        }
        return retVal;
    }

    /**
     * Parse a parenthesized argument list.  A bare colon is allowed as an argument.
     *
     * @return the list of argument expressions
     *
     * @throws MatlabSyntaxException
     */
    private List<Expression> parseArguments() throws MatlabSyntaxException {
        this.consume(TokenType.LPAREN, "'('");
        this.contexts.push(false);
        List<Expression> retVal = new ArrayList<Expression>();
        if (! this.check(TokenType.RPAREN)) {
            do {
                Token t = this.peek();
                if (t.is(TokenType.COLON) && (this.peekAt(1).is(TokenType.COMMA) || this.peekAt(1).is(TokenType.RPAREN))) {
                    this.advance();
                    retVal.add(new ColonNode(t.getLine(), t.getColumn()));
                } else
                    retVal.add(this.parseExpression());
            } while (this.match(TokenType.COMMA));
        }
        this.consume(TokenType.RPAREN, "')'");
        this.contexts.pop();
        return retVal;
    }

    /**
     * Parse a function handle or an anonymous function.
     *
     * @return the handle expression
     *
     * @throws MatlabSyntaxException
     */
    private Expression parseHandle() throws MatlabSyntaxException {
        Token at = this.advance();
        Expression retVal;
        if (this.match(TokenType.LPAREN)) {
            this.contexts.push(false);
            List<String> params = new ArrayList<String>();
            if (! this.check(TokenType.RPAREN)) {
                do {
                    if (this.match(TokenType.NOT))
                        params.add("~");
                    else
                        params.add(this.consume(TokenType.IDENTIFIER, "parameter name").getText());
                } while (this.match(TokenType.COMMA));
            }
            this.consume(TokenType.RPAREN, "')'");
            this.contexts.pop();
            Expression body = this.parseExpression();
            retVal = new AnonymousFunctionNode(at.getLine(), at.getColumn(), params, body);
        } else {
            Token name = this.consume(TokenType.IDENTIFIER, "function name");
            retVal = new FunctionHandleNode(at.getLine(), at.getColumn(), name.getText());
        }
        return retVal;
    }

    /**
     * Parse a matrix literal.
     *
     * @return the matrix node
     *
     * @throws MatlabSyntaxException
     */
    private MatrixNode parseMatrix() throws MatlabSyntaxException {
        Token start = this.advance();
        this.contexts.push(true);
        List<List<Expression>> rows = new ArrayList<List<Expression>>();
        List<Expression> row = new ArrayList<Expression>();
        boolean afterElement = false;
        while (! this.check(TokenType.RBRACKET)) {
            Token t = this.peek();
            if (t.is(TokenType.EOF))
                throw this.syntax("unterminated matrix", start);
            if (t.is(TokenType.SEMICOLON) || t.is(TokenType.NEWLINE)) {
                this.advance();
                if (! row.isEmpty()) {
                    rows.add(row);
                    row = new ArrayList<Expression>();
                }
                afterElement = false;
            } else if (t.is(TokenType.COMMA)) {
                this.advance();
                afterElement = false;
            } else {
                if (afterElement && ! t.hasSpaceBefore())
                    throw this.syntax("unexpected " + describe(t) + " in matrix", t);
                row.add(this.parseExpression());
                afterElement = true;
            }
        }
        this.advance();
        this.contexts.pop();
        if (! row.isEmpty())
            rows.add(row);
        return new MatrixNode(start.getLine(), start.getColumn(), rows);
    }

    /**
     * Consume the terminator at the end of a statement.  End of file is also acceptable.
     *
     * @throws MatlabSyntaxException
     */
    private void endStatement() throws MatlabSyntaxException {
        Token t = this.peek();
        if (t.is(TokenType.COMMA) || t.is(TokenType.SEMICOLON) || t.is(TokenType.NEWLINE))
            this.advance();
        else if (! t.is(TokenType.EOF))
            throw this.syntax("unexpected " + describe(t), t);
    }

    /**
     * Skip a statement terminator if one is present.
     *
     * @return TRUE if a terminator was skipped
     */
    private boolean skipTerminator() {
        TokenType type = this.peek().getType();
        boolean retVal = (type == TokenType.COMMA || type == TokenType.SEMICOLON || type == TokenType.NEWLINE);
        if (retVal)
            this.advance();
        return retVal;
    }

    /**
     * @return TRUE if the innermost bracket context is a matrix
     */
    private boolean inMatrix() {
        return (! this.contexts.isEmpty() && this.contexts.peek());
    }

    /**
     * @return the current token
     */
    private Token peek() {
        return this.tokens.get(this.current);
    }

    /**
     * @return the token at the specified distance past the current one (EOF if past the end)
     *
     * @param distance	distance to look ahead
     */
    private Token peekAt(int distance) {
        int idx = Math.min(this.current + distance, this.tokens.size() - 1);
        return this.tokens.get(idx);
    }

    /**
     * @return TRUE if the current token is of the specified type
     *
     * @param type		token type to check
     */
    private boolean check(TokenType type) {
        return this.peek().is(type);
    }

    /**
     * Consume the current token and return it.  We never advance past the EOF token.
     *
     * @return the token consumed
     */
    private Token advance() {
        Token retVal = this.peek();
        if (! retVal.is(TokenType.EOF))
            this.current++;
        return retVal;
    }

    /**
     * Consume the current token if it is of the specified type.
     *
     * @param type		token type desired
     *
     * @return TRUE if the token was consumed
     */
    private boolean match(TokenType type) {
        boolean retVal = this.check(type);
        if (retVal)
            this.advance();
        return retVal;
    }

    /**
     * Consume a token of the specified type, or fail if the current token is wrong.
     *
     * @param type		token type required
     * @param what		description of what was expected, for the error message
     *
     * @return the token consumed
     *
     * @throws MatlabSyntaxException
     */
    private Token consume(TokenType type, String what) throws MatlabSyntaxException {
        Token t = this.peek();
        if (! t.is(type))
            throw this.syntax("expected " + what + " but found " + describe(t), t);
        return this.advance();
    }

    /**
     * @return a printable description of a token for error messages
     *
     * @param t		token to describe
     */
    private static String describe(Token t) {
        String retVal;
        if (t.is(TokenType.NEWLINE) || t.is(TokenType.EOF))
            retVal = t.getType().getDisplay();
        else
            retVal = "'" + t.getText() + "'";
        return retVal;
    }

    /**
     * @return a syntax exception located at a token
     *
     * @param detail	description of the problem
     * @param t			offending token
     */
    private MatlabSyntaxException syntax(String detail, Token t) {
        return new MatlabSyntaxException(MatlabSyntaxException.Kind.SYNTAX, detail, t.getLine(), t.getColumn(),
                this.source.quote(t.getLine()));
    }

    /**
     * @return an unsupported-construct exception located at a token
     *
     * @param detail	description of the construct
     * @param t			offending token
     */
    private MatlabSyntaxException unsupported(String detail, Token t) {
        return new MatlabSyntaxException(MatlabSyntaxException.Kind.UNSUPPORTED_CONSTRUCT, detail, t.getLine(),
                t.getColumn(), this.source.quote(t.getLine()));
    }

}
