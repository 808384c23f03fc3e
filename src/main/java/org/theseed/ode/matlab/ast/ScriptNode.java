package org.theseed.ode.matlab.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The root of a parse tree:  the statements of a single source file, in file order.
 * Function definitions appear in the statement list where they occur in the file.
 */
public class ScriptNode extends ParseNode {

    // FIELDS
    /** name of the source */
    private final String name;
    /** statements in file order */
    private final List<Statement> statements;

    public ScriptNode(String name, List<Statement> statements) {
        super(1, 1);
        this.name = name;
        this.statements = List.copyOf(statements);
    }

    /**
     * @return the name of the source
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return all the statements, in file order
     */
    public List<Statement> getStatements() {
        return this.statements;
    }

    /**
     * @return the statements that are not function definitions
     */
    public List<Statement> getTopLevel() {
        return this.statements.stream().filter(x -> ! (x instanceof FunctionDefinitionNode))
                .collect(Collectors.toList());
    }

    /**
     * @return the function definitions, in file order
     */
    public List<FunctionDefinitionNode> getFunctions() {
        return this.statements.stream().filter(x -> x instanceof FunctionDefinitionNode)
                .map(x -> (FunctionDefinitionNode) x).collect(Collectors.toList());
    }

    /**
     * Dispatch this node to a visitor.
     *
     * @param visitor	visitor to process this node
     *
     * @return the visitor's result
     */
    public <T, E extends Exception> T accept(ParseNodeVisitor<T, E> visitor) throws E {
        return visitor.visitScript(this);
    }

}
