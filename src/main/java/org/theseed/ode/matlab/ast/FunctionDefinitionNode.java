package org.theseed.ode.matlab.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function definition.  An ignored parameter ("~") is stored as a NULL name.
 */
public class FunctionDefinitionNode extends Statement {

    // FIELDS
    /** function name */
    private final String name;
    /** output names */
    private final List<String> outputs;
    /** parameter names */
    private final List<String> params;
    /** function body */
    private final List<Statement> body;

    public FunctionDefinitionNode(int line, int column, String name, List<String> outputs,
            List<String> params, List<Statement> body) {
        super(line, column);
        this.name = name;
        this.outputs = List.copyOf(outputs);
        // Ignored parameters are NULL, which List.copyOf does not allow.
        this.params = Collections.unmodifiableList(new ArrayList<String>(params));
        this.body = List.copyOf(body);
    }

    /**
     * @return the function name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the output names
     */
    public List<String> getOutputs() {
        return this.outputs;
    }

    /**
     * @return the parameter names (NULL for an ignored parameter)
     */
    public List<String> getParams() {
        return this.params;
    }

    /**
     * @return the function body
     */
    public List<Statement> getBody() {
        return this.body;
    }

    @Override
    public <T, E extends Exception> T accept(StatementVisitor<T, E> visitor) throws E {
        return visitor.visitFunctionDefinition(this);
    }

}
