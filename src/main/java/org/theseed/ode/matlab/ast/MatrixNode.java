package org.theseed.ode.matlab.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A bracketed matrix literal.  Each row is a list of element expressions; an element
 * may itself evaluate to a matrix, in which case it is concatenated.
 */
public class MatrixNode extends Expression {

    /** rows of the matrix */
    private final List<List<Expression>> rows;

    public MatrixNode(int line, int column, List<List<Expression>> rows) {
        super(line, column);
        List<List<Expression>> copy = new ArrayList<List<Expression>>(rows.size());
        for (List<Expression> row : rows)
            copy.add(List.copyOf(row));
        this.rows = List.copyOf(copy);
    }

    /**
     * @return the rows of the matrix
     */
    public List<List<Expression>> getRows() {
        return this.rows;
    }

    /**
     * @return TRUE if this is the empty matrix "[]"
     */
    public boolean isEmpty() {
        return this.rows.isEmpty();
    }

    @Override
    public <T, E extends Exception> T accept(ExpressionVisitor<T, E> visitor) throws E {
        return visitor.visitMatrix(this);
    }

}
