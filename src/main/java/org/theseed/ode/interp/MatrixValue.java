/**
 *
 */
package org.theseed.ode.interp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;

/**
 * This is a two-dimensional matrix of symbolic expressions.  A scalar is a 1x1 matrix.
 * The elements are stored in column-major order, which is the order MATLAB uses for
 * linear indexing.
 *
 * The arithmetic methods throw IllegalArgumentException when the operand sizes do not
 * agree; the interpreter converts these into located errors.
 */
public class MatrixValue extends Value {

    // FIELDS
    /** number of rows */
    private final int rows;
    /** number of columns */
    private final int cols;
    /** elements in column-major order */
    private final Expr[] data;
    /** the empty matrix */
    private static final MatrixValue EMPTY = new MatrixValue(0, 0, new Expr[0]);

    /**
     * Construct a matrix from column-major element data.
     *
     * @param rows		number of rows
     * @param cols		number of columns
     * @param data		elements in column-major order
     */
    public MatrixValue(int rows, int cols, Expr[] data) {
        if (data.length != rows * cols)
            throw new IllegalArgumentException("Matrix data length " + data.length + " does not match "
                    + rows + "x" + cols + ".");
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * @return a 1x1 matrix
     *
     * @param value		the single element
     */
    public static MatrixValue scalar(Expr value) {
        return new MatrixValue(1, 1, new Expr[] { value });
    }

    /**
     * @return a 1x1 numeric matrix
     *
     * @param value		the single element
     */
    public static MatrixValue scalar(double value) {
        return scalar(Exprs.constant(value));
    }

    /**
     * @return the empty matrix
     */
    public static MatrixValue empty() {
        return EMPTY;
    }

    /**
     * @return a column vector
     *
     * @param elements	elements of the vector
     */
    public static MatrixValue column(List<Expr> elements) {
        return new MatrixValue(elements.size(), 1, elements.toArray(new Expr[elements.size()]));
    }

    /**
     * @return a row vector
     *
     * @param elements	elements of the vector
     */
    public static MatrixValue row(List<Expr> elements) {
        return new MatrixValue(1, elements.size(), elements.toArray(new Expr[elements.size()]));
    }

    /**
     * @return a matrix of the specified size filled with a single value
     *
     * @param rows		number of rows
     * @param cols		number of columns
     * @param value		value for every element
     */
    public static MatrixValue filled(int rows, int cols, Expr value) {
        Expr[] data = new Expr[rows * cols];
        Arrays.fill(data, value);
        return new MatrixValue(rows, cols, data);
    }

    /**
     * @return the number of rows
     */
    public int getRows() {
        return this.rows;
    }

    /**
     * @return the number of columns
     */
    public int getCols() {
        return this.cols;
    }

    /**
     * @return the number of elements
     */
    public int size() {
        return this.data.length;
    }

    /**
     * @return TRUE if this matrix has exactly one element
     */
    public boolean isScalar() {
        return this.data.length == 1;
    }

    /**
     * @return TRUE if this matrix has no elements
     */
    public boolean isEmpty() {
        return this.data.length == 0;
    }

    /**
     * @return TRUE if this matrix has a single row or a single column
     */
    public boolean isVector() {
        return this.rows == 1 || this.cols == 1;
    }

    /**
     * @return TRUE if every element is a numeric constant
     */
    public boolean isNumeric() {
        return Arrays.stream(this.data).allMatch(x -> x.isConstant());
    }

    /**
     * @return the element at a 0-based linear index
     *
     * @param idx	linear index (column-major)
     */
    public Expr get(int idx) {
        return this.data[idx];
    }

    /**
     * @return the element at a 0-based row and column
     *
     * @param r		row index
     * @param c		column index
     */
    public Expr get(int r, int c) {
        return this.data[c * this.rows + r];
    }

    /**
     * @return the single element of a scalar
     */
    public Expr getScalar() {
        return this.data[0];
    }

    /**
     * @return the elements in column-major order
     */
    public List<Expr> elements() {
        return Arrays.asList(this.data);
    }

    /**
     * @return the columns of this matrix, in order (the values taken by a loop variable)
     */
    public List<MatrixValue> columns() {
        List<MatrixValue> retVal = new ArrayList<MatrixValue>(this.cols);
        for (int c = 0; c < this.cols; c++) {
            Expr[] colData = Arrays.copyOfRange(this.data, c * this.rows, (c + 1) * this.rows);
            retVal.add(new MatrixValue(this.rows, 1, colData));
        }
        return retVal;
    }

    /**
     * @return the transpose of this matrix
     */
    public MatrixValue transpose() {
        Expr[] newData = new Expr[this.data.length];
        for (int r = 0; r < this.rows; r++) {
            for (int c = 0; c < this.cols; c++)
                newData[r * this.cols + c] = this.get(r, c);
        }
        return new MatrixValue(this.cols, this.rows, newData);
    }

    /**
     * @return a copy of this matrix with one element changed, growing it if necessary
     *
     * New elements created by growth are zero.
     *
     * @param r			0-based row index
     * @param c			0-based column index
     * @param value		new element value
     */
    public MatrixValue with(int r, int c, Expr value) {
        int newRows = Math.max(this.rows, r + 1);
        int newCols = Math.max(this.cols, c + 1);
        Expr[] newData = new Expr[newRows * newCols];
        Arrays.fill(newData, Exprs.ZERO);
        for (int i = 0; i < this.rows; i++) {
            for (int j = 0; j < this.cols; j++)
                newData[j * newRows + i] = this.get(i, j);
        }
        newData[c * newRows + r] = value;
        return new MatrixValue(newRows, newCols, newData);
    }

    /**
     * @return a copy of this matrix with one element changed by linear index, growing
     * 		   a vector if necessary
     *
     * @param idx		0-based linear index
     * @param value		new element value
     */
    public MatrixValue with(int idx, Expr value) {
        MatrixValue retVal;
        if (idx < this.data.length) {
            Expr[] newData = Arrays.copyOf(this.data, this.data.length);
            newData[idx] = value;
            retVal = new MatrixValue(this.rows, this.cols, newData);
        } else if (this.data.length == 0 || this.rows == 1)
            retVal = this.with(0, idx, value);
        else if (this.cols == 1)
            retVal = this.with(idx, 0, value);
        else
            throw new IllegalArgumentException("Cannot grow a " + this.rows + "x" + this.cols
                    + " matrix by linear index " + (idx + 1) + ".");
        return retVal;
    }

    /**
     * @return the result of applying a function to every element
     *
     * @param f		function to apply
     */
    public MatrixValue map(UnaryOperator<Expr> f) {
        Expr[] newData = new Expr[this.data.length];
        for (int i = 0; i < newData.length; i++)
            newData[i] = f.apply(this.data[i]);
        return new MatrixValue(this.rows, this.cols, newData);
    }

    /**
     * @return the result of an element-wise operation, with scalar broadcast
     *
     * @param a		left operand
     * @param b		right operand
     * @param f		element operation
     */
    public static MatrixValue elementwise(MatrixValue a, MatrixValue b, BinaryOperator<Expr> f) {
        MatrixValue retVal;
        if (a.isScalar()) {
            Expr av = a.getScalar();
            retVal = b.map(x -> f.apply(av, x));
        } else if (b.isScalar()) {
            Expr bv = b.getScalar();
            retVal = a.map(x -> f.apply(x, bv));
        } else if (a.rows == b.rows && a.cols == b.cols) {
            Expr[] newData = new Expr[a.data.length];
            for (int i = 0; i < newData.length; i++)
                newData[i] = f.apply(a.data[i], b.data[i]);
            retVal = new MatrixValue(a.rows, a.cols, newData);
        } else
            throw new IllegalArgumentException("Element-wise operation on a " + a.describe() + " and a "
                    + b.describe() + ".");
        return retVal;
    }

    /**
     * @return the matrix product of two matrices (a scalar operand is broadcast)
     *
     * @param a		left operand
     * @param b		right operand
     */
    public static MatrixValue multiply(MatrixValue a, MatrixValue b) {
        MatrixValue retVal;
        if (a.isScalar() || b.isScalar())
            retVal = elementwise(a, b, Exprs::mul);
        else if (a.cols != b.rows)
            throw new IllegalArgumentException("Matrix product of a " + a.describe() + " and a "
                    + b.describe() + ".");
        else {
            Expr[] newData = new Expr[a.rows * b.cols];
            for (int r = 0; r < a.rows; r++) {
                for (int c = 0; c < b.cols; c++) {
                    Expr sum = Exprs.ZERO;
                    for (int k = 0; k < a.cols; k++)
                        sum = Exprs.add(sum, Exprs.mul(a.get(r, k), b.get(k, c)));
                    newData[c * a.rows + r] = sum;
                }
            }
            retVal = new MatrixValue(a.rows, b.cols, newData);
        }
        return retVal;
    }

    /**
     * @return the horizontal concatenation of matrices (empty matrices are skipped)
     *
     * @param parts		matrices to concatenate
     */
    public static MatrixValue horzcat(List<MatrixValue> parts) {
        List<MatrixValue> real = nonEmpty(parts);
        MatrixValue retVal;
        if (real.isEmpty())
            retVal = EMPTY;
        else if (real.size() == 1)
            retVal = real.get(0);
        else {
            int rows = real.get(0).rows;
            List<Expr> data = new ArrayList<Expr>();
            int cols = 0;
            for (MatrixValue part : real) {
                if (part.rows != rows)
                    throw new IllegalArgumentException("Cannot place a " + part.describe()
                            + " beside a matrix with " + rows + " rows.");
                data.addAll(part.elements());
                cols += part.cols;
            }
            retVal = new MatrixValue(rows, cols, data.toArray(new Expr[data.size()]));
        }
        return retVal;
    }

    /**
     * @return the vertical concatenation of matrices (empty matrices are skipped)
     *
     * @param parts		matrices to concatenate
     */
    public static MatrixValue vertcat(List<MatrixValue> parts) {
        List<MatrixValue> real = nonEmpty(parts);
        MatrixValue retVal;
        if (real.isEmpty())
            retVal = EMPTY;
        else if (real.size() == 1)
            retVal = real.get(0);
        else {
            int cols = real.get(0).cols;
            int rows = 0;
            for (MatrixValue part : real) {
                if (part.cols != cols)
                    throw new IllegalArgumentException("Cannot place a " + part.describe()
                            + " below a matrix with " + cols + " columns.");
                rows += part.rows;
            }
            Expr[] newData = new Expr[rows * cols];
            int r0 = 0;
            for (MatrixValue part : real) {
                for (int r = 0; r < part.rows; r++) {
                    for (int c = 0; c < cols; c++)
                        newData[c * rows + r0 + r] = part.get(r, c);
                }
                r0 += part.rows;
            }
            retVal = new MatrixValue(rows, cols, newData);
        }
        return retVal;
    }

    /**
     * @return the non-empty members of a list of matrices
     *
     * @param parts		list to filter
     */
    private static List<MatrixValue> nonEmpty(List<MatrixValue> parts) {
        List<MatrixValue> retVal = new ArrayList<MatrixValue>(parts.size());
        for (MatrixValue part : parts) {
            if (! part.isEmpty())
                retVal.add(part);
        }
        return retVal;
    }

    @Override
    public String describe() {
        String retVal;
        if (this.isScalar())
            retVal = "scalar " + this.data[0];
        else
            retVal = this.rows + "x" + this.cols + " matrix";
        return retVal;
    }

}
