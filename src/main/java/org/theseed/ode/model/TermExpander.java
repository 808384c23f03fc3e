/**
 *
 */
package org.theseed.ode.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.expr.Binary;
import org.theseed.ode.expr.Constant;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.FunctionCall;
import org.theseed.ode.expr.NumericEvaluator;
import org.theseed.ode.expr.Symbol;
import org.theseed.ode.expr.Unary;

/**
 * This object expands a derivative expression into a flat list of signed terms.
 * Multiplication is distributed over addition, integer powers of sums up to
 * {@link #MAX_POWER} are multiplied out, division by a single term becomes negative
 * exponents, and anything else that is not additive (elementary functions, sums in
 * denominators, symbolic exponents) is kept whole as an opaque factor.  Like terms are
 * merged and terms that cancel are dropped.
 */
public class TermExpander {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TermExpander.class);
    /** map of species names to 1-based indices */
    private final Map<String, Integer> speciesIndex;
    /** names of the model parameters */
    private final Set<String> parameters;
    /** line number for error messages */
    private final int line;
    /** source line for error messages */
    private final String sourceLine;

    /** largest integer power of a sum that is multiplied out */
    public static final int MAX_POWER = 8;
    /** largest number of terms allowed in an expansion */
    public static final int MAX_TERMS = 2000;
    /** relative size below which a merged coefficient is treated as zero */
    private static final double TOLERANCE = 1e-12;

    /**
     * Create an expander.
     *
     * @param speciesIndex	map of species names to 1-based indices
     * @param parameters	names of the model parameters
     * @param line			line number for error messages
     * @param sourceLine	source line for error messages
     */
    public TermExpander(Map<String, Integer> speciesIndex, Set<String> parameters, int line, String sourceLine) {
        this.speciesIndex = speciesIndex;
        this.parameters = parameters;
        this.line = line;
        this.sourceLine = sourceLine;
    }

    /**
     * @return the merged terms of an expression
     *
     * @param expr		expression to expand
     *
     * @throws ModelBuildException
     */
    public List<Term> expand(Expr expr) throws ModelBuildException {
        List<Term> retVal = merge(this.terms(expr));
        log.debug("{} expanded to {} terms.", expr, retVal.size());
        return retVal;
    }

    /**
     * @return the unmerged terms of an expression
     *
     * @param expr		expression to expand
     *
     * @throws ModelBuildException
     */
    private List<Term> terms(Expr expr) throws ModelBuildException {
        List<Term> retVal;
        if (expr instanceof Constant) {
            double value = ((Constant) expr).getValue();
            retVal = new ArrayList<Term>(1);
            if (value != 0.0)
                retVal.add(Term.constant(value));
        } else if (expr instanceof Symbol)
            retVal = List.of(Term.of(this.symbolFactor((Symbol) expr)));
        else if (expr instanceof Unary) {
            Unary unary = (Unary) expr;
            if (unary.getOp() != Unary.Op.NEG)
                throw this.error(ModelBuildException.Kind.NON_POLYNOMIAL_TERM,
                        "Logical negation \"" + expr + "\" cannot be part of a rate.");
            retVal = negate(this.terms(unary.getOperand()));
        } else if (expr instanceof Binary)
            retVal = this.binaryTerms((Binary) expr);
        else if (expr instanceof FunctionCall) {
            FunctionCall call = (FunctionCall) expr;
            if (! NumericEvaluator.isKnownFunction(call.getName(), call.getArgs().size()))
                throw this.error(ModelBuildException.Kind.NON_POLYNOMIAL_TERM,
                        "Function \"" + call.getName() + "\" has no rate-law translation.");
            for (Expr arg : call.getArgs())
                this.terms(arg);
            retVal = List.of(Term.of(Factor.opaque(call)));
        } else
            throw this.error(ModelBuildException.Kind.NON_POLYNOMIAL_TERM, "Unexpected expression \"" + expr + "\".");
        return retVal;
    }

    /**
     * @return the factor for a symbol
     *
     * @param symbol	symbol to convert
     *
     * @throws ModelBuildException
     */
    private Factor symbolFactor(Symbol symbol) throws ModelBuildException {
        Factor retVal;
        String name = symbol.getName();
        Integer idx = this.speciesIndex.get(name);
        if (symbol.isTime())
            retVal = Factor.time();
        else if (idx != null)
            retVal = Factor.species(name, idx);
        else if (this.parameters.contains(name))
            retVal = Factor.parameter(name);
        else
            throw this.error(ModelBuildException.Kind.UNDEFINED_SYMBOL,
                    "\"" + name + "\" is not a species, a parameter, or time.");
        return retVal;
    }

    /**
     * @return the unmerged terms of a binary expression
     *
     * @param expr		expression to expand
     *
     * @throws ModelBuildException
     */
    private List<Term> binaryTerms(Binary expr) throws ModelBuildException {
        List<Term> retVal;
        Binary.Op op = expr.getOp();
        switch (op) {
        case ADD :
            retVal = new ArrayList<Term>(this.terms(expr.getLeft()));
            retVal.addAll(this.terms(expr.getRight()));
            this.checkSize(retVal.size());
            break;
        case SUB :
            retVal = new ArrayList<Term>(this.terms(expr.getLeft()));
            retVal.addAll(negate(this.terms(expr.getRight())));
            this.checkSize(retVal.size());
            break;
        case MUL :
            retVal = this.product(this.terms(expr.getLeft()), this.terms(expr.getRight()));
            break;
        case DIV : {
            List<Term> num = this.terms(expr.getLeft());
            List<Term> den = merge(this.terms(expr.getRight()));
            if (den.isEmpty())
                throw this.error(ModelBuildException.Kind.NON_POLYNOMIAL_TERM, "Division by zero in \"" + expr + "\".");
            Term inverse;
            if (den.size() == 1)
                inverse = den.get(0).power(-1.0);
            else
                inverse = Term.of(Factor.opaque(expr.getRight()).withExponent(-1.0));
            retVal = this.product(num, List.of(inverse));
            break;
        }
        case POW :
            retVal = this.powerTerms(expr);
            break;
        default :
            throw this.error(ModelBuildException.Kind.NON_POLYNOMIAL_TERM,
                    "Operation \"" + op.getSymbol() + "\" in \"" + expr + "\" cannot be part of a rate.");
        }
        return retVal;
    }

    /**
     * @return the unmerged terms of a power expression
     *
     * @param expr		power expression
     *
     * @throws ModelBuildException
     */
    private List<Term> powerTerms(Binary expr) throws ModelBuildException {
        List<Term> retVal;
        List<Term> base = merge(this.terms(expr.getLeft()));
        Double exponent = Exprs.valueOf(expr.getRight());
        if (exponent == null) {
            // Symbolic exponent:  validate the names and keep the whole power opaque.
            this.terms(expr.getRight());
            retVal = List.of(Term.of(Factor.opaque(expr)));
        } else if (base.isEmpty())
            retVal = (exponent == 0.0 ? List.of(Term.constant(1.0)) : new ArrayList<Term>());
        else if (base.size() == 1 && (base.get(0).getCoefficient() > 0 || exponent == Math.rint(exponent)))
            retVal = List.of(base.get(0).power(exponent));
        else if (base.size() > 1 && exponent == Math.rint(exponent) && exponent >= 1 && exponent <= MAX_POWER) {
            retVal = base;
            for (int i = 1; i < exponent; i++)
                retVal = this.product(retVal, base);
        } else
            retVal = List.of(Term.of(Factor.opaque(expr.getLeft()).withExponent(exponent)));
        return retVal;
    }

    /**
     * @return the distributed product of two term lists
     *
     * @param a		first list
     * @param b		second list
     *
     * @throws ModelBuildException
     */
    private List<Term> product(List<Term> a, List<Term> b) throws ModelBuildException {
        this.checkSize(a.size() * b.size());
        List<Term> retVal = new ArrayList<Term>(a.size() * b.size());
        for (Term ta : a) {
            for (Term tb : b)
                retVal.add(ta.times(tb));
        }
        return retVal;
    }

    /**
     * Verify that an expansion has not grown too large.
     *
     * @param size		number of terms in the expansion
     *
     * @throws ModelBuildException
     */
    private void checkSize(int size) throws ModelBuildException {
        if (size > MAX_TERMS)
            throw this.error(ModelBuildException.Kind.NON_POLYNOMIAL_TERM,
                    "Expansion produces more than " + MAX_TERMS + " terms.");
    }

    /**
     * @return the negation of every term in a list
     *
     * @param terms		terms to negate
     */
    private static List<Term> negate(List<Term> terms) {
        List<Term> retVal = new ArrayList<Term>(terms.size());
        for (Term term : terms)
            retVal.add(term.negate());
        return retVal;
    }

    /**
     * @return a term list with like terms merged, in order of first appearance
     *
     * A merged coefficient that is tiny compared to the largest coefficient contributing
     * to it is treated as zero and the term is dropped.
     *
     * @param terms		terms to merge
     */
    public static List<Term> merge(List<Term> terms) {
        Map<String, Double> sums = new LinkedHashMap<String, Double>();
        Map<String, Double> scales = new LinkedHashMap<String, Double>();
        Map<String, Term> samples = new LinkedHashMap<String, Term>();
        for (Term term : terms) {
            String key = term.getKey();
            sums.merge(key, term.getCoefficient(), Double::sum);
            scales.merge(key, Math.abs(term.getCoefficient()), Math::max);
            samples.putIfAbsent(key, term);
        }
        List<Term> retVal = new ArrayList<Term>(sums.size());
        for (Map.Entry<String, Double> entry : sums.entrySet()) {
            double coeff = entry.getValue();
            if (Math.abs(coeff) > TOLERANCE * scales.get(entry.getKey()))
                retVal.add(samples.get(entry.getKey()).withCoefficient(coeff));
        }
        return retVal;
    }

    /**
     * @return a model-building exception for the current derivative
     *
     * @param kind		type of failure
     * @param detail	description of the failure
     */
    private ModelBuildException error(ModelBuildException.Kind kind, String detail) {
        return new ModelBuildException(kind, detail, this.line, this.sourceLine);
    }

}
