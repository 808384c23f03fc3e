/**
 *
 */
package org.theseed.ode.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.theseed.ode.expr.Binary;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.Symbol;

/**
 * Tests for term expansion.
 */
public class TermExpanderTest {

    private static final Expr X1 = Exprs.symbol("x_1");
    private static final Expr X2 = Exprs.symbol("x_2");
    private static final Expr K = Exprs.symbol("k");
    private static final Expr A = Exprs.symbol("a");

    private static TermExpander expander() {
        return new TermExpander(Map.of("x_1", 1, "x_2", 2), Set.of("k", "a"), 7, "dx = ...");
    }

    private static List<String> keys(List<Term> terms) {
        return terms.stream().map(x -> x.getKey()).collect(Collectors.toList());
    }

    @Test
    public void testDistribution() throws ModelBuildException {
        Expr square = Exprs.mul(Exprs.pow(Exprs.add(X1, X2), Exprs.constant(2)), K);
        List<Term> terms = expander().expand(square);
        assertThat(keys(terms), contains("k*x_1^2", "k*x_1*x_2", "k*x_2^2"));
        assertThat(terms.get(0).getCoefficient(), equalTo(1.0));
        assertThat(terms.get(1).getCoefficient(), equalTo(2.0));
        assertThat(terms.get(2).getCoefficient(), equalTo(1.0));
        assertThat(terms.get(1).getSpecies(), contains("x_1", "x_2"));
        assertThat(terms.get(1).dependsOn("x_2"), equalTo(true));
        assertThat(terms.get(1).dependsOn("x_3"), equalTo(false));
    }

    @Test
    public void testCancellation() throws ModelBuildException {
        Expr expr = Exprs.add(Exprs.sub(Exprs.mul(K, X1), A), Exprs.mul(X1, K));
        List<Term> terms = expander().expand(Exprs.sub(expr, Exprs.mul(Exprs.constant(2), Exprs.mul(K, X1))));
        assertThat(keys(terms), contains("a"));
        assertThat(terms.get(0).getCoefficient(), equalTo(-1.0));
        assertThat(expander().expand(Exprs.sub(X1, X1)), empty());
    }

    @Test
    public void testDivision() throws ModelBuildException {
        List<Term> terms = expander().expand(Exprs.div(A, Exprs.mul(K, X1)));
        assertThat(keys(terms), contains("a*k^-1*x_1^-1"));
        terms = expander().expand(Exprs.div(Exprs.mul(K, X1), Exprs.add(A, X1)));
        assertThat(terms, hasSize(1));
        Term term = terms.get(0);
        assertThat(term.getKey(), equalTo("k*x_1*(a + x_1)^-1"));
        assertThat(term.getFactors().get(2).getType(), equalTo(Factor.Type.OPAQUE));
        terms = expander().expand(Exprs.mul(Exprs.call("exp", List.of(Symbol.TIME)), X2));
        assertThat(keys(terms), contains("x_2*(exp(time))"));
    }

    @Test
    public void testMerge() {
        Term t1 = new Term(2.0, List.of(Factor.parameter("k"), Factor.species("x_1", 1)));
        Term t2 = new Term(3.0, List.of(Factor.species("x_1", 1), Factor.parameter("k")));
        Term t3 = Term.constant(4.0);
        List<Term> merged = TermExpander.merge(List.of(t3, t1, t2));
        assertThat(keys(merged), contains("1", "k*x_1"));
        assertThat(merged.get(1).getCoefficient(), equalTo(5.0));
        merged = TermExpander.merge(List.of(t1, t1.negate(), t3));
        assertThat(keys(merged), contains("1"));
    }

    @Test
    public void testErrors() {
        var e = assertThrows(ModelBuildException.class, () -> expander().expand(Exprs.mul(K, Exprs.symbol("zz"))));
        assertThat(e.getKind(), equalTo(ModelBuildException.Kind.UNDEFINED_SYMBOL));
        assertThat(e.getLine(), equalTo(7));
        e = assertThrows(ModelBuildException.class, () -> expander().expand(Exprs.compare(Binary.Op.GT, X1, K)));
        assertThat(e.getKind(), equalTo(ModelBuildException.Kind.NON_POLYNOMIAL_TERM));
        e = assertThrows(ModelBuildException.class,
                () -> expander().expand(Exprs.call("mystery", List.of(X1))));
        assertThat(e.getKind(), equalTo(ModelBuildException.Kind.NON_POLYNOMIAL_TERM));
    }

}
