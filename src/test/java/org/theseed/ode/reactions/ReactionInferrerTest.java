/**
 *
 */
package org.theseed.ode.reactions;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.theseed.ode.ConversionException;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.NumericEvaluator;
import org.theseed.ode.interp.OdeInterpreter;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.SourceText;
import org.theseed.ode.model.Factor;
import org.theseed.ode.model.ModelParameter;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeModelBuilder;
import org.theseed.ode.model.OdeVariable;
import org.theseed.ode.model.Term;

/**
 * Tests for reaction inference.
 */
public class ReactionInferrerTest {

    /**
     * @return the model for a test data file
     *
     * @param fileName	name of the file in the data directory
     *
     * @throws IOException
     * @throws ConversionException
     */
    private static OdeModel buildFile(String fileName) throws IOException, ConversionException {
        SourceText source = SourceText.read(new File("data", fileName));
        var script = new OdeInterpreter(source, false).interpret(MatlabParser.parse(source));
        return new OdeModelBuilder(source).build(script);
    }

    /**
     * @return the model for a script held in a string
     *
     * @param name		name of the script
     * @param text		text of the script
     *
     * @throws ConversionException
     */
    private static OdeModel buildText(String name, String text) throws ConversionException {
        SourceText source = new SourceText(name, text);
        var script = new OdeInterpreter(source, false).interpret(MatlabParser.parse(source));
        return new OdeModelBuilder(source).build(script);
    }

    /**
     * @return a two-species script with a constant and a right-hand side
     *
     * @param constants	constant assignments
     * @param rhs		right-hand side of the derivative assignment
     */
    private static String twoSpecies(String constants, String rhs) {
        return constants + "\n"
                + "[t, x] = ode45(@f, [0 1], [1; 0]);\n"
                + "function dx = f(t, x)\n"
                + "  dx = " + rhs + ";\n"
                + "end\n";
    }

    /**
     * @return a model in which every species has a single term with the same monomial
     *
     * @param coeffs	coefficient of the term for each species
     */
    private static OdeModel sharedModel(double... coeffs) {
        List<OdeVariable> vars = new ArrayList<OdeVariable>(coeffs.length);
        for (int i = 0; i < coeffs.length; i++) {
            Term term = new Term(coeffs[i], List.of(Factor.parameter("k"), Factor.species("x_1", 1)));
            vars.add(new OdeVariable(i + 1, "x_" + (i + 1), Exprs.ONE, term.toExpr(), List.of(term)));
        }
        return new OdeModel("shared", vars, List.of(new ModelParameter("k", Exprs.constant(0.5))));
    }

    @Test
    public void testTwoCompartments() throws IOException, ConversionException {
        OdeModel model = buildFile("readme.m");
        ReactionNetwork network = new ReactionInferrer().infer(model);
        assertThat(network.size(), equalTo(4));
        List<InferredReaction> reactions = network.getReactions();
        List<String> ids = reactions.stream().map(x -> x.getId()).collect(Collectors.toList());
        assertThat(ids, contains("r1", "r2", "r3", "r4"));
        InferredReaction r = reactions.get(0);
        assertThat(r.getKind(), equalTo(InferredReaction.Kind.SYNTHESIS));
        assertThat(r.getFormula(), equalTo("0 -> x_1"));
        assertThat(r.getRate().toString(), equalTo("a"));
        assertThat(r.getModifiers(), empty());
        r = reactions.get(1);
        assertThat(r.getKind(), equalTo(InferredReaction.Kind.DEGRADATION));
        assertThat(r.getFormula(), equalTo("x_1 -> 0"));
        assertThat(r.getRate().toString(), equalTo("b * x_1"));
        assertThat(r.getModifiers(), empty());
        r = reactions.get(2);
        assertThat(r.getKind(), equalTo(InferredReaction.Kind.SYNTHESIS));
        assertThat(r.getFormula(), equalTo("0 -> x_2"));
        assertThat(r.getRate().toString(), equalTo("c * x_1"));
        assertThat(r.getModifiers(), contains("x_1"));
        r = reactions.get(3);
        assertThat(r.getKind(), equalTo(InferredReaction.Kind.DEGRADATION));
        assertThat(r.getRate().toString(), equalTo("d * x_2"));
        assertThat(r.getNetCoeff("x_2"), equalTo(-1));
        assertThat(r.getNetCoeff("x_1"), equalTo(0));
    }

    @Test
    public void testMassAction() throws IOException, ConversionException {
        ReactionNetwork network = new ReactionInferrer().infer(buildFile("bimolecular.m"));
        assertThat(network.size(), equalTo(1));
        InferredReaction r = network.getReactions().get(0);
        assertThat(r.getKind(), equalTo(InferredReaction.Kind.CONVERSION));
        assertThat(r.getFormula(), equalTo("x_1 + x_2 -> x_3"));
        assertThat(r.getRate().toString(), equalTo("k * x_1 * x_2"));
        assertThat(r.getModifiers(), empty());
        // Tighter limits split the reaction, and the split is not unique.
        var e = assertThrows(InferenceException.class,
                () -> new ReactionInferrer(1, 3, 4).infer(buildFile("bimolecular.m")));
        assertThat(e.getKind(), equalTo(InferenceException.Kind.AMBIGUOUS_GROUPING));
        network = new ReactionInferrer().infer(buildFile("loops.m"));
        assertThat(network.size(), equalTo(2));
        assertThat(network.getReactions().get(0).getFormula(), equalTo("x_1 -> x_2"));
        assertThat(network.getReactions().get(1).getFormula(), equalTo("x_2 -> 0"));
        network = new ReactionInferrer().infer(buildFile("michaelis.m"));
        assertThat(network.size(), equalTo(1));
        assertThat(network.getReactions().get(0).getFormula(), equalTo("s_1 -> s_2"));
    }

    @Test
    public void testStoichiometry() throws InferenceException {
        // 2 x_1 -> x_2 at rate k*x_1
        OdeModel model = sharedModel(-2.0, 1.0);
        ReactionNetwork network = new ReactionInferrer().infer(model);
        assertThat(network.size(), equalTo(1));
        InferredReaction r = network.getReactions().get(0);
        assertThat(r.getFormula(), equalTo("2*x_1 -> x_2"));
        assertThat(r.getRateTerm().getCoefficient(), equalTo(1.0));
        // Half-unit coefficients scale the rate down.
        network = new ReactionInferrer().infer(sharedModel(-1.0, 0.5));
        r = network.getReactions().get(0);
        assertThat(r.getFormula(), equalTo("2*x_1 -> x_2"));
        assertThat(r.getRateTerm().getCoefficient(), equalTo(0.5));
    }

    @Test
    public void testRederivation() throws IOException, ConversionException {
        for (String fileName : List.of("readme.m", "bimolecular.m", "anonymous.m", "extra.m", "loops.m", "michaelis.m")) {
            OdeModel model = buildFile(fileName);
            ReactionNetwork network = new ReactionInferrer().infer(model);
            for (OdeVariable var : model.getVariables()) {
                Map<String, Double> expected = var.getTerms().stream()
                        .collect(Collectors.toMap(x -> x.getKey(), x -> x.getCoefficient()));
                Map<String, Double> actual = network.rederiveTerms(var.getName()).stream()
                        .collect(Collectors.toMap(x -> x.getKey(), x -> x.getCoefficient()));
                assertThat(fileName + " " + var.getName(), actual.keySet(), equalTo(expected.keySet()));
                for (String key : expected.keySet())
                    assertThat(fileName + " " + key, actual.get(key), closeTo(expected.get(key), 1e-12));
            }
        }
    }

    @Test
    public void testOpaqueOperandOrder() throws ConversionException {
        OdeModel model = buildText("hill", twoSpecies("K = 0.5;", "[-x(1)/(K+x(1)); x(1)/(x(1)+K)]"));
        ReactionNetwork network = new ReactionInferrer().infer(model);
        assertThat(network.size(), equalTo(1));
        InferredReaction r = network.getReactions().get(0);
        assertThat(r.getKind(), equalTo(InferredReaction.Kind.CONVERSION));
        assertThat(r.getFormula(), equalTo("x_1 -> x_2"));
        model = buildText("expo", twoSpecies("k = 2;", "[-exp(k*x(1)); exp(x(1)*k)]"));
        network = new ReactionInferrer().infer(model);
        assertThat(network.size(), equalTo(1));
        r = network.getReactions().get(0);
        assertThat(r.getKind(), equalTo(InferredReaction.Kind.CONVERSION));
        assertThat(r.getFormula(), equalTo("x_1 -> x_2"));
    }

    @Test
    public void testParameterSigns() throws ConversionException {
        // A negative constant reverses the direction of the flux.
        OdeModel model = buildText("negative", twoSpecies("k = -0.5;", "[k*x(1); -k*x(1)]"));
        ReactionNetwork network = new ReactionInferrer().infer(model);
        assertThat(network.size(), equalTo(1));
        InferredReaction r = network.getReactions().get(0);
        assertThat(r.getFormula(), equalTo("x_1 -> x_2"));
        assertThat(r.getModifiers(), empty());
        double rate = NumericEvaluator.evaluate(r.getRate(), Map.of("k", -0.5, "x_1", 2.0), 0.0);
        assertThat(rate, closeTo(1.0, 1e-12));
        for (OdeVariable var : model.getVariables()) {
            List<Term> terms = network.rederiveTerms(var.getName());
            assertThat(terms.size(), equalTo(1));
            assertThat(terms.get(0).getKey(), equalTo(var.getTerms().get(0).getKey()));
            assertThat(terms.get(0).getCoefficient(), closeTo(var.getTerms().get(0).getCoefficient(), 1e-12));
        }
        // Matrix entries carry their own signs, and a zero entry contributes no reaction.
        model = buildText("matrix", twoSpecies("A = [-1 0; 1 -2];", "A*x"));
        network = new ReactionInferrer().infer(model);
        List<String> formulas = network.getReactions().stream().map(x -> x.getFormula()).collect(Collectors.toList());
        assertThat(formulas, contains("x_1 -> 0", "0 -> x_2", "x_2 -> 0"));
        Map<String, Double> values = Map.of("A_1_1", -1.0, "A_2_1", 1.0, "A_2_2", -2.0, "x_1", 1.0, "x_2", 1.0);
        for (InferredReaction reaction : network.getReactions())
            assertThat(reaction.toString(), NumericEvaluator.evaluate(reaction.getRate(), values, 0.0), greaterThan(0.0));
        // Dividing by a zero constant cannot be explained.
        var e = assertThrows(InferenceException.class,
                () -> new ReactionInferrer().infer(buildText("singular", twoSpecies("k = 0;", "[-x(1)/k; x(1)/k]"))));
        assertThat(e.getKind(), equalTo(InferenceException.Kind.SINGULAR_RATE));
    }

    @Test
    public void testFailures() {
        var e = assertThrows(InferenceException.class,
                () -> new ReactionInferrer(2, 3, 4).infer(sharedModel(-1.0, -1.0, -1.0, 1.0)));
        assertThat(e.getKind(), equalTo(InferenceException.Kind.AMBIGUOUS_GROUPING));
        e = assertThrows(InferenceException.class,
                () -> new ReactionInferrer().infer(sharedModel(-1, 1, -1, 1, -1, 1, -1, 1, -1, 1, -1)));
        assertThat(e.getKind(), equalTo(InferenceException.Kind.SEARCH_LIMIT));
        assertThrows(IllegalArgumentException.class, () -> new ReactionInferrer(0, 3, 4));
    }

}
