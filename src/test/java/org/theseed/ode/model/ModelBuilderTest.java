/**
 *
 */
package org.theseed.ode.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.theseed.ode.ConversionException;
import org.theseed.ode.expr.NumericEvaluator;
import org.theseed.ode.interp.OdeInterpreter;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.SourceText;

/**
 * Tests for building ODE models from interpreted scripts.
 */
public class ModelBuilderTest {

    /**
     * @return the model for a source text
     *
     * @param source	source to convert
     *
     * @throws ConversionException
     */
    private static OdeModel build(SourceText source) throws ConversionException {
        var script = new OdeInterpreter(source, false).interpret(MatlabParser.parse(source));
        return new OdeModelBuilder(source).build(script);
    }

    /**
     * @return the model for a test data file
     *
     * @param fileName	name of the file in the data directory
     *
     * @throws IOException
     * @throws ConversionException
     */
    private static OdeModel buildFile(String fileName) throws IOException, ConversionException {
        return build(SourceText.read(new File("data", fileName)));
    }

    @Test
    public void testTwoCompartments() throws IOException, ConversionException {
        OdeModel model = buildFile("readme.m");
        assertThat(model.getName(), equalTo("readme"));
        assertThat(model.size(), equalTo(2));
        List<String> parms = model.getParameters().stream().map(x -> x.getName()).collect(Collectors.toList());
        assertThat(parms, contains("a", "b", "c", "d"));
        List<Double> values = model.getParameters().stream().map(x -> x.getValue()).collect(Collectors.toList());
        assertThat(values, contains(0.6, 0.348, 0.36, 0.01152));
        ModelParameter b = model.getParameters().get(1);
        assertThat(b.hasValue(), equalTo(true));
        assertThat(b.getValue(), equalTo(0.348));
        OdeVariable x1 = model.getVariable("x_1");
        assertThat(x1.getIndex(), equalTo(1));
        assertThat(x1.getInitialValue(), equalTo(1.0));
        assertThat(x1.getDerivative().toString(), equalTo("a - b * x_1"));
        List<String> keys = x1.getTerms().stream().map(x -> x.getKey()).collect(Collectors.toList());
        assertThat(keys, contains("a", "b*x_1"));
        assertThat(x1.getTerms().get(1).getCoefficient(), equalTo(-1.0));
        OdeVariable x2 = model.getVariable("x_2");
        assertThat(x2.getInitialValue(), equalTo(0.0));
        assertThat(x2.getDerivative().toString(), equalTo("c * x_1 - d * x_2"));
        keys = x2.getTerms().stream().map(x -> x.getKey()).collect(Collectors.toList());
        assertThat(keys, contains("c*x_1", "d*x_2"));
        assertThat(model.getVariable("x_3"), nullValue());
    }

    @Test
    public void testParameterSelection() throws IOException, ConversionException {
        // The loop index and the unused switch are not parameters.
        OdeModel model = buildFile("loops.m");
        List<String> parms = model.getParameters().stream().map(x -> x.getName()).collect(Collectors.toList());
        assertThat(parms, containsInAnyOrder("scale", "k_1", "k_2"));
        model = buildFile("extra.m");
        parms = model.getParameters().stream().map(x -> x.getName()).collect(Collectors.toList());
        assertThat(parms, contains("kd"));
        assertThat(model.getVariable("x_1").getInitialValue(), equalTo(5.0));
    }

    @Test
    public void testOpaqueFactors() throws IOException, ConversionException {
        OdeModel model = buildFile("michaelis.m");
        List<Term> terms = model.getVariable("s_1").getTerms();
        assertThat(terms, hasSize(1));
        assertThat(terms.get(0).getKey(), equalTo("Vmax*s_1*(Km + s_1)^-1"));
        assertThat(terms.get(0).getCoefficient(), equalTo(-1.0));
        terms = model.getVariable("s_2").getTerms();
        assertThat(terms.get(0).getKey(), equalTo("Vmax*s_1*(Km + s_1)^-1"));
        assertThat(terms.get(0).getCoefficient(), equalTo(1.0));
    }

    @Test
    public void testReconstruction() throws IOException, ConversionException {
        Random rand = new Random(1234);
        for (String fileName : List.of("readme.m", "bimolecular.m", "anonymous.m", "extra.m", "loops.m", "michaelis.m")) {
            OdeModel model = buildFile(fileName);
            Map<String, Double> values = new HashMap<String, Double>();
            for (ModelParameter parm : model.getParameters())
                values.put(parm.getName(), parm.hasValue() ? parm.getValue() : rand.nextDouble());
            for (OdeVariable var : model.getVariables())
                values.put(var.getName(), 0.5 + rand.nextDouble());
            for (OdeVariable var : model.getVariables()) {
                double expected = NumericEvaluator.evaluate(var.getDerivative(), values, 1.0);
                double actual = NumericEvaluator.evaluate(var.getTermSum(), values, 1.0);
                assertThat(fileName + " " + var.getName(), actual, closeTo(expected, 1e-9));
            }
        }
    }

    @Test
    public void testErrors() {
        String text = "k = 1;\n"
                + "[t, x] = ode45(@f, [0 1], 1);\n"
                + "function dx = f(t, x)\n"
                + "  dx = -k * x * sin(x > 1);\n"
                + "end\n";
        var e = assertThrows(ModelBuildException.class, () -> build(new SourceText("bad", text)));
        assertThat(e.getKind(), equalTo(ModelBuildException.Kind.NON_POLYNOMIAL_TERM));
        assertThat(e.getLine(), equalTo(3));
    }

}
