/**
 *
 */
package org.theseed.ode.interp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.theseed.ode.ConversionException;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.NumericEvaluator;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.SourceText;

/**
 * Tests for the script interpreter.
 */
public class InterpreterTest {

    /**
     * @return the interpretation of a test data file
     *
     * @param fileName		name of the file in the data directory
     *
     * @throws IOException
     * @throws ConversionException
     */
    private static InterpretedScript interpretFile(String fileName) throws IOException, ConversionException {
        SourceText source = SourceText.read(new File("data", fileName));
        return interpret(source, false);
    }

    /**
     * @return the interpretation of a source text
     *
     * @param source			source to interpret
     * @param useOutputNames	TRUE to name species after the solver output
     *
     * @throws ConversionException
     */
    private static InterpretedScript interpret(SourceText source, boolean useOutputNames) throws ConversionException {
        return new OdeInterpreter(source, useOutputNames).interpret(MatlabParser.parse(source));
    }

    @Test
    public void testTwoCompartments() throws IOException, ConversionException {
        InterpretedScript script = interpretFile("readme.m");
        assertThat(script.getName(), equalTo("readme"));
        assertThat(script.getSolverCall().getSolverName(), equalTo("ode45"));
        assertThat(script.getFunction().getName(), equalTo("f"));
        assertThat(script.getFunction().isSynthetic(), equalTo(false));
        assertThat(script.getSpeciesNames(), contains("x_1", "x_2"));
        assertThat(script.getSeparator(), equalTo("_"));
        List<Expr> initial = script.getInitialValues();
        assertThat(Exprs.valueOf(initial.get(0)), equalTo(1.0));
        assertThat(Exprs.valueOf(initial.get(1)), equalTo(0.0));
        List<Expr> derivs = script.getDerivatives();
        assertThat(derivs.get(0).toString(), equalTo("a - b * x_1"));
        assertThat(derivs.get(1).toString(), equalTo("c * x_1 - d * x_2"));
        Map<String, Expr> constants = script.getConstants();
        assertThat(constants.keySet(), hasItems("a", "b", "c", "d"));
        assertThat(Exprs.valueOf(constants.get("b")), equalTo(0.348));
    }

    @Test
    public void testAnonymous() throws IOException, ConversionException {
        InterpretedScript script = interpretFile("anonymous.m");
        assertThat(script.getSolverCall().getSolverName(), equalTo("ode23"));
        assertThat(script.getFunction().isSynthetic(), equalTo(true));
        assertThat(script.getFunction().getName(), equalTo("anonymous"));
        assertThat(script.getSpeciesNames(), contains("y_1", "y_2", "y_3"));
        Map<String, Double> values = Map.of("k1", 0.4, "k2", 0.1, "y_1", 1.0, "y_2", 2.0, "y_3", 3.0);
        List<Expr> derivs = script.getDerivatives();
        assertThat(NumericEvaluator.evaluate(derivs.get(0), values, 0.0), closeTo(-0.4, 1e-12));
        assertThat(NumericEvaluator.evaluate(derivs.get(1), values, 0.0), closeTo(0.2, 1e-12));
        assertThat(NumericEvaluator.evaluate(derivs.get(2), values, 0.0), closeTo(0.2, 1e-12));
    }

    @Test
    public void testExtraArguments() throws IOException, ConversionException {
        InterpretedScript script = interpretFile("extra.m");
        assertThat(script.getSpeciesNames(), contains("x_1"));
        assertThat(Exprs.valueOf(script.getInitialValues().get(0)), equalTo(5.0));
        assertThat(script.getConstants().keySet(), hasItem("kd"));
        Map<String, Double> values = Map.of("kd", 0.7, "x_1", 2.0);
        assertThat(NumericEvaluator.evaluate(script.getDerivatives().get(0), values, 0.0), closeTo(-1.4, 1e-12));
    }

    @Test
    public void testControlFlow() throws IOException, ConversionException {
        InterpretedScript script = interpretFile("loops.m");
        assertThat(script.getSolverCall().getSolverName(), equalTo("ode15s"));
        assertThat(script.getSpeciesNames(), contains("x_1", "x_2"));
        Map<String, Expr> constants = script.getConstants();
        assertThat(constants.keySet(), hasItems("scale", "k_1", "k_2"));
        assertThat(Exprs.valueOf(constants.get("scale")), equalTo(1.0));
        assertThat(Exprs.valueOf(constants.get("k_1")), closeTo(0.1, 1e-12));
        assertThat(Exprs.valueOf(constants.get("k_2")), closeTo(0.2, 1e-12));
        Map<String, Double> values = Map.of("scale", 1.0, "k_1", 0.1, "k_2", 0.2, "x_1", 2.0, "x_2", 1.0);
        List<Expr> derivs = script.getDerivatives();
        assertThat(NumericEvaluator.evaluate(derivs.get(0), values, 0.0), closeTo(-0.2, 1e-12));
        assertThat(NumericEvaluator.evaluate(derivs.get(1), values, 0.0), closeTo(0.0, 1e-12));
    }

    @Test
    public void testNaming() throws ConversionException {
        String text = "[t, conc] = ode45(@f, [0 1], [1; 2]);\n"
                + "function dx = f(t, x)\n"
                + "  dx = [-x(1); x(1)];\n"
                + "end\n";
        SourceText source = new SourceText("naming", text);
        assertThat(interpret(source, false).getSpeciesNames(), contains("x_1", "x_2"));
        assertThat(interpret(source, true).getSpeciesNames(), contains("conc_1", "conc_2"));
        // An existing name that looks like an indexed name forces a longer separator.
        text = "x_1 = 2;\n"
                + "[t, x] = ode45(@f, [0 1], [1; 0]);\n"
                + "function dx = f(t, x)\n"
                + "  dx = [-x_1*x(1); x_1*x(1)];\n"
                + "end\n";
        InterpretedScript script = interpret(new SourceText("collide", text), false);
        assertThat(script.getSeparator(), equalTo("__"));
        assertThat(script.getSpeciesNames(), contains("x__1", "x__2"));
        assertThat(script.getConstants().keySet(), hasItem("x_1"));
    }

    @Test
    public void testErrors() {
        var e = assertThrows(InterpretException.class, () -> interpretFile("mismatch.m"));
        assertThat(e.getKind(), equalTo(InterpretException.Kind.SOLVER_FUNCTION_MISMATCH));
        e = assertThrows(InterpretException.class, () -> interpretFile("piecewise.m"));
        assertThat(e.getKind(), equalTo(InterpretException.Kind.UNSUPPORTED_CONDITIONAL));
        e = assertThrows(InterpretException.class, () -> interpretFile("twosolvers.m"));
        assertThat(e.getKind(), equalTo(InterpretException.Kind.MULTIPLE_SOLVER_CALLS));
        assertThat(e.getLine(), equalTo(3));
        e = assertThrows(InterpretException.class, () -> interpret(new SourceText("none", "k = 1;\n"), false));
        assertThat(e.getKind(), equalTo(InterpretException.Kind.MISSING_SOLVER_CALL));
        e = assertThrows(InterpretException.class,
                () -> interpret(new SourceText("undef", "[t, x] = ode45(@f, [0 1], q0);\nfunction dx = f(t, x)\n  dx = -x;\nend\n"), false));
        assertThat(e.getKind(), equalTo(InterpretException.Kind.UNRESOLVED_SYMBOL));
    }

}
