/**
 *
 */
package org.theseed.ode.xpp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.ode.ConversionException;
import org.theseed.ode.interp.OdeInterpreter;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.SourceText;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeModelBuilder;

/**
 * Tests for XPPAUT output.
 */
public class XppWriterTest {

    /** script with functions, time, and a symbolic initial condition */
    private static final String FUNCTIONS = "k = 2;\n"
            + "[t, x] = ode45(@f, [0 1], [k; 0]);\n"
            + "function dx = f(t, x)\n"
            + "  dx = [-k*log(x(1))*t; floor(x(2)) + k];\n"
            + "end\n";

    /**
     * @return the model for a source
     *
     * @param source	source script
     *
     * @throws ConversionException
     */
    private static OdeModel build(SourceText source) throws ConversionException {
        var script = new OdeInterpreter(source, false).interpret(MatlabParser.parse(source));
        return new OdeModelBuilder(source).build(script);
    }

    @Test
    public void testPlainFile() throws IOException, ConversionException {
        OdeModel model = build(SourceText.read(new File("data", "readme.m")));
        String text = new XppWriter(false).write(model);
        List<String> lines = Arrays.asList(text.split("\n"));
        assertThat(lines.get(1), equalTo("# Converted from MATLAB script readme"));
        assertThat(lines, hasItems("par a=0.6", "par b=0.348", "par c=0.36", "par d=0.01152"));
        assertThat(lines, hasItems("init x_1=1", "dx_1/dt=a-b*x_1", "init x_2=0", "dx_2/dt=c*x_1-d*x_2"));
        assertThat(lines.indexOf("par d=0.01152"), lessThan(lines.indexOf("init x_1=1")));
        assertThat(lines.indexOf("init x_1=1"), lessThan(lines.indexOf("dx_1/dt=a-b*x_1")));
        assertThat(lines.get(lines.size() - 1), equalTo("done"));
        assertThat(text, not(containsString("# Parameter")));
        assertThat(text, not(containsString("rateRule")));
    }

    @Test
    public void testComments() throws IOException, ConversionException {
        OdeModel model = build(SourceText.read(new File("data", "readme.m")));
        List<String> lines = Arrays.asList(new XppWriter(true).write(model).split("\n"));
        int parmComment = lines.indexOf("# Parameter id = b, constant");
        assertThat(parmComment, greaterThan(0));
        assertThat(lines.get(parmComment + 1), equalTo("par b=0.348"));
        int ruleComment = lines.indexOf("# rateRule : variable = x_2");
        assertThat(ruleComment, greaterThan(parmComment));
        assertThat(lines.get(ruleComment + 1), equalTo("init x_2=0"));
        assertThat(lines, hasItems("# Species:   id = x_1, defined by rule", "# Species:   id = x_2, defined by rule"));
        assertThat(lines.indexOf("# Species:   id = x_2, defined by rule"), lessThan(lines.indexOf("done")));
    }

    @Test
    public void testFunctions() throws ConversionException {
        OdeModel model = build(new SourceText("funky", FUNCTIONS));
        String text = new XppWriter(false).write(model);
        List<String> lines = Arrays.asList(text.split("\n"));
        // The symbolic initial condition is evaluated from the parameters.
        assertThat(lines, hasItems("par k=2", "init x_1=2", "init x_2=0"));
        assertThat(text, containsString("ln(x_1)"));
        assertThat(text, containsString("flr(x_2)"));
        assertThat(text, not(containsString("log(")));
        assertThat(text, not(containsString("time")));
        for (String line : lines) {
            if (line.startsWith("dx_"))
                assertThat(line, not(containsString(" ")));
        }
    }

}
