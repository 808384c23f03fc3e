/**
 *
 */
package org.theseed.ode;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;

import javax.xml.stream.XMLStreamException;

import org.junit.jupiter.api.Test;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.SBMLReader;
import org.theseed.ode.interp.InterpretException;
import org.theseed.ode.matlab.MatlabSyntaxException;
import org.theseed.ode.matlab.SourceText;
import org.theseed.ode.reactions.InferenceException;
import org.theseed.ode.sbml.SbmlModelBuilder;

/**
 * Tests for the end-to-end conversion pipeline.
 */
public class ConverterTest {

    /** script whose terms cannot be grouped uniquely into reactions */
    private static final String AMBIGUOUS = "k = 1;\n"
            + "[t, x] = ode45(@f, [0 1], [1; 1; 1; 0]);\n"
            + "function dx = f(t, x)\n"
            + "  dx = [-k*x(1); -k*x(1); -k*x(1); k*x(1)];\n"
            + "end\n";

    @Test
    public void testReactionMode() throws IOException, ConversionException, XMLStreamException {
        OdeConverter converter = new OdeConverter();
        ConversionResult result = converter.convert(new File("data", "readme.m"));
        assertThat(result.getMode(), equalTo(SbmlModelBuilder.Type.REACTIONS));
        assertThat(result.isFallback(), equalTo(false));
        assertThat(result.getFallbackReason(), nullValue());
        assertThat(result.getNetwork().size(), equalTo(4));
        assertThat(result.getModel().size(), equalTo(2));
        assertThat(result.getScript().getSpeciesNames(), contains("x_1", "x_2"));
        assertThat(result.getParseTree(), not(nullValue()));
        Model model = new SBMLReader().readSBMLFromString(result.toXml()).getModel();
        assertThat(model.getNumReactions(), equalTo(4));
        assertThat(model.getNumRules(), equalTo(0));
        assertThat(model.getParameter("a").getValue(), equalTo(0.6));
        assertThat(model.getParameter("b").getValue(), equalTo(0.348));
        assertThat(model.getParameter("c").getValue(), equalTo(0.36));
        assertThat(model.getParameter("d").getValue(), equalTo(0.01152));
    }

    @Test
    public void testRuleMode() throws IOException, ConversionException, XMLStreamException {
        ConversionOptions options = new ConversionOptions().setMode(SbmlModelBuilder.Type.RULES);
        ConversionResult result = new OdeConverter(options).convert(new File("data", "anonymous.m"));
        assertThat(result.getMode(), equalTo(SbmlModelBuilder.Type.RULES));
        assertThat(result.getNetwork(), nullValue());
        Model model = result.getDocument().getModel();
        assertThat(model.getId(), equalTo("anonymous"));
        assertThat(model.getNumSpecies(), equalTo(3));
        assertThat(model.getNumParameters(), equalTo(2));
        assertThat(model.getNumRules(), equalTo(3));
        // Parameter states force rate rules even when reactions are requested.
        options = new ConversionOptions().setSpeciesAsParameters(true);
        result = new OdeConverter(options).convert(new File("data", "readme.m"));
        assertThat(result.getMode(), equalTo(SbmlModelBuilder.Type.RULES));
        assertThat(result.isFallback(), equalTo(false));
        assertThat(result.getDocument().getModel().getNumParameters(), equalTo(6));
    }

    @Test
    public void testFallback() throws ConversionException {
        SourceText source = new SourceText("ambiguous", AMBIGUOUS);
        ConversionResult result = new OdeConverter().convert(source);
        assertThat(result.isFallback(), equalTo(true));
        assertThat(result.getFallbackReason().getKind(), equalTo(InferenceException.Kind.AMBIGUOUS_GROUPING));
        assertThat(result.getMode(), equalTo(SbmlModelBuilder.Type.RULES));
        assertThat(result.getDocument().getModel().getNumRules(), equalTo(4));
        ConversionOptions strict = new ConversionOptions().setFallback(false);
        var e = assertThrows(InferenceException.class, () -> new OdeConverter(strict).convert(source));
        assertThat(e.getStage(), equalTo(ConversionException.Stage.INFERENCE));
        // Looser limits make the grouping unique.
        ConversionOptions loose = new ConversionOptions().setMaxReactants(3);
        result = new OdeConverter(loose).convert(source);
        assertThat(result.isFallback(), equalTo(false));
        assertThat(result.getNetwork().size(), equalTo(1));
    }

    @Test
    public void testFailures() {
        var e1 = assertThrows(MatlabSyntaxException.class, () -> new OdeConverter().convert(new File("data", "cells.m")));
        assertThat(e1.getStage(), equalTo(ConversionException.Stage.PARSE));
        var e2 = assertThrows(InterpretException.class, () -> new OdeConverter().convert(new File("data", "mismatch.m")));
        assertThat(e2.getStage(), equalTo(ConversionException.Stage.INTERPRET));
        assertThat(e2.getMessage(), containsString("SOLVER_FUNCTION_MISMATCH"));
        assertThat(e2.getLine(), greaterThan(0));
    }

}
