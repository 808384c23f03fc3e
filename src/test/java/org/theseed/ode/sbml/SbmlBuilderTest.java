/**
 *
 */
package org.theseed.ode.sbml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;

import javax.xml.stream.XMLStreamException;

import org.junit.jupiter.api.Test;
import org.sbml.jsbml.ASTNode;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.RateRule;
import org.sbml.jsbml.Reaction;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLReader;
import org.sbml.jsbml.Species;
import org.theseed.ode.ConversionException;
import org.theseed.ode.ConversionOptions;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.expr.Exprs;
import org.theseed.ode.expr.Symbol;
import org.theseed.ode.interp.OdeInterpreter;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.SourceText;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeModelBuilder;
import org.theseed.ode.reactions.ReactionInferrer;
import org.theseed.ode.reactions.ReactionNetwork;

/**
 * Tests for the SBML document builders.
 */
public class SbmlBuilderTest {

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
     * @return the model in a document after writing it out and reading it back
     *
     * @param doc	document to round-trip
     *
     * @throws XMLStreamException
     */
    private static Model reread(SBMLDocument doc) throws XMLStreamException {
        String xml = SbmlModelBuilder.toXml(doc);
        assertThat(xml, containsString("<sbml"));
        SBMLDocument doc2 = new SBMLReader().readSBMLFromString(xml);
        assertThat(doc2.getLevel(), equalTo(3));
        assertThat(doc2.getVersion(), equalTo(1));
        return doc2.getModel();
    }

    @Test
    public void testRateRules() throws IOException, ConversionException, XMLStreamException {
        OdeModel model = buildFile("readme.m");
        ConversionOptions options = new ConversionOptions();
        SBMLDocument doc = SbmlModelBuilder.Type.RULES.create(options).build(model, null);
        Model sbml = reread(doc);
        assertThat(sbml.getId(), equalTo("readme"));
        assertThat(sbml.getNumCompartments(), equalTo(1));
        assertThat(sbml.getCompartment(0).getId(), equalTo(SbmlModelBuilder.COMPARTMENT_ID));
        assertThat(sbml.getNumSpecies(), equalTo(2));
        assertThat(sbml.getNumParameters(), equalTo(4));
        assertThat(sbml.getParameter("c").getValue(), equalTo(0.36));
        assertThat(sbml.getParameter("c").getConstant(), equalTo(true));
        Species x1 = sbml.getSpecies("x_1");
        assertThat(x1.getInitialConcentration(), equalTo(1.0));
        assertThat(x1.getConstant(), equalTo(false));
        assertThat(x1.getBoundaryCondition(), equalTo(false));
        assertThat(sbml.getNumRules(), equalTo(2));
        assertThat(sbml.getNumReactions(), equalTo(0));
        RateRule rule = (RateRule) sbml.getRule(0);
        assertThat(rule.getVariable(), equalTo("x_1"));
        assertThat(rule.getMath().getType(), equalTo(ASTNode.Type.MINUS));
    }

    @Test
    public void testParameterStates() throws IOException, ConversionException, XMLStreamException {
        OdeModel model = buildFile("extra.m");
        ConversionOptions options = new ConversionOptions().setSpeciesAsParameters(true).setModelId("decay_model");
        SBMLDocument doc = SbmlModelBuilder.Type.RULES.create(options).build(model, null);
        Model sbml = reread(doc);
        assertThat(sbml.getId(), equalTo("decay_model"));
        assertThat(sbml.getNumSpecies(), equalTo(0));
        assertThat(sbml.getNumParameters(), equalTo(2));
        assertThat(sbml.getParameter("x_1").getConstant(), equalTo(false));
        assertThat(sbml.getParameter("x_1").getValue(), equalTo(5.0));
        assertThat(sbml.getNumRules(), equalTo(1));
        assertThrows(IllegalArgumentException.class, () -> SbmlModelBuilder.Type.REACTIONS.create(options));
    }

    @Test
    public void testReactions() throws IOException, ConversionException, XMLStreamException {
        OdeModel model = buildFile("readme.m");
        ReactionNetwork network = new ReactionInferrer().infer(model);
        SBMLDocument doc = SbmlModelBuilder.Type.REACTIONS.create(new ConversionOptions()).build(model, network);
        Model sbml = reread(doc);
        assertThat(sbml.getNumRules(), equalTo(0));
        assertThat(sbml.getNumReactions(), equalTo(4));
        Reaction r1 = sbml.getReaction("r1");
        assertThat(r1.getNumReactants(), equalTo(0));
        assertThat(r1.getNumProducts(), equalTo(1));
        assertThat(r1.getProduct(0).getSpecies(), equalTo("x_1"));
        assertThat(r1.getReversible(), equalTo(false));
        Reaction r3 = sbml.getReaction("r3");
        assertThat(r3.getNumModifiers(), equalTo(1));
        assertThat(r3.getModifier(0).getSpecies(), equalTo("x_1"));
        assertThat(r3.getKineticLaw().getMath().getType(), equalTo(ASTNode.Type.TIMES));
        // Bimolecular stoichiometry.
        model = buildFile("bimolecular.m");
        network = new ReactionInferrer().infer(model);
        doc = SbmlModelBuilder.Type.REACTIONS.create(new ConversionOptions()).build(model, network);
        sbml = reread(doc);
        Reaction r = sbml.getReaction("r1");
        assertThat(r.getNumReactants(), equalTo(2));
        assertThat(r.getNumProducts(), equalTo(1));
        assertThat(r.getReactant(0).getStoichiometry(), equalTo(1.0));
    }

    @Test
    public void testNotes() throws IOException, ConversionException, XMLStreamException {
        OdeModel model = buildFile("readme.m");
        ConversionOptions options = new ConversionOptions().setAddComments(true);
        Model sbml = reread(SbmlModelBuilder.Type.RULES.create(options).build(model, null));
        assertThat(sbml.getNotesString(), containsString("Converted from MATLAB script readme."));
        assertThat(sbml.getRule(0).getNotesString(), containsString("dx_1/dt = a - b * x_1"));
        assertThat(sbml.getRule(1).getNotesString(), containsString("dx_2/dt = c * x_1 - d * x_2"));
        ReactionNetwork network = new ReactionInferrer().infer(model);
        sbml = reread(SbmlModelBuilder.Type.REACTIONS.create(options).build(model, network));
        assertThat(sbml.getReaction("r2").getNotesString(), containsString("rate b * x_1"));
        // Without the option, nothing is annotated.
        sbml = reread(SbmlModelBuilder.Type.REACTIONS.create(new ConversionOptions()).build(model, network));
        assertThat(sbml.isSetNotes(), equalTo(false));
        assertThat(sbml.getReaction("r2").isSetNotes(), equalTo(false));
    }

    @Test
    public void testMath() {
        Expr x = Exprs.symbol("x_1");
        ASTNode node = MathConverter.convert(Exprs.mul(Exprs.call("exp", List.of(Symbol.TIME)), x));
        assertThat(node.getType(), equalTo(ASTNode.Type.TIMES));
        assertThat(node.getChild(0).getType(), equalTo(ASTNode.Type.FUNCTION_EXP));
        assertThat(node.getChild(0).getChild(0).getType(), equalTo(ASTNode.Type.NAME_TIME));
        assertThat(node.getChild(1).getName(), equalTo("x_1"));
        node = MathConverter.convert(Exprs.neg(x));
        assertThat(node.getType(), equalTo(ASTNode.Type.MINUS));
        assertThat(node.getChildCount(), equalTo(1));
        node = MathConverter.convert(Exprs.constant(3.0));
        assertThat(node.getInteger(), equalTo(3));
        node = MathConverter.convert(Exprs.call("log10", List.of(x)));
        assertThat(node.getType(), equalTo(ASTNode.Type.FUNCTION_LOG));
    }

    @Test
    public void testIds() {
        assertThat(SbmlModelBuilder.toSId("my-model"), equalTo("my_model"));
        assertThat(SbmlModelBuilder.toSId("2step"), equalTo("_2step"));
        assertThat(SbmlModelBuilder.toSId(""), equalTo("model"));
    }

}
