/**
 *
 */
package org.theseed.ode;

import javax.xml.stream.XMLStreamException;

import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLException;
import org.theseed.ode.interp.InterpretedScript;
import org.theseed.ode.matlab.ast.ScriptNode;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.reactions.InferenceException;
import org.theseed.ode.reactions.ReactionNetwork;
import org.theseed.ode.sbml.SbmlModelBuilder;
import org.theseed.ode.xpp.XppWriter;

/**
 * This object contains the products of every stage of a successful conversion.
 */
public class ConversionResult {

    // FIELDS
    /** parse tree */
    private final ScriptNode parseTree;
    /** interpreted script */
    private final InterpretedScript script;
    /** ODE model */
    private final OdeModel model;
    /** inferred reactions, or NULL if reactions were not used */
    private final ReactionNetwork network;
    /** way the dynamics were expressed */
    private final SbmlModelBuilder.Type mode;
    /** inference failure that caused a fallback to rate rules, or NULL */
    private final InferenceException fallbackReason;
    /** SBML document */
    private final SBMLDocument document;

    /**
     * Assemble a conversion result.
     *
     * @param parseTree			parse tree
     * @param script			interpreted script
     * @param model				ODE model
     * @param network			inferred reactions, or NULL
     * @param mode				way the dynamics were expressed
     * @param fallbackReason	inference failure that forced rate rules, or NULL
     * @param document			SBML document
     */
    public ConversionResult(ScriptNode parseTree, InterpretedScript script, OdeModel model, ReactionNetwork network,
            SbmlModelBuilder.Type mode, InferenceException fallbackReason, SBMLDocument document) {
        this.parseTree = parseTree;
        this.script = script;
        this.model = model;
        this.network = network;
        this.mode = mode;
        this.fallbackReason = fallbackReason;
        this.document = document;
    }

    /**
     * @return the parse tree
     */
    public ScriptNode getParseTree() {
        return this.parseTree;
    }

    /**
     * @return the interpreted script
     */
    public InterpretedScript getScript() {
        return this.script;
    }

    /**
     * @return the ODE model
     */
    public OdeModel getModel() {
        return this.model;
    }

    /**
     * @return the inferred reactions, or NULL if the model uses rate rules
     */
    public ReactionNetwork getNetwork() {
        return this.network;
    }

    /**
     * @return the way the dynamics were expressed
     */
    public SbmlModelBuilder.Type getMode() {
        return this.mode;
    }

    /**
     * @return TRUE if reactions were requested but rate rules had to be used
     */
    public boolean isFallback() {
        return this.fallbackReason != null;
    }

    /**
     * @return the inference failure that forced rate rules, or NULL
     */
    public InferenceException getFallbackReason() {
        return this.fallbackReason;
    }

    /**
     * @return the SBML document
     */
    public SBMLDocument getDocument() {
        return this.document;
    }

    /**
     * @return the SBML document as XML text
     *
     * @throws XMLStreamException
     * @throws SBMLException
     */
    public String toXml() throws SBMLException, XMLStreamException {
        return SbmlModelBuilder.toXml(this.document);
    }

    /**
     * @return the text of an XPPAUT file for the ODE model
     *
     * @param comments	TRUE to describe the model elements in comments
     */
    public String toXpp(boolean comments) {
        return new XppWriter(comments).write(this.model);
    }

}
