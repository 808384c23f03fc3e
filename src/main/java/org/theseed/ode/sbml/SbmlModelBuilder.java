/**
 *
 */
package org.theseed.ode.sbml;

import javax.xml.stream.XMLStreamException;

import org.apache.commons.lang3.StringUtils;
import org.sbml.jsbml.Compartment;
import org.sbml.jsbml.InitialAssignment;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.Parameter;
import org.sbml.jsbml.SBase;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLException;
import org.sbml.jsbml.SBMLWriter;
import org.sbml.jsbml.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.expr.Expr;
import org.theseed.ode.model.ModelParameter;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeVariable;
import org.theseed.ode.reactions.ReactionNetwork;

/**
 * An SBML model builder converts an ODE model into an SBML Level 3 Version 1 document.  All
 * builders produce the same compartment, species and parameters; the subclass decides how
 * the dynamics are expressed.
 */
public abstract class SbmlModelBuilder {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SbmlModelBuilder.class);
    /** controlling parameters */
    private final IParms processor;

    /** ID of the single compartment */
    public static final String COMPARTMENT_ID = "comp1";
    /** SBML level */
    public static final int LEVEL = 3;
    /** SBML version */
    public static final int VERSION = 1;
    /** XHTML namespace for notes */
    private static final String XHTML_NS = "http://www.w3.org/1999/xhtml";

    /**
     * This interface represents the methods a client must support to build a model.
     */
    public interface IParms {

        /**
         * @return the model ID to use, or NULL to use the source name
         */
        public String getModelId();

        /**
         * @return TRUE if the state variables should be parameters instead of species
         */
        public boolean isSpeciesAsParameters();

        /**
         * @return TRUE if the model elements should carry descriptive notes
         */
        public boolean isAddComments();

    }

    /**
     * This enumeration indicates the ways the dynamics can be expressed.
     */
    public static enum Type {
        /** one rate rule per state variable */
        RULES {
            @Override
            public SbmlModelBuilder create(IParms processor) {
                return new RateRuleSbmlBuilder(processor);
            }
        },
        /** one reaction per inferred reaction */
        REACTIONS {
            @Override
            public SbmlModelBuilder create(IParms processor) {
                return new ReactionSbmlBuilder(processor);
            }
        };

        /**
         * @return a model builder of this type
         *
         * @param processor		controlling parameters
         */
        public abstract SbmlModelBuilder create(IParms processor);
    }

    /**
     * Construct a model builder.
     *
     * @param processor		controlling parameters
     */
    public SbmlModelBuilder(IParms processor) {
        this.processor = processor;
    }

    /**
     * @return an SBML document for an ODE model
     *
     * @param model		ODE model to convert
     * @param network	inferred reactions, or NULL if none are available
     */
    public SBMLDocument build(OdeModel model, ReactionNetwork network) {
        SBMLDocument retVal = new SBMLDocument(LEVEL, VERSION);
        String modelId = this.processor.getModelId();
        if (StringUtils.isBlank(modelId))
            modelId = toSId(model.getName());
        Model sbmlModel = retVal.createModel(modelId);
        if (this.processor.isAddComments())
            addNotes(sbmlModel, "Converted from MATLAB script " + model.getName() + ".");
        Compartment comp = sbmlModel.createCompartment(COMPARTMENT_ID);
        comp.setSize(1.0);
        comp.setSpatialDimensions(3);
        comp.setConstant(true);
        // Create the parameters.
        for (ModelParameter parm : model.getParameters()) {
            Parameter sbmlParm = sbmlModel.createParameter(parm.getName());
            sbmlParm.setConstant(true);
            if (parm.hasValue())
                sbmlParm.setValue(parm.getValue());
            else
                this.addInitialAssignment(sbmlModel, parm.getName(), parm.getExpression());
        }
        // Create the state variables.
        for (OdeVariable variable : model.getVariables()) {
            String id = variable.getName();
            Double init = variable.getInitialValue();
            if (this.processor.isSpeciesAsParameters()) {
                Parameter sbmlParm = sbmlModel.createParameter(id);
                sbmlParm.setConstant(false);
                if (init != null)
                    sbmlParm.setValue(init);
            } else {
                Species species = sbmlModel.createSpecies(id, comp);
                species.setHasOnlySubstanceUnits(false);
                species.setBoundaryCondition(false);
                species.setConstant(false);
                if (init != null)
                    species.setInitialConcentration(init);
            }
            if (init == null)
                this.addInitialAssignment(sbmlModel, id, variable.getInitialExpression());
        }
        log.info("Model {} has {} state variables and {} parameters.", modelId, model.size(),
                model.getParameters().size());
        this.addDynamics(sbmlModel, model, network);
        return retVal;
    }

    /**
     * Add an initial assignment to the model.
     *
     * @param sbmlModel		target SBML model
     * @param id			ID of the variable being initialized
     * @param expr			initial value expression
     */
    private void addInitialAssignment(Model sbmlModel, String id, Expr expr) {
        InitialAssignment assign = sbmlModel.createInitialAssignment();
        assign.setVariable(id);
        assign.setMath(MathConverter.convert(expr));
        log.debug("Initial assignment created for {}.", id);
    }

    /**
     * @return TRUE if the model elements should carry descriptive notes
     */
    protected boolean isAddComments() {
        return this.processor.isAddComments();
    }

    /**
     * Attach a one-paragraph XHTML note to an SBML element.
     *
     * @param element	element to annotate
     * @param text		plain text of the note
     */
    protected static void addNotes(SBase element, String text) {
        String escaped = StringUtils.replaceEach(text, new String[] { "&", "<", ">" },
                new String[] { "&amp;", "&lt;", "&gt;" });
        try {
            element.setNotes("<notes><body xmlns=\"" + XHTML_NS + "\"><p>" + escaped + "</p></body></notes>");
        } catch (XMLStreamException e) {
            throw new RuntimeException("Invalid note text \"" + text + "\": " + e.getMessage(), e);
        }
    }

    /**
     * Add the elements that express the model dynamics.
     *
     * @param sbmlModel		target SBML model
     * @param model			ODE model being converted
     * @param network		inferred reactions, or NULL if none are available
     */
    protected abstract void addDynamics(Model sbmlModel, OdeModel model, ReactionNetwork network);

    /**
     * @return a name converted into a legal SBML identifier
     *
     * @param name		name to convert
     */
    public static String toSId(String name) {
        String retVal = StringUtils.defaultIfBlank(name, "model").replaceAll("[^A-Za-z0-9_]", "_");
        if (! Character.isLetter(retVal.charAt(0)) && retVal.charAt(0) != '_')
            retVal = "_" + retVal;
        return retVal;
    }

    /**
     * @return the XML text of an SBML document
     *
     * @param doc	document to serialize
     *
     * @throws XMLStreamException
     * @throws SBMLException
     */
    public static String toXml(SBMLDocument doc) throws SBMLException, XMLStreamException {
        return new SBMLWriter().writeSBMLToString(doc);
    }

}
