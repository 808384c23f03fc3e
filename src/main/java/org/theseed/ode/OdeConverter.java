/**
 *
 */
package org.theseed.ode;

import java.io.File;
import java.io.IOException;

import org.sbml.jsbml.SBMLDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.interp.InterpretedScript;
import org.theseed.ode.interp.OdeInterpreter;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.SourceText;
import org.theseed.ode.matlab.ast.ScriptNode;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeModelBuilder;
import org.theseed.ode.reactions.InferenceException;
import org.theseed.ode.reactions.ReactionInferrer;
import org.theseed.ode.reactions.ReactionNetwork;
import org.theseed.ode.sbml.SbmlModelBuilder;

/**
 * This object runs the full conversion pipeline on a MATLAB script:  parsing, interpretation,
 * model building, reaction inference (when reactions are wanted) and SBML construction.  A
 * converter keeps no state between conversions.
 */
public class OdeConverter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(OdeConverter.class);
    /** conversion options */
    private final ConversionOptions options;

    /**
     * Create a converter with the default options.
     */
    public OdeConverter() {
        this(new ConversionOptions());
    }

    /**
     * Create a converter.
     *
     * @param options	conversion options
     */
    public OdeConverter(ConversionOptions options) {
        this.options = options;
    }

    /**
     * @return the result of converting a MATLAB file
     *
     * @param inFile	file to convert
     *
     * @throws IOException
     * @throws ConversionException
     */
    public ConversionResult convert(File inFile) throws IOException, ConversionException {
        log.info("Reading MATLAB script {}.", inFile);
        return this.convert(SourceText.read(inFile));
    }

    /**
     * @return the result of converting MATLAB source text
     *
     * @param source	source text to convert
     *
     * @throws ConversionException
     */
    public ConversionResult convert(SourceText source) throws ConversionException {
        ScriptNode parseTree = MatlabParser.parse(source);
        InterpretedScript script = new OdeInterpreter(source, this.options.isUseOutputNames()).interpret(parseTree);
        OdeModel model = new OdeModelBuilder(source).build(script);
        SbmlModelBuilder.Type mode = this.options.getMode();
        ReactionNetwork network = null;
        InferenceException fallbackReason = null;
        if (mode == SbmlModelBuilder.Type.REACTIONS) {
            if (this.options.isSpeciesAsParameters()) {
                log.warn("State variables cannot be reaction participants when they are parameters; using rate rules.");
                mode = SbmlModelBuilder.Type.RULES;
            } else {
                ReactionInferrer inferrer = new ReactionInferrer(this.options.getMaxReactants(),
                        this.options.getMaxProducts(), this.options.getMaxStoich());
                try {
                    network = inferrer.infer(model);
                } catch (InferenceException e) {
                    if (! this.options.isFallback())
                        throw e;
                    log.warn("Reaction inference failed, using rate rules instead: {}", e.getMessage());
                    fallbackReason = e;
                    mode = SbmlModelBuilder.Type.RULES;
                }
            }
        }
        SBMLDocument document = mode.create(this.options).build(model, network);
        log.info("Conversion of {} complete using {}.", source.getName(), mode);
        return new ConversionResult(parseTree, script, model, network, mode, fallbackReason, document);
    }

    /**
     * @return the conversion options
     */
    public ConversionOptions getOptions() {
        return this.options;
    }

}
