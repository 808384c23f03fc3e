/**
 *
 */
package org.theseed.ode.cli;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.ConversionException;
import org.theseed.ode.ConversionOptions;
import org.theseed.ode.interp.InterpretedScript;
import org.theseed.ode.interp.OdeInterpreter;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.SourceText;
import org.theseed.ode.matlab.ast.ScriptNode;
import org.theseed.ode.model.OdeModel;
import org.theseed.ode.model.OdeModelBuilder;
import org.theseed.ode.reactions.ReactionInferrer;

/**
 * This is a base class for commands against a MATLAB source file.
 *
 * The positional parameter is the name of the MATLAB file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --output-names	name the species after the second output of the solver call
 * --maxReactants	maximum total reactant stoichiometry for an inferred reaction
 * --maxProducts	maximum total product stoichiometry for an inferred reaction
 * --maxStoich		maximum stoichiometry of a single species in an inferred reaction
 */
public abstract class BaseSourceProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseSourceProcessor.class);
    /** source text */
    private SourceText source;

    // COMMAND-LINE OPTIONS

    /** TRUE to name the species after the solver output */
    @Option(name = "--output-names", usage = "name species after the second output of the solver call")
    private boolean useOutputNames;

    /** maximum reactant stoichiometry */
    @Option(name = "--maxReactants", metaVar = "2", usage = "maximum total reactant stoichiometry of a reaction")
    private int maxReactants;

    /** maximum product stoichiometry */
    @Option(name = "--maxProducts", metaVar = "3", usage = "maximum total product stoichiometry of a reaction")
    private int maxProducts;

    /** maximum species stoichiometry */
    @Option(name = "--maxStoich", metaVar = "4", usage = "maximum stoichiometry of a single species in a reaction")
    private int maxStoich;

    /** MATLAB source file */
    @Argument(index = 0, metaVar = "source.m", usage = "MATLAB/Octave script to process", required = true)
    private File sourceFile;

    @Override
    protected final void setDefaults() {
        this.useOutputNames = false;
        this.maxReactants = ReactionInferrer.DEFAULT_MAX_REACTANTS;
        this.maxProducts = ReactionInferrer.DEFAULT_MAX_PRODUCTS;
        this.maxStoich = ReactionInferrer.DEFAULT_MAX_STOICH;
        this.setSourceDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setSourceDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (this.maxReactants < 1 || this.maxProducts < 1 || this.maxStoich < 1)
            throw new ParseFailureException("Stoichiometry limits must be positive.");
        if (! this.sourceFile.canRead())
            throw new FileNotFoundException("Source file " + this.sourceFile + " is not found or unreadable.");
        this.source = SourceText.read(this.sourceFile);
        log.info("{} lines read from {}.", this.source.getLineCount(), this.sourceFile);
        this.validateSourceParms();
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateSourceParms() throws IOException, ParseFailureException;

    /**
     * @return the source text
     */
    protected SourceText getSource() {
        return this.source;
    }

    /**
     * @return the conversion options specified on the command line
     */
    protected ConversionOptions getOptions() {
        return new ConversionOptions().setUseOutputNames(this.useOutputNames).setMaxReactants(this.maxReactants)
                .setMaxProducts(this.maxProducts).setMaxStoich(this.maxStoich);
    }

    /**
     * @return the ODE model for the source file
     *
     * @throws ConversionException
     */
    protected OdeModel buildModel() throws ConversionException {
        ScriptNode tree = MatlabParser.parse(this.source);
        InterpretedScript script = new OdeInterpreter(this.source, this.useOutputNames).interpret(tree);
        return new OdeModelBuilder(this.source).build(script);
    }

    /**
     * @return a reaction inferrer using the command-line limits
     */
    protected ReactionInferrer getInferrer() {
        return new ReactionInferrer(this.maxReactants, this.maxProducts, this.maxStoich);
    }

}
