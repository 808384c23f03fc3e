/**
 *
 */
package org.theseed.ode.cli;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.ConversionOptions;
import org.theseed.ode.ConversionResult;
import org.theseed.ode.OdeConverter;
import org.theseed.ode.sbml.SbmlModelBuilder;

/**
 * This command converts a MATLAB ODE script into an SBML model or an XPPAUT file.  In SBML, the
 * dynamics are expressed as inferred reactions when possible and as rate rules otherwise.  An
 * XPPAUT file always contains one differential equation per state variable.
 *
 * The positional parameter is the name of the MATLAB file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file (if not STDOUT)
 *
 * --format			output format, SBML or XPP (default SBML)
 * --comments		describe the converted elements in SBML notes or XPP comments
 * --mode			RULES for rate rules, REACTIONS for inferred reactions (default REACTIONS)
 * --strict			fail instead of using rate rules when reactions cannot be inferred
 * --params			encode the state variables as parameters instead of species
 * --id				model ID (default is derived from the file name)
 * --output-names	name the species after the second output of the solver call
 * --maxReactants	maximum total reactant stoichiometry for an inferred reaction
 * --maxProducts	maximum total product stoichiometry for an inferred reaction
 * --maxStoich		maximum stoichiometry of a single species in an inferred reaction
 */
public class ConvertProcessor extends BaseSourceProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConvertProcessor.class);

    /**
     * Output file formats.
     */
    public static enum Format {
        /** SBML Level 3 Version 1 */
        SBML,
        /** XPPAUT ODE file */
        XPP;
    }

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "model.xml", usage = "output file (if not STDOUT)")
    private File outFile;

    /** output format */
    @Option(name = "--format", usage = "output file format")
    private Format format;

    /** TRUE to describe the converted elements */
    @Option(name = "--comments", usage = "describe the converted elements in notes or comments")
    private boolean addComments;

    /** dynamics mode */
    @Option(name = "--mode", usage = "way to express the model dynamics")
    private SbmlModelBuilder.Type mode;

    /** TRUE to fail if reactions cannot be inferred */
    @Option(name = "--strict", usage = "fail instead of using rate rules when reactions cannot be inferred")
    private boolean strict;

    /** TRUE to encode state variables as parameters */
    @Option(name = "--params", usage = "encode state variables as parameters instead of species")
    private boolean speciesAsParameters;

    /** model ID */
    @Option(name = "--id", metaVar = "model1", usage = "ID for the SBML model (default is based on the file name)")
    private String modelId;

    @Override
    protected void setSourceDefaults() {
        this.outFile = null;
        this.format = Format.SBML;
        this.addComments = false;
        this.mode = SbmlModelBuilder.Type.REACTIONS;
        this.strict = false;
        this.speciesAsParameters = false;
        this.modelId = null;
    }

    @Override
    protected void validateSourceParms() throws IOException, ParseFailureException {
        if (this.strict && this.mode != SbmlModelBuilder.Type.REACTIONS)
            throw new ParseFailureException("--strict is only meaningful for REACTIONS mode.");
        if (this.format == Format.XPP) {
            if (this.strict || this.speciesAsParameters)
                throw new ParseFailureException("--strict and --params cannot be used with XPP output.");
            // XPP has no reactions, so the inference is skipped.
            this.mode = SbmlModelBuilder.Type.RULES;
        }
        if (this.modelId != null && ! this.modelId.equals(SbmlModelBuilder.toSId(this.modelId)))
            throw new ParseFailureException("Model ID \"" + this.modelId + "\" is not a valid SBML identifier.");
    }

    @Override
    protected void runCommand() throws Exception {
        ConversionOptions options = this.getOptions().setMode(this.mode).setFallback(! this.strict)
                .setSpeciesAsParameters(this.speciesAsParameters).setModelId(this.modelId)
                .setAddComments(this.addComments);
        OdeConverter converter = new OdeConverter(options);
        ConversionResult result = converter.convert(this.getSource());
        if (result.isFallback())
            log.warn("Rate rules were used because no reaction network could be inferred.");
        String text;
        if (this.format == Format.XPP)
            text = result.toXpp(this.addComments);
        else
            text = result.toXml();
        if (this.outFile == null)
            System.out.println(text);
        else {
            FileUtils.writeStringToFile(this.outFile, text, StandardCharsets.UTF_8);
            log.info("{} output written to {}.", this.format, this.outFile);
        }
    }

}
