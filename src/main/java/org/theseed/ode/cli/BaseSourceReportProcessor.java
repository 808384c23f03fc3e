/**
 *
 */
package org.theseed.ode.cli;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a base class for reports about a MATLAB source file.
 *
 * The positional parameter is the name of the MATLAB file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 */
public abstract class BaseSourceReportProcessor extends BaseSourceProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseSourceReportProcessor.class);
    /** output stream */
    private OutputStream outStream;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, usage = "output file for report (if not STDOUT)")
    private File outFile;

    @Override
    protected void setSourceDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    /**
     * Set the option defaults for the subclass.
     */
    protected abstract void setReporterDefaults();

    @Override
    protected void validateSourceParms() throws IOException, ParseFailureException {
        // Handle the output file.
        if (this.outFile == null) {
            log.info("Output will be to the standard output.");
            this.outStream = System.out;
        } else {
            log.info("Output will be to {}.", this.outFile);
            this.outStream = new FileOutputStream(this.outFile);
        }
        this.validateReporterParms();
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateReporterParms() throws IOException, ParseFailureException;

    @Override
    protected final void runCommand() throws Exception {
        PrintWriter writer = new PrintWriter(this.outStream);
        try {
            this.runReporter(writer);
        } finally {
            writer.flush();
            // Insure the output file is closed.
            if (this.outFile != null)
                writer.close();
        }
    }

    /**
     * Execute the command and produce the report.
     *
     *  @param writer	print writer to receive the report
     *
     *  @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
