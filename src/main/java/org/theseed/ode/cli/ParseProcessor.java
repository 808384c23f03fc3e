/**
 *
 */
package org.theseed.ode.cli;

import java.io.IOException;
import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.matlab.MatlabParser;
import org.theseed.ode.matlab.ParseTreePrinter;
import org.theseed.ode.matlab.ast.ScriptNode;

/**
 * This command parses a MATLAB file and prints the parse tree.  It is useful for finding out
 * how the converter reads a script before anything is interpreted.
 *
 * The positional parameter is the name of the MATLAB file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 */
public class ParseProcessor extends BaseSourceReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ParseProcessor.class);

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ScriptNode tree = MatlabParser.parse(this.getSource());
        log.info("{} statements parsed.", tree.getStatements().size());
        writer.print(ParseTreePrinter.print(tree));
    }

}
