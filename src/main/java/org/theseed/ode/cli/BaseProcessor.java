/**
 *
 */
package org.theseed.ode.cli;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ode.ConversionException;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all the command processors.  It parses the command line into
 * the annotated fields of the subclass, handles the help and debug options, and runs the
 * command with timing and error reporting.
 *
 * The command-line options common to all commands are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 */
public abstract class BaseProcessor implements Runnable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;
    /** TRUE if the command completed successfully */
    private boolean successful;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command line and validate the parameters.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should be skipped
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger root =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    root.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException | IOException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        }
        return retVal;
    }

    @Override
    public void run() {
        this.startTime = System.currentTimeMillis();
        this.successful = false;
        try {
            this.runCommand();
            this.successful = true;
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (ConversionException e) {
            log.error(e.getMessage());
        } catch (Exception e) {
            log.error("Command failed.", e);
        }
    }

    /**
     * @return TRUE if the last run completed successfully
     */
    public boolean isSuccessful() {
        return this.successful;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and parameters.
     *
     * @return TRUE if the command should run, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Run the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
