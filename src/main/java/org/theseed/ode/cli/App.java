package org.theseed.ode.cli;

import java.util.Arrays;

/**
 * Commands for converting MATLAB ODE scripts to SBML.
 *
 * convert		convert a script into an SBML model
 * parse		display the parse tree of a script
 * odes			report the ODE system extracted from a script
 * reactions	report the reactions inferred from a script
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("Usage: App <convert|parse|odes|reactions> [options] source.m");
            System.exit(99);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "convert" :
            processor = new ConvertProcessor();
            break;
        case "parse" :
            processor = new ParseProcessor();
            break;
        case "odes" :
            processor = new OdeReportProcessor();
            break;
        case "reactions" :
            processor = new ReactionsReportProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
            if (! processor.isSuccessful())
                System.exit(1);
        }
    }
}
