/**
 *
 */
package org.theseed.ode.cli;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;

/**
 * Tests for the command-line processors.
 */
public class CommandTest {

    /**
     * Run a command and return the lines of its output file.
     *
     * @param processor		command processor to run
     * @param args			command-line arguments, without the output option
     *
     * @return the output lines
     *
     * @throws IOException
     */
    private static List<String> runCommand(BaseProcessor processor, String... args) throws IOException {
        File outFile = File.createTempFile("ode", ".out");
        outFile.deleteOnExit();
        String[] fullArgs = new String[args.length + 2];
        System.arraycopy(args, 0, fullArgs, 0, args.length);
        fullArgs[args.length] = "-o";
        fullArgs[args.length + 1] = outFile.getPath();
        boolean ok = processor.parseCommand(fullArgs);
        assertThat(ok, equalTo(true));
        processor.run();
        assertThat(processor.isSuccessful(), equalTo(true));
        return FileUtils.readLines(outFile, StandardCharsets.UTF_8);
    }

    @Test
    public void testOdeReport() throws IOException {
        List<String> lines = runCommand(new OdeReportProcessor(), "data/readme.m");
        assertThat(lines.get(0), equalTo("index\tspecies\tinitial\tderivative\tterms"));
        assertThat(lines.get(1), startsWith("1\tx_1\t1\ta - b * x_1\t"));
        assertThat(lines, hasItem("parameter\tvalue"));
        assertThat(lines, hasItems("a\t0.6", "b\t0.348", "c\t0.36", "d\t0.01152"));
    }

    @Test
    public void testReactionReport() throws IOException {
        List<String> lines = runCommand(new ReactionsReportProcessor(), "data/bimolecular.m");
        assertThat(lines.get(0), equalTo("reaction_id\tkind\tformula\tmodifiers\trate"));
        assertThat(lines, hasSize(2));
        assertThat(lines.get(1), startsWith("r1\tCONVERSION\tx_1 + x_2 -> x_3\t"));
        assertThat(lines.get(1), endsWith("k * x_1 * x_2"));
    }

    @Test
    public void testConvert() throws IOException {
        List<String> lines = runCommand(new ConvertProcessor(), "--mode", "RULES", "data/extra.m");
        String xml = String.join("\n", lines);
        assertThat(xml, containsString("<sbml"));
        assertThat(xml, containsString("rateRule"));
        assertThat(xml, not(containsString("<reaction ")));
    }

    @Test
    public void testXppConvert() throws IOException {
        List<String> lines = runCommand(new ConvertProcessor(), "--format", "XPP", "data/readme.m");
        assertThat(lines, hasItems("par a=0.6", "init x_1=1", "dx_1/dt=a-b*x_1", "done"));
        assertThat(lines, not(hasItem(startsWith("# rateRule"))));
        lines = runCommand(new ConvertProcessor(), "--format", "XPP", "--comments", "data/readme.m");
        assertThat(lines, hasItems("# Parameter id = a, constant", "# rateRule : variable = x_1"));
        String xml = String.join("\n", runCommand(new ConvertProcessor(), "--comments", "data/readme.m"));
        assertThat(xml, containsString("<notes>"));
        assertThat(xml, containsString("Converted from MATLAB script readme."));
    }

    @Test
    public void testBadParameters() {
        assertThat(new ConvertProcessor().parseCommand(new String[] { "data/missing.m" }), equalTo(false));
        assertThat(new ConvertProcessor().parseCommand(new String[] { "--maxReactants", "0", "data/readme.m" }),
                equalTo(false));
        assertThat(new ConvertProcessor().parseCommand(new String[] { "--mode", "RULES", "--strict", "data/readme.m" }),
                equalTo(false));
        assertThat(new ConvertProcessor().parseCommand(new String[] { "--format", "XPP", "--params", "data/readme.m" }),
                equalTo(false));
    }

}
