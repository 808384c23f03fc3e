/**
 *
 */
package org.theseed.ode.matlab;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * This object holds the full text of a MATLAB source file in memory.  On construction it
 * performs the comment and continuation pre-pass:  comments (percent or pound sign to the
 * end of the line, and block comments delimited by lines containing only "%{" and "%}")
 * are removed, and lines ending with a "..." continuation are joined to the following line.
 * The cleaned text is what the lexer sees.  Because joining lines changes the line
 * numbering, we keep a map from each cleaned line to the original line where it began.
 */
public class SourceText {

    // FIELDS
    /** name of the source (usually a file base name) */
    private final String name;
    /** original lines of the file */
    private final List<String> lines;
    /** cleaned text */
    private final String cleanText;
    /** map from cleaned line index (0-based) to original line number (1-based) */
    private final int[] lineMap;

    /**
     * This is a simple object describing the code portion of a single physical line.
     */
    private static class LineScan {

        /** code text with the comment removed */
        private final String code;
        /** TRUE if the line ends in a continuation */
        private final boolean continued;

        private LineScan(String code, boolean continued) {
            this.code = code;
            this.continued = continued;
        }

    }

    /**
     * Construct a source text object from a string.
     *
     * @param name		name to give the source
     * @param text		MATLAB source text
     */
    public SourceText(String name, String text) {
        this.name = name;
        this.lines = Arrays.asList(StringUtils.splitPreserveAllTokens(
                StringUtils.remove(text, '\r'), '\n'));
        List<String> cleanLines = new ArrayList<String>(this.lines.size());
        List<Integer> starts = new ArrayList<Integer>(this.lines.size());
        StringBuilder pending = null;
        int pendingStart = 0;
        boolean inBlock = false;
        for (int i = 0; i < this.lines.size(); i++) {
            String raw = this.lines.get(i);
            String trimmed = raw.strip();
            String code;
            boolean continued = false;
            if (inBlock) {
                if (trimmed.equals("%}") || trimmed.equals("#}"))
                    inBlock = false;
                code = "";
            } else if (trimmed.equals("%{") || trimmed.equals("#{")) {
                inBlock = true;
                code = "";
            } else {
                LineScan scan = scanLine(raw);
                code = scan.code;
                continued = scan.continued;
            }
            if (pending == null) {
                pending = new StringBuilder(code);
                pendingStart = i + 1;
            } else
                pending.append(' ').append(code);
            if (! continued) {
                cleanLines.add(pending.toString());
                starts.add(pendingStart);
                pending = null;
            }
        }
        if (pending != null) {
            cleanLines.add(pending.toString());
            starts.add(pendingStart);
        }
        this.cleanText = StringUtils.join(cleanLines, '\n');
        this.lineMap = starts.stream().mapToInt(x -> x).toArray();
    }

    /**
     * Read a source file into memory.  The file is read completely and closed before
     * this method returns.
     *
     * @param inFile	MATLAB source file
     *
     * @return the source text object for the file
     *
     * @throws IOException
     */
    public static SourceText read(File inFile) throws IOException {
        String text = Files.readString(inFile.toPath(), StandardCharsets.UTF_8);
        String name = StringUtils.substringBeforeLast(inFile.getName(), ".");
        return new SourceText(name, text);
    }

    /**
     * Isolate the code portion of a physical line.
     *
     * @param raw	physical line to scan
     *
     * @return the code portion of the line and a continuation flag
     */
    private static LineScan scanLine(String raw) {
        StringBuilder code = new StringBuilder(raw.length());
        char inString = 0;
        int depth = 0;
        char prev = 0;
        boolean spaceBefore = false;
        boolean continued = false;
        final int n = raw.length();
        int j = 0;
        boolean done = false;
        while (j < n && ! done) {
            char c = raw.charAt(j);
            if (inString != 0) {
                code.append(c);
                if (c == inString) {
                    if (j + 1 < n && raw.charAt(j + 1) == inString) {
                        // Doubled delimiter is an escaped quote.
                        code.append(inString);
                        j++;
                    } else {
                        inString = 0;
                        prev = c;
                        spaceBefore = false;
                    }
                } else if (inString == '"' && c == '\\' && j + 1 < n) {
                    code.append(raw.charAt(j + 1));
                    j++;
                }
            } else if (c == '%' || c == '#') {
                done = true;
            } else if (c == '.' && raw.startsWith("...", j)) {
                continued = true;
                done = true;
            } else {
                code.append(c);
                if (Character.isWhitespace(c))
                    spaceBefore = true;
                else {
                    if (c == '"')
                        inString = '"';
                    else if (c == '\'' && isQuoteStart(prev, spaceBefore, depth > 0))
                        inString = '\'';
                    else if (c == '[' || c == '{')
                        depth++;
                    else if ((c == ']' || c == '}') && depth > 0)
                        depth--;
                    prev = c;
                    spaceBefore = false;
                }
            }
            j++;
        }
        return new LineScan(code.toString(), continued);
    }

    /**
     * Determine whether a single quote starts a string or is a transpose operator.
     *
     * @param prev			previous non-space character, or 0 if there is none
     * @param spaceBefore	TRUE if there was white space between the previous character and the quote
     * @param inMatrix		TRUE if we are inside square or curly brackets
     *
     * @return TRUE if the quote starts a string
     */
    public static boolean isQuoteStart(char prev, boolean spaceBefore, boolean inMatrix) {
        boolean retVal;
        if (prev == 0)
            retVal = true;
        else if (Character.isLetterOrDigit(prev) || prev == '_' || prev == ')' || prev == ']'
                || prev == '}' || prev == '\'' || prev == '.')
            retVal = (inMatrix && spaceBefore);
        else
            retVal = true;
        return retVal;
    }

    /**
     * @return the cleaned text (comments and continuations removed)
     */
    public String getCleanText() {
        return this.cleanText;
    }

    /**
     * @return the original line number for a cleaned line number
     *
     * @param cleanLine		1-based line number in the cleaned text
     */
    public int originalLine(int cleanLine) {
        int retVal;
        if (cleanLine < 1)
            retVal = 1;
        else if (cleanLine > this.lineMap.length)
            retVal = this.lines.size();
        else
            retVal = this.lineMap[cleanLine - 1];
        return retVal;
    }

    /**
     * @return the text of an original source line, or an empty string if the line number is invalid
     *
     * @param line		1-based original line number
     */
    public String quote(int line) {
        String retVal = "";
        if (line >= 1 && line <= this.lines.size())
            retVal = this.lines.get(line - 1);
        return retVal;
    }

    /**
     * @return the name of this source
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the number of original lines
     */
    public int getLineCount() {
        return this.lines.size();
    }

    @Override
    public String toString() {
        return "SourceText(" + this.name + ", " + this.lines.size() + " lines)";
    }

}
