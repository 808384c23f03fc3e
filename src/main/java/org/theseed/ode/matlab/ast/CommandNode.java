package org.theseed.ode.matlab.ast;

import java.util.List;

/**
 * A statement in command syntax, such as "clear all" or "hold on".  These have no
 * effect on the model.
 */
public class CommandNode extends Statement {

    // FIELDS
    /** command name */
    private final String name;
    /** command words */
    private final List<String> words;

    public CommandNode(int line, int column, String name, List<String> words) {
        super(line, column);
        this.name = name;
        this.words = List.copyOf(words);
    }

    /**
     * @return the command name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the words following the command name
     */
    public List<String> getWords() {
        return this.words;
    }

    @Override
    public <T, E extends Exception> T accept(StatementVisitor<T, E> visitor) throws E {
        return visitor.visitCommand(this);
    }

}
