package net.littleredcomputer.propcheck;

/**
 * Thrown when a proposition names more distinct variables than fit in an assignment
 * word. There is no way to continue the check after this.
 */
public class TooManyVariablesException extends IllegalStateException {
    private final String name;

    TooManyVariablesException(String name) {
        super("over " + VariableRegistry.MAX_VARIABLES + " propositional variables (at [" + name + "])");
        this.name = name;
    }

    /** The name whose registration was refused. */
    public String getName() { return name; }
}
