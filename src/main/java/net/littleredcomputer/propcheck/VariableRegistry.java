package net.littleredcomputer.propcheck;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps variable names to bit positions in an assignment word, in order of first
 * appearance. Because an assignment is a 32-bit word, at most {@link #MAX_VARIABLES}
 * distinct names may be registered.
 */
public class VariableRegistry {
    /** Width of the assignment word. */
    public static final int MAX_VARIABLES = Integer.SIZE;

    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();  // inverse of names

    /**
     * Find the bit index of the named variable, registering it if this is the first
     * time the name has been seen.
     * @param name variable name, as written between the brackets
     * @return index in [0, MAX_VARIABLES)
     * @throws TooManyVariablesException if name would be the 33rd distinct variable
     */
    public int resolve(String name) {
        Integer i = index.get(name);
        if (i != null) return i;
        if (names.size() >= MAX_VARIABLES) throw new TooManyVariablesException(name);
        int ix = names.size();
        names.add(name);
        index.put(name, ix);
        return ix;
    }

    public int size() { return names.size(); }

    public String name(int i) { return names.get(i); }

    public ImmutableList<String> names() { return ImmutableList.copyOf(names); }
}
