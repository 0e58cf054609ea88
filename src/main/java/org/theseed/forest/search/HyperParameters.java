/**
 *
 */
package org.theseed.forest.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * This object is an immutable set of named hyperparameter values.  One is produced for each cell of a
 * parameter grid.  The parameters are kept in the order they were specified.
 *
 * @author Bruce Parrello
 *
 */
public class HyperParameters {

    // FIELDS
    /** map of parameter names to values */
    private final Map<String, Object> values;
    /** empty parameter set */
    public static final HyperParameters EMPTY = new HyperParameters(Collections.emptyMap());

    /**
     * Construct a parameter set from a map.
     *
     * @param values	map of parameter names to values (copied)
     */
    public HyperParameters(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
    }

    /**
     * @return a parameter set built from alternating names and values
     *
     * @param pairs		parameter names and values (name1, value1, name2, value2, ...)
     */
    public static HyperParameters of(Object... pairs) {
        if (pairs.length % 2 != 0)
            throw new IllegalArgumentException("Parameter list must contain name/value pairs.");
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < pairs.length; i += 2)
            map.put(String.valueOf(pairs[i]), pairs[i + 1]);
        return new HyperParameters(map);
    }

    /**
     * @return a parameter set containing these values overridden by the values of another
     *
     * @param other		parameter set whose values take precedence
     */
    public HyperParameters merge(HyperParameters other) {
        Map<String, Object> map = new LinkedHashMap<String, Object>(this.values);
        map.putAll(other.values);
        return new HyperParameters(map);
    }

    /**
     * @return the value of the named parameter, or NULL if it is not present
     *
     * @param name		name of the parameter
     */
    public Object get(String name) {
        return this.values.get(name);
    }

    /**
     * @return TRUE if the named parameter is present
     *
     * @param name		name of the parameter
     */
    public boolean contains(String name) {
        return this.values.containsKey(name);
    }

    /**
     * @return the set of parameter names
     */
    public Set<String> getNames() {
        return this.values.keySet();
    }

    /**
     * @return the parameter map
     */
    public Map<String, Object> asMap() {
        return this.values;
    }

    /**
     * @return the number of parameters
     */
    public int size() {
        return this.values.size();
    }

    @Override
    public boolean equals(Object obj) {
        boolean retVal;
        if (this == obj)
            retVal = true;
        else if (! (obj instanceof HyperParameters))
            retVal = false;
        else
            retVal = this.values.equals(((HyperParameters) obj).values);
        return retVal;
    }

    @Override
    public int hashCode() {
        return this.values.hashCode();
    }

    @Override
    public String toString() {
        return this.values.entrySet().stream().map(x -> x.getKey() + "=" + x.getValue())
                .collect(Collectors.joining(", "));
    }

}
