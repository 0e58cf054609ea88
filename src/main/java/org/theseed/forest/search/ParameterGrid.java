/**
 *
 */
package org.theseed.forest.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parameter grid specifies a list of candidate values for each of one or more hyperparameters.  The grid
 * produces a parameter set for every combination of values.  The last parameter added varies fastest.
 *
 * @author Bruce Parrello
 *
 */
public class ParameterGrid {

    // FIELDS
    /** map of parameter names to candidate values */
    private final Map<String, List<Object>> choices;

    /**
     * Create an empty parameter grid.
     */
    public ParameterGrid() {
        this.choices = new LinkedHashMap<String, List<Object>>();
    }

    /**
     * Specify the candidate values for a parameter.
     *
     * @param name		name of the parameter
     * @param values	candidate values
     */
    public ParameterGrid add(String name, Object... values) {
        return this.add(name, Arrays.asList(values));
    }

    /**
     * Specify the candidate values for a parameter.
     *
     * @param name		name of the parameter
     * @param values	list of candidate values
     */
    public ParameterGrid add(String name, List<?> values) {
        this.choices.put(name, new ArrayList<Object>(values));
        return this;
    }

    /**
     * @return the names of the parameters in the grid
     */
    public List<String> getNames() {
        return new ArrayList<String>(this.choices.keySet());
    }

    /**
     * Verify that the grid can produce at least one combination.
     *
     * @throws IllegalArgumentException if the grid is empty or a parameter has no candidate values
     */
    public void validate() {
        if (this.choices.isEmpty())
            throw new IllegalArgumentException("Parameter grid is empty.");
        for (Map.Entry<String, List<Object>> entry : this.choices.entrySet()) {
            if (entry.getValue().isEmpty())
                throw new IllegalArgumentException("No candidate values specified for parameter " + entry.getKey() + ".");
        }
    }

    /**
     * @return the number of parameter combinations in the grid
     */
    public int size() {
        int retVal = (this.choices.isEmpty() ? 0 : 1);
        for (List<Object> values : this.choices.values())
            retVal *= values.size();
        return retVal;
    }

    /**
     * @return a list of all the parameter combinations in the grid
     */
    public List<HyperParameters> getCombinations() {
        this.validate();
        List<String> names = this.getNames();
        List<HyperParameters> retVal = new ArrayList<HyperParameters>(this.size());
        // This is an odometer.  The last position turns fastest.
        int[] positions = new int[names.size()];
        boolean done = false;
        while (! done) {
            Map<String, Object> map = new LinkedHashMap<String, Object>();
            for (int i = 0; i < positions.length; i++) {
                String name = names.get(i);
                map.put(name, this.choices.get(name).get(positions[i]));
            }
            retVal.add(new HyperParameters(map));
            // Advance the odometer.
            int i = positions.length - 1;
            while (i >= 0 && positions[i] == this.choices.get(names.get(i)).size() - 1) {
                positions[i] = 0;
                i--;
            }
            if (i < 0)
                done = true;
            else
                positions[i]++;
        }
        return Collections.unmodifiableList(retVal);
    }

}
