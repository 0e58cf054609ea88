/**
 *
 */
package org.theseed.forest.decision;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * This randomizer selects samples balanced to have an equal number of members of each class.  Since some classes
 * may have fewer members than required to fill the necessary slots, the choice method is randomization with
 * replacement.  The total sample size is the training set size, rounded up to a multiple of the class count.
 *
 * @author Bruce Parrello
 *
 */
public class BalancedRandomizer implements IRandomizer {

    // FIELDS
    /** list of row indices for each nonempty class, in label order */
    private List<int[]> outcomeSets;
    /** number of examples to choose for each class */
    private int oRows;

    @Override
    public void initializeData(TabularData trainingSet) {
        // Split the row indices into outcome groups.
        SortedMap<Integer, List<Integer>> groups = new TreeMap<Integer, List<Integer>>();
        for (int i = 0; i < trainingSet.size(); i++)
            groups.computeIfAbsent(trainingSet.getLabel(i), k -> new ArrayList<Integer>()).add(i);
        this.outcomeSets = new ArrayList<int[]>(groups.size());
        for (List<Integer> group : groups.values())
            this.outcomeSets.add(group.stream().mapToInt(Integer::intValue).toArray());
        // Determine the number of rows to use for each outcome.
        int nSets = this.outcomeSets.size();
        this.oRows = (trainingSet.size() + nSets - 1) / nSets;
    }

    @Override
    public int[] getData(long seed) {
        Random rand = new Random(seed);
        int[] retVal = new int[this.oRows * this.outcomeSets.size()];
        int n = 0;
        for (int[] outcomeSet : this.outcomeSets) {
            for (int i = 0; i < this.oRows; i++)
                retVal[n++] = outcomeSet[rand.nextInt(outcomeSet.length)];
        }
        return retVal;
    }

}
