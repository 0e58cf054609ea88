/**
 *
 */
package org.theseed.forest.decision;

import java.util.Random;

/**
 * This randomly selects data rows with replacement, producing a bootstrap sample the same size as the
 * training set.
 *
 * @author Bruce Parrello
 *
 */
public class ReplacingRandomizer implements IRandomizer {

    // FIELDS
    /** number of examples in the training set */
    private int nSize;

    @Override
    public void initializeData(TabularData trainingSet) {
        this.nSize = trainingSet.size();
    }

    @Override
    public int[] getData(long seed) {
        Random rand = new Random(seed);
        return rand.ints(this.nSize, 0, this.nSize).toArray();
    }

}
