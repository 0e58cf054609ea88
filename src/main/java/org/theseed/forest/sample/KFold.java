/**
 *
 */
package org.theseed.forest.sample;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * This object partitions a set of row indices into folds for cross-validation.  The indices are optionally
 * shuffled once, then divided into contiguous blocks whose sizes differ by at most one (the first blocks
 * get the extra rows).  Each fold uses one block for validation and all the remaining rows, in their
 * original relative order, for training.
 *
 * @author Bruce Parrello
 *
 */
public class KFold implements Iterable<Fold> {

    // FIELDS
    /** list of folds */
    private final List<Fold> folds;

    /**
     * Partition a set of rows into folds without shuffling.
     *
     * @param n		number of rows
     * @param k		number of folds
     */
    public KFold(int n, int k) {
        this(n, k, null);
    }

    /**
     * Partition a set of rows into folds after shuffling with the specified seed.
     *
     * @param n		number of rows
     * @param k		number of folds
     * @param seed	seed for shuffling
     */
    public KFold(int n, int k, long seed) {
        this(n, k, new Random(seed));
    }

    /**
     * Partition a set of rows into folds.
     *
     * @param n		number of rows
     * @param k		number of folds
     * @param rand	random-number generator for shuffling, or NULL to keep the original order
     */
    private KFold(int n, int k, Random rand) {
        if (k < 2)
            throw new IllegalArgumentException("Invalid fold count " + k + ".  Must be 2 or greater.");
        if (k > n)
            throw new IllegalArgumentException("Fold count " + k + " exceeds the number of rows (" + n + ").");
        int[] order = Shuffler.indices(n, rand);
        this.folds = new ArrayList<Fold>(k);
        int base = n / k;
        int extra = n % k;
        int start = 0;
        for (int i = 0; i < k; i++) {
            int blockSize = base + (i < extra ? 1 : 0);
            int end = start + blockSize;
            int[] test = new int[blockSize];
            int[] train = new int[n - blockSize];
            System.arraycopy(order, start, test, 0, blockSize);
            System.arraycopy(order, 0, train, 0, start);
            System.arraycopy(order, end, train, start, n - end);
            this.folds.add(new Fold(i, train, test));
            start = end;
        }
    }

    @Override
    public Iterator<Fold> iterator() {
        return this.folds.iterator();
    }

    /**
     * @return the number of folds
     */
    public int size() {
        return this.folds.size();
    }

    /**
     * @return the specified fold
     *
     * @param i		index of the desired fold
     */
    public Fold get(int i) {
        return this.folds.get(i);
    }

}
