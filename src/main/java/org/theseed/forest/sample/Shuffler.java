/**
 *
 */
package org.theseed.forest.sample;

import java.util.Random;
import java.util.stream.IntStream;

/**
 * This class contains utilities for shuffling arrays of row indices.
 *
 * @author Bruce Parrello
 *
 */
public class Shuffler {

    /**
     * Shuffle an array of indices in place.
     *
     * @param array		array to shuffle
     * @param rand		random-number generator to use
     */
    public static void shuffle(int[] array, Random rand) {
        for (int i = array.length - 1; i > 0; i--) {
            int j = rand.nextInt(i + 1);
            int buffer = array[i];
            array[i] = array[j];
            array[j] = buffer;
        }
    }

    /**
     * @return an array containing the indices from 0 to n - 1, optionally shuffled
     *
     * @param n			number of indices
     * @param rand		random-number generator to use, or NULL to leave the indices in order
     */
    public static int[] indices(int n, Random rand) {
        int[] retVal = IntStream.range(0, n).toArray();
        if (rand != null)
            shuffle(retVal, rand);
        return retVal;
    }

}
