/**
 *
 */
package org.theseed.forest.decision;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
public class TestSplitFinders {

    /**
     * @return an array of row indices from 0 to n - 1
     */
    private static int[] allRows(int n) {
        return IntStream.range(0, n).toArray();
    }

    @Test
    public void testThresholds() {
        double[][] data = new double[][] { { 1 }, { 2 }, { 3 }, { 4 }, { 5 }, { 6 } };
        int[] labels = new int[] { 0, 0, 1, 0, 1, 1 };
        SplitPointFinder finder = SplitPointFinder.create(ColumnType.ORDERED, Impurity.GINI, 10, 2);
        double before = Impurity.GINI.compute(new int[] { 3, 3 });
        Splitter split = finder.computeSplit(0, data, labels, allRows(6), before);
        assertThat(split, not(sameInstance(Splitter.NULL)));
        assertThat(split.getFeature(), equalTo(0));
        assertThat(split.getType(), equalTo(ColumnType.ORDERED));
        // Thresholds 2 and 4 both score 0.25; the first one found is kept.
        assertThat(split.getLimit(), equalTo(2.0));
        assertThat(split.getScore(), closeTo(0.25, 1e-12));
        assertThat(split.getGain(), closeTo(0.25, 1e-12));
        assertThat(split.getLeftCount(), equalTo(2));
        assertThat(split.getRightCount(), equalTo(4));
        assertThat(split.splitsLeft(new double[] { 2.0 }), equalTo(true));
        assertThat(split.splitsLeft(new double[] { 2.5 }), equalTo(false));
    }

    @Test
    public void testPercentileCandidates() {
        double[] values = IntStream.range(0, 100).asDoubleStream().toArray();
        SplitPointFinder.Thresholds finder = new SplitPointFinder.Thresholds(Impurity.GINI, 10, 2);
        double[] candidates = finder.getCandidates(values);
        assertThat(candidates.length, equalTo(10));
        assertThat(candidates[0], equalTo(0.0));
        assertThat(candidates[1], closeTo(11.0, 1e-9));
        assertThat(candidates[9], equalTo(99.0));
        // A few distinct values are used as-is.
        double[] few = new double[] { 3.0, 1.0, 3.0, 2.0 };
        assertThat(finder.getCandidates(few), equalTo(new double[] { 1.0, 2.0, 3.0 }));
        // Heavily repeated values produce duplicate percentiles, which are removed.
        double[] lumpy = new double[50];
        for (int i = 0; i < lumpy.length; i++)
            lumpy[i] = (i < 40 ? 0.0 : i);
        double[] lumpyCandidates = finder.getCandidates(lumpy);
        assertThat(lumpyCandidates.length, lessThan(10));
        assertThat(lumpyCandidates[0], equalTo(0.0));
        assertThat(lumpyCandidates[1], greaterThan(0.0));
    }

    @Test
    public void testCategories() {
        // Twelve categories; category 11 is the most common, categories 9 and 10 the least.
        double[] values = new double[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 11, 11, 0, 1, 2, 3, 4, 5, 6, 7, 8 };
        SplitPointFinder.Categories finder = new SplitPointFinder.Categories(Impurity.GINI, 10, 2);
        double[] candidates = finder.getCandidates(values);
        assertThat(candidates.length, equalTo(10));
        assertThat(candidates[0], equalTo(11.0));
        for (double candidate : candidates)
            assertThat(candidate, not(anyOf(equalTo(9.0), equalTo(10.0))));
        // Check the equality split.
        double[][] data = new double[][] { { 7 }, { 7 }, { 3 }, { 5 }, { 7 }, { 3 } };
        int[] labels = new int[] { 1, 1, 0, 0, 1, 0 };
        SplitPointFinder catFinder = SplitPointFinder.create(ColumnType.UNORDERED, Impurity.ENTROPY, 10, 2);
        Splitter split = catFinder.computeSplit(0, data, labels, allRows(6), 0.5);
        assertThat(split.getType(), equalTo(ColumnType.UNORDERED));
        assertThat(split.getLimit(), equalTo(7.0));
        assertThat(split.getScore(), equalTo(0.0));
        assertThat(split.splitsLeft(new double[] { 7.0 }), equalTo(true));
        assertThat(split.splitsLeft(new double[] { 8.0 }), equalTo(false));
    }

    @Test
    public void testNoSplit() {
        double[][] data = new double[][] { { 4 }, { 4 }, { 4 }, { 4 } };
        int[] labels = new int[] { 0, 1, 0, 1 };
        for (ColumnType type : ColumnType.values()) {
            SplitPointFinder finder = SplitPointFinder.create(type, Impurity.GINI, 10, 2);
            Splitter split = finder.computeSplit(0, data, labels, allRows(4), 0.5);
            assertThat(split, sameInstance(Splitter.NULL));
        }
        // A subset of rows is respected.
        double[][] data2 = new double[][] { { 1 }, { 2 }, { 3 }, { 4 } };
        SplitPointFinder finder = SplitPointFinder.create(ColumnType.ORDERED, Impurity.GINI, 10, 2);
        Splitter split = finder.computeSplit(0, data2, labels, new int[] { 1, 2 }, 0.5);
        assertThat(split.getLimit(), equalTo(2.0));
        assertThat(split.getScore(), equalTo(0.0));
    }

}
