/**
 *
 */
package org.theseed.forest.sample;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.theseed.forest.decision.TabularData;

/**
 * @author Bruce Parrello
 *
 */
public class TestStratifiedSplitter {

    @Test
    public void testProportions() {
        // 60 rows of stratum 0, 30 of stratum 1, 10 of stratum 2.
        int[] strata = new int[100];
        for (int i = 0; i < 100; i++)
            strata[i] = (i < 60 ? 0 : (i < 90 ? 1 : 2));
        StratifiedSplitter splitter = new StratifiedSplitter(0.25, 42L);
        StratifiedSplitter.Result result = splitter.split(strata);
        int[] test = result.getTest();
        int[] train = result.getTrain();
        // round(15.0) + round(7.5) + round(2.5) = 15 + 8 + 3
        assertThat(test.length, equalTo(26));
        assertThat(train.length, equalTo(74));
        assertThat(countStratum(test, strata, 0), equalTo(15L));
        assertThat(countStratum(test, strata, 1), equalTo(8L));
        assertThat(countStratum(test, strata, 2), equalTo(3L));
        int[] all = IntStream.concat(Arrays.stream(test), Arrays.stream(train)).sorted().toArray();
        assertThat(all, equalTo(IntStream.range(0, 100).toArray()));
        // The same seed gives the same split.
        StratifiedSplitter.Result again = new StratifiedSplitter(0.25, 42L).split(strata);
        assertThat(again.getTest(), equalTo(test));
        assertThat(again.getTrain(), equalTo(train));
    }

    /**
     * @return the number of rows in the specified stratum
     *
     * @param rows		row indices to check
     * @param strata	stratum of each row
     * @param s			stratum of interest
     */
    private static long countStratum(int[] rows, int[] strata, int s) {
        return Arrays.stream(rows).filter(r -> strata[r] == s).count();
    }

    @Test
    public void testDataSplit() {
        double[][] rows = new double[20][];
        int[] labels = new int[20];
        for (int i = 0; i < 20; i++) {
            rows[i] = new double[] { i, i * 2.0 };
            labels[i] = i % 2;
        }
        TabularData dataset = TabularData.ordered(rows, labels);
        TabularData[] parts = new StratifiedSplitter(0.2, 7L).split(dataset);
        assertThat(parts[0].size(), equalTo(16));
        assertThat(parts[1].size(), equalTo(4));
        assertThat(parts[1].getLabelSet(), contains(0, 1));
        // Each row keeps its own label.
        double[][] testRows = parts[1].toMatrix();
        for (int i = 0; i < testRows.length; i++)
            assertThat(parts[1].getLabel(i), equalTo(((int) testRows[i][0]) % 2));
    }

    @Test
    public void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> new StratifiedSplitter(0.0, 1L));
        assertThrows(IllegalArgumentException.class, () -> new StratifiedSplitter(1.0, 1L));
        TabularData tiny = TabularData.ordered(new double[][] { { 1 }, { 2 } }, new int[] { 0, 1 });
        // Each stratum has one row, which rounds to no testing rows.
        assertThrows(IllegalArgumentException.class, () -> new StratifiedSplitter(0.3, 1L).split(tiny));
    }

}
