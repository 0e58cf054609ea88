/**
 *
 */
package org.theseed.forest.decision;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
public class TestImpurity {

    @Test
    public void testPureSets() {
        int[][] pure = new int[][] { { 5 }, { 0, 7 }, { 0, 0, 3 }, { 1 } };
        for (Impurity type : Impurity.values()) {
            for (int[] counts : pure)
                assertThat(type.toString(), type.compute(counts), equalTo(0.0));
        }
    }

    @Test
    public void testGini() {
        int[][] pairs = new int[][] { { 1, 3 }, { 3, 7 }, { 5, 5 }, { 2, 9 } };
        for (int[] counts : pairs) {
            double p = counts[0] / (double) (counts[0] + counts[1]);
            assertThat(Impurity.GINI.compute(counts), equalTo(2.0 * p * (1.0 - p)));
        }
        // Two classes that are not labels 0 and 1.
        double p = 2 / 6.0;
        assertThat(Impurity.GINI.compute(new int[] { 0, 2, 0, 4 }), equalTo(2.0 * p * (1.0 - p)));
        // Three classes use the general formula.
        assertThat(Impurity.GINI.compute(new int[] { 1, 1, 1 }), closeTo(2.0 / 3.0, 1e-12));
        assertThat(Impurity.GINI.compute(new int[] { 2, 1, 1 }), closeTo(1.0 - 0.25 - 0.0625 - 0.0625, 1e-12));
    }

    @Test
    public void testEntropy() {
        assertThat(Impurity.ENTROPY.compute(new int[] { 4, 4 }), closeTo(0.5, 1e-12));
        assertThat(Impurity.ENTROPY.compute(new int[] { 1, 1, 1, 1 }), closeTo(1.0, 1e-12));
        double p = 0.25;
        double expected = -(p * Math.log(p) + (1 - p) * Math.log(1 - p)) / Math.log(2.0) / 2.0;
        assertThat(Impurity.ENTROPY.compute(new int[] { 1, 0, 3 }), closeTo(expected, 1e-12));
    }

    @Test
    public void testErrorAndSqrt() {
        assertThat(Impurity.ERROR.compute(new int[] { 1, 3 }), closeTo(0.25, 1e-12));
        assertThat(Impurity.ERROR.compute(new int[] { 2, 1, 1 }), closeTo(0.5, 1e-12));
        assertThat(Impurity.SQRT.compute(new int[] { 1, 3 }), closeTo(Math.sqrt(0.25 * 0.75), 1e-12));
        assertThat(Impurity.SQRT.compute(new int[] { 5, 5 }), closeTo(0.5, 1e-12));
    }

    @Test
    public void testParse() {
        assertThat(Impurity.parse("gini"), equalTo(Impurity.GINI));
        assertThat(Impurity.parse("Entropy"), equalTo(Impurity.ENTROPY));
        assertThat(Impurity.parse("ERROR"), equalTo(Impurity.ERROR));
        assertThat(Impurity.parse("sqrt"), equalTo(Impurity.SQRT));
        assertThrows(IllegalArgumentException.class, () -> Impurity.parse("variance"));
    }

}
