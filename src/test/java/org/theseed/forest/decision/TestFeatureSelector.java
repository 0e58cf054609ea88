/**
 *
 */
package org.theseed.forest.decision;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
public class TestFeatureSelector {

    @Test
    public void testCounts() {
        assertThat(FeatureSelector.ALL.getCount(12), equalTo(12));
        assertThat(FeatureSelector.parse(null), sameInstance(FeatureSelector.ALL));
        assertThat(FeatureSelector.parse("All"), sameInstance(FeatureSelector.ALL));
        FeatureSelector sqrt = FeatureSelector.parse("sqrt");
        assertThat(sqrt.getCount(16), equalTo(4));
        assertThat(sqrt.getCount(10), equalTo(3));
        assertThat(sqrt.getCount(1), equalTo(1));
        FeatureSelector log2 = FeatureSelector.parse("LOG2");
        assertThat(log2.getCount(16), equalTo(4));
        assertThat(log2.getCount(2), equalTo(1));
        assertThat(log2.getCount(1), equalTo(1));
        FeatureSelector fixed = FeatureSelector.parse(3);
        assertThat(fixed.getCount(10), equalTo(3));
        assertThat(fixed.getCount(2), equalTo(2));
        assertThat(FeatureSelector.parse("5").getCount(10), equalTo(5));
        FeatureSelector fraction = FeatureSelector.parse(0.5);
        assertThat(fraction.getCount(10), equalTo(5));
        assertThat(fraction.getCount(1), equalTo(1));
        assertThat(FeatureSelector.parse("0.25").getCount(8), equalTo(2));
        assertThat(FeatureSelector.parse(fraction), sameInstance(fraction));
    }

    @Test
    public void testSelection() {
        FeatureSelector fixed = new FeatureSelector.Fixed(3);
        Random rand = new Random(42L);
        for (int i = 0; i < 20; i++) {
            int[] features = fixed.getFeaturesToUse(8, rand);
            assertThat(features.length, equalTo(3));
            assertThat(Arrays.stream(features).distinct().count(), equalTo(3L));
            for (int f : features)
                assertThat(f, allOf(greaterThanOrEqualTo(0), lessThan(8)));
        }
        assertThat(FeatureSelector.ALL.getFeaturesToUse(4, rand), equalTo(new int[] { 0, 1, 2, 3 }));
        // The same seed gives the same selection.
        int[] first = fixed.getFeaturesToUse(8, new Random(99L));
        int[] second = fixed.getFeaturesToUse(8, new Random(99L));
        assertThat(first, equalTo(second));
    }

    @Test
    public void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> FeatureSelector.parse("half"));
        assertThrows(IllegalArgumentException.class, () -> FeatureSelector.parse(0));
        assertThrows(IllegalArgumentException.class, () -> FeatureSelector.parse(1.5));
        assertThrows(IllegalArgumentException.class, () -> FeatureSelector.parse("0.0"));
    }

}
