/**
 *
 */
package org.theseed.forest.decision;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * @author Bruce Parrello
 *
 */
public class TestRandomForest {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TestRandomForest.class);

    @Test
    public void testForest() {
        TabularData training = SampleData.blobs(300, 11L);
        TabularData testing = SampleData.blobs(200, 12L);
        RandomForest.Parms parms = new RandomForest.Parms().setNumTrees(25).setSeed(42L);
        parms.getTreeParms().setSelector(FeatureSelector.parse("sqrt"));
        RandomForest forest = new RandomForest(training, parms);
        assertThat(forest.getTrees().size(), equalTo(25));
        int[] predictions = forest.predict(testing.getFeatures());
        int good = 0;
        for (int i = 0; i < predictions.length; i++) {
            if (predictions[i] == testing.getLabel(i)) good++;
        }
        double accuracy = good / (double) predictions.length;
        log.info("Forest accuracy is {}.", accuracy);
        assertThat(accuracy, greaterThan(0.9));
        // The signal column should be the most important.
        INDArray importances = forest.getFeatureImportances();
        assertThat(importances.sumNumber().doubleValue(), closeTo(1.0, 1e-6));
        for (int i = 1; i < 4; i++)
            assertThat(importances.getDouble(0), greaterThan(importances.getDouble(i)));
        // Depth and size are the means over the trees.
        double depth = forest.getTrees().stream().mapToInt(DecisionTree::getMaxDepth).average().getAsDouble();
        double size = forest.getTrees().stream().mapToInt(DecisionTree::getNodeCount).average().getAsDouble();
        assertThat(forest.getDepth(), closeTo(depth, 1e-9));
        assertThat(forest.getSize(), closeTo(size, 1e-9));
    }

    @Test
    public void testReproducible() {
        TabularData training = SampleData.blobs(150, 21L);
        TabularData testing = SampleData.blobs(100, 22L);
        RandomForest.Parms parms = new RandomForest.Parms().setNumTrees(15).setSeed(1000L);
        parms.getTreeParms().setSelector(FeatureSelector.parse(2));
        RandomForest forest1 = new RandomForest(training, parms);
        RandomForest forest2 = new RandomForest(training, parms);
        assertThat(forest1.predict(testing.getFeatures()), equalTo(forest2.predict(testing.getFeatures())));
        assertThat(forest1.getSize(), equalTo(forest2.getSize()));
        assertThat(forest1.getDepth(), equalTo(forest2.getDepth()));
        for (int i = 0; i < 15; i++)
            assertThat(forest1.getTrees().get(i).describe(null), equalTo(forest2.getTrees().get(i).describe(null)));
        // The trees within a forest differ from each other.
        long distinct = forest1.getTrees().stream().map(x -> x.describe(null)).distinct().count();
        assertThat(distinct, greaterThan(1L));
    }

    @Test
    public void testBalanced() {
        // Build a data set with three times as many label-1 rows as label-0 rows.
        double[][] rows = new double[80][];
        int[] labels = new int[80];
        for (int i = 0; i < 80; i++) {
            labels[i] = (i % 4 == 0 ? 0 : 1);
            rows[i] = new double[] { labels[i] * 10.0 + (i % 7), i % 3 };
        }
        TabularData dataset = TabularData.ordered(rows, labels);
        BalancedRandomizer randomizer = new BalancedRandomizer();
        randomizer.initializeData(dataset);
        int[] sample = randomizer.getData(5L);
        assertThat(sample.length, equalTo(80));
        long zeroes = Arrays.stream(sample).filter(r -> labels[r] == 0).count();
        assertThat(zeroes, equalTo(40L));
        assertThat(randomizer.getData(5L), equalTo(sample));
        ReplacingRandomizer replacer = new ReplacingRandomizer();
        replacer.initializeData(dataset);
        int[] sample2 = replacer.getData(5L);
        assertThat(sample2.length, equalTo(80));
        for (int r : sample2)
            assertThat(r, allOf(greaterThanOrEqualTo(0), lessThan(80)));
        RandomForest.Parms parms = new RandomForest.Parms().setNumTrees(10).setMethod(RandomForest.Method.BALANCED);
        RandomForest forest = new RandomForest(dataset, parms);
        int[] predictions = forest.predict(Nd4j.create(new double[][] { { 2.0, 1.0 }, { 13.0, 0.0 } }));
        assertThat(predictions, equalTo(new int[] { 0, 1 }));
    }

    @Test
    public void testParms() {
        RandomForest.Parms parms = new RandomForest.Parms();
        assertThat(parms.getNumTrees(), equalTo(100));
        assertThat(parms.getMethod(), equalTo(RandomForest.Method.RANDOM));
        assertThat(parms.configure(RandomForest.Parms.N_ESTIMATORS, "12"), equalTo(true));
        assertThat(parms.getNumTrees(), equalTo(12));
        parms.configure(RandomForest.Parms.METHOD, "balanced");
        assertThat(parms.getMethod(), equalTo(RandomForest.Method.BALANCED));
        parms.configure(TreeParms.SEED, 99L);
        assertThat(parms.getSeed(), equalTo(99L));
        assertThat(parms.configure(TreeParms.MAX_DEPTH, 3), equalTo(true));
        assertThat(parms.getTreeParms().getMaxDepth(), equalTo(3));
        assertThat(parms.configure("learningRate", 0.1), equalTo(false));
        assertThrows(IllegalArgumentException.class, () -> parms.configure(RandomForest.Parms.METHOD, "boosted"));
        assertThrows(IllegalArgumentException.class, () -> parms.configure(RandomForest.Parms.N_ESTIMATORS, 0));
        // The forest keeps its own copy of the parameters.
        RandomForest forest = new RandomForest(parms);
        parms.setNumTrees(50);
        assertThat(forest.getParms().getNumTrees(), equalTo(12));
    }

    @Test
    public void testErrors() {
        RandomForest forest = new RandomForest(new RandomForest.Parms().setNumTrees(9));
        assertThrows(IllegalStateException.class, () -> forest.predict(Nd4j.create(new double[][] { { 1, 2 } })));
        forest.fit(SampleData.sixRows());
        assertThat(forest.getTrees().size(), equalTo(9));
        assertThrows(IllegalArgumentException.class, () -> forest.predict(Nd4j.create(new double[][] { { 1 } })));
        int[] predictions = forest.predict(Nd4j.create(new double[][] { { 1, 0 }, { 6, 1 } }));
        assertThat(predictions, equalTo(new int[] { 0, 1 }));
    }

}
