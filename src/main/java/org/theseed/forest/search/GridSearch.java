/**
 *
 */
package org.theseed.forest.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.text.TextStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.forest.decision.IClassifier;
import org.theseed.forest.decision.TabularData;
import org.theseed.forest.decision.TreeParms;
import org.theseed.forest.sample.Fold;
import org.theseed.forest.sample.KFold;

/**
 * This class performs a cross-validated grid search for the best hyperparameters of a model.  Every combination
 * in the parameter grid is evaluated by k-fold cross-validation, with a fresh model trained for each fold.  The
 * winner is the most accurate combination among those meeting the acceptance threshold, with ties going to the
 * shallower and then the smaller model.  If no combination meets the threshold, the most accurate combination
 * wins and the outcome is flagged as a fallback.  The winning parameters are then used to train a final model on
 * the whole training set.
 *
 * Each (combination, fold) pair is evaluated independently in a parallel stream.  The model for each combination
 * gets its own seed, drawn in sequence from the search seed before the parallel phase begins.
 *
 * @author Bruce Parrello
 *
 */
public class GridSearch {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(GridSearch.class);
    /** type of model to build */
    private final ModelType modelType;
    /** parameters held fixed across the grid */
    private HyperParameters fixedParms;
    /** number of folds */
    private int foldK;
    /** minimum acceptable accuracy */
    private double acceptLimit;
    /** TRUE to shuffle the rows before dividing them into folds */
    private boolean shuffle;
    /** random-number seed */
    private long seed;

    /**
     * This object contains the evaluation of one combination on one fold.
     */
    private static class FoldScore {

        /** validation accuracy */
        private final double accuracy;
        /** model depth */
        private final double depth;
        /** model size */
        private final double size;

        private FoldScore(double accuracy, double depth, double size) {
            this.accuracy = accuracy;
            this.depth = depth;
            this.size = size;
        }

    }

    /**
     * Construct a grid search with default settings (5 folds, shuffled, no acceptance threshold).
     *
     * @param modelType		type of model to search
     */
    public GridSearch(ModelType modelType) {
        this.modelType = modelType;
        this.fixedParms = HyperParameters.EMPTY;
        this.foldK = 5;
        this.acceptLimit = 0.0;
        this.shuffle = true;
        this.seed = 0;
    }

    /**
     * Specify the parameters held fixed across the grid.  Grid values override these.
     *
     * @param fixedParms	fixed parameters
     */
    public GridSearch setFixedParms(HyperParameters fixedParms) {
        this.fixedParms = fixedParms;
        return this;
    }

    /**
     * Specify the number of folds.
     *
     * @param foldK		number of folds to use
     */
    public GridSearch setFolds(int foldK) {
        if (foldK < 2)
            throw new IllegalArgumentException("Invalid k-fold " + foldK + ".  Must be 2 or greater.");
        this.foldK = foldK;
        return this;
    }

    /**
     * Specify the minimum acceptable accuracy.
     *
     * @param acceptLimit	accuracy a combination must reach to be preferred on complexity
     */
    public GridSearch setAcceptLimit(double acceptLimit) {
        this.acceptLimit = acceptLimit;
        return this;
    }

    /**
     * Specify whether the rows should be shuffled before forming the folds.
     *
     * @param shuffle	TRUE to shuffle
     */
    public GridSearch setShuffle(boolean shuffle) {
        this.shuffle = shuffle;
        return this;
    }

    /**
     * Specify the random-number seed.
     *
     * @param seed		seed for fold shuffling and model randomization
     */
    public GridSearch setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * Run the grid search.
     *
     * @param dataset	training set
     * @param grid		parameter grid to search
     *
     * @return the outcome of the search, including the final model
     *
     * @throws IllegalArgumentException if the grid is empty, a parameter is invalid, or there are too few rows
     */
    public SearchOutcome run(TabularData dataset, ParameterGrid grid) {
        grid.validate();
        List<HyperParameters> combos = grid.getCombinations();
        final int nCombos = combos.size();
        final int k = this.foldK;
        KFold folds = (this.shuffle ? new KFold(dataset.size(), k, this.seed) : new KFold(dataset.size(), k));
        // Compute the full parameter set for each combination.
        long[] seeds = new Random(this.seed).longs(nCombos).toArray();
        List<HyperParameters> fullParms = new ArrayList<HyperParameters>(nCombos);
        for (int c = 0; c < nCombos; c++) {
            HyperParameters parms = this.fixedParms.merge(combos.get(c))
                    .merge(HyperParameters.of(TreeParms.SEED, seeds[c]));
            // Insure the parameters are valid before any training starts.
            this.modelType.create(parms);
            fullParms.add(parms);
        }
        // Build the training and validation sets for each fold.
        List<TabularData[]> foldData = new ArrayList<TabularData[]>(k);
        for (Fold fold : folds)
            foldData.add(new TabularData[] { dataset.subset(fold.getTrain()), dataset.subset(fold.getTest()) });
        log.info("Searching {} parameter combinations with {}-fold cross-validation on {} rows.", nCombos, k,
                dataset.size());
        long start = System.currentTimeMillis();
        // Evaluate every combination on every fold.  An exception in any unit aborts the search.
        List<FoldScore> scores = IntStream.range(0, nCombos * k).parallel()
                .mapToObj(u -> this.evaluate(u / k, fullParms.get(u / k), foldData.get(u % k)))
                .collect(Collectors.toList());
        // Aggregate the scores for each combination.
        List<SearchResult> results = new ArrayList<SearchResult>(nCombos);
        for (int c = 0; c < nCombos; c++) {
            SummaryStatistics accuracy = new SummaryStatistics();
            SummaryStatistics depth = new SummaryStatistics();
            SummaryStatistics size = new SummaryStatistics();
            double[] foldAccuracies = new double[k];
            for (int f = 0; f < k; f++) {
                FoldScore score = scores.get(c * k + f);
                accuracy.addValue(score.accuracy);
                depth.addValue(score.depth);
                size.addValue(score.size);
                foldAccuracies[f] = score.accuracy;
            }
            SearchResult result = new SearchResult(c, combos.get(c), accuracy.getMean(), depth.getMean(),
                    size.getMean(), foldAccuracies);
            log.debug("Result {}: {}.", c + 1, result);
            results.add(result);
        }
        log.info("Cross-validation completed in {} seconds.", (System.currentTimeMillis() - start) / 1000.0);
        // Choose the winner.
        SearchResult best = this.selectBest(results);
        boolean fallback = (best == null);
        if (fallback) {
            best = selectMostAccurate(results);
            log.warn("No parameter combination reached accuracy {}.  Using most accurate combination [{}] with accuracy {}.",
                    this.acceptLimit, best.getParms(), best.getAccuracy());
        } else
            log.info("Best parameter combination is [{}] with accuracy {}.", best.getParms(), best.getAccuracy());
        // Train the final model.
        IClassifier model = this.modelType.create(fullParms.get(best.getIdx()));
        model.fit(dataset);
        String report = this.buildReport(grid.getNames(), results, best, fallback);
        return new SearchOutcome(best, model, results, fallback, report);
    }

    /**
     * Evaluate a parameter combination on a single fold.  This runs in parallel with the other evaluations,
     * so it must not modify any shared state.
     *
     * @param combo		index of the combination
     * @param parms		full parameter set for the model
     * @param data		two-element array containing the training set and the validation set
     *
     * @return the evaluation score
     */
    private FoldScore evaluate(int combo, HyperParameters parms, TabularData[] data) {
        IClassifier model = this.modelType.create(parms);
        model.fit(data[0]);
        TabularData testSet = data[1];
        int[] predictions = model.predict(testSet.getFeatures());
        int good = 0;
        for (int i = 0; i < predictions.length; i++) {
            if (predictions[i] == testSet.getLabel(i))
                good++;
        }
        double accuracy = good / (double) predictions.length;
        log.debug("Combination {} scored {} on {} validation rows.", combo + 1, accuracy, predictions.length);
        return new FoldScore(accuracy, model.getDepth(), model.getSize());
    }

    /**
     * @return the preferred result among those meeting the acceptance threshold, or NULL if there are none
     *
     * @param results	list of results to examine
     */
    protected SearchResult selectBest(List<SearchResult> results) {
        SearchResult retVal = null;
        for (SearchResult result : results) {
            if (result.getAccuracy() >= this.acceptLimit) {
                if (retVal == null || SearchResult.PREFERENCE.compare(result, retVal) < 0)
                    retVal = result;
            }
        }
        return retVal;
    }

    /**
     * @return the first result with the highest accuracy
     *
     * @param results	list of results to examine
     */
    protected static SearchResult selectMostAccurate(List<SearchResult> results) {
        SearchResult retVal = null;
        for (SearchResult result : results) {
            if (retVal == null || result.getAccuracy() > retVal.getAccuracy())
                retVal = result;
        }
        return retVal;
    }

    /**
     * @return a printable summary of the search results
     *
     * @param names		names of the grid parameters
     * @param results	list of results
     * @param best		winning result
     * @param fallback	TRUE if the winner was chosen by fallback
     */
    private String buildReport(List<String> names, List<SearchResult> results, SearchResult best, boolean fallback) {
        int width = 14;
        for (String name : names)
            width = Math.max(width, name.length());
        final int colWidth = width;
        String boundary = StringUtils.repeat('=', 6 + (names.size() + 3) * (colWidth + 1));
        TextStringBuilder buffer = new TextStringBuilder(boundary.length() * (results.size() + 8));
        buffer.appendNewLine();
        buffer.appendln("%s search using %d-fold cross-validation.", this.modelType.getDescription(), this.foldK);
        buffer.appendln(boundary);
        buffer.append(String.format("%4s ", "#"));
        for (String name : names)
            buffer.append(" ").append(StringUtils.leftPad(name, colWidth));
        buffer.appendln(" %" + colWidth + "s %" + colWidth + "s %" + colWidth + "s", "Accuracy", "Depth", "Nodes");
        buffer.appendln(boundary);
        for (SearchResult result : results) {
            char flag = (result == best ? '*' : ' ');
            buffer.append(String.format("%4d%c", result.getIdx() + 1, flag));
            for (String name : names)
                buffer.append(" ").append(StringUtils.leftPad(String.valueOf(result.getParms().get(name)), colWidth));
            buffer.appendln(" %" + colWidth + ".6f %" + colWidth + ".2f %" + colWidth + ".2f", result.getAccuracy(),
                    result.getDepth(), result.getSize());
        }
        buffer.appendln(boundary);
        if (fallback)
            buffer.appendln("No combination reached accuracy %4.2f; the most accurate was chosen.", this.acceptLimit);
        buffer.appendln("Best combination: %s", best.getParms());
        return buffer.toString();
    }

    /**
     * @return the number of folds
     */
    public int getFolds() {
        return this.foldK;
    }

    /**
     * @return the minimum acceptable accuracy
     */
    public double getAcceptLimit() {
        return this.acceptLimit;
    }

}
