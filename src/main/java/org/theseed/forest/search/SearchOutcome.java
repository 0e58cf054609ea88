/**
 *
 */
package org.theseed.forest.search;

import java.util.Collections;
import java.util.List;

import org.theseed.forest.decision.IClassifier;

/**
 * This object contains the result of a grid search:  the winning hyperparameters, the model trained with them
 * on the full training set, and the cross-validation results for every combination.  If no combination met the
 * acceptance threshold, the winner is the most accurate combination and the fallback flag is set.
 *
 * @author Bruce Parrello
 *
 */
public class SearchOutcome {

    // FIELDS
    /** winning result */
    private final SearchResult best;
    /** final model */
    private final IClassifier model;
    /** results for all combinations, in grid order */
    private final List<SearchResult> results;
    /** TRUE if no combination met the acceptance threshold */
    private final boolean fallback;
    /** summary report */
    private final String report;

    /**
     * Construct a search outcome.
     *
     * @param best		winning result
     * @param model		model trained on the full training set with the winning parameters
     * @param results	results for all combinations
     * @param fallback	TRUE if no combination met the acceptance threshold
     * @param report	summary report
     */
    protected SearchOutcome(SearchResult best, IClassifier model, List<SearchResult> results, boolean fallback,
            String report) {
        this.best = best;
        this.model = model;
        this.results = Collections.unmodifiableList(results);
        this.fallback = fallback;
        this.report = report;
    }

    /**
     * @return the winning hyperparameter combination
     */
    public HyperParameters getParms() {
        return this.best.getParms();
    }

    /**
     * @return the winning result
     */
    public SearchResult getBest() {
        return this.best;
    }

    /**
     * @return the model trained with the winning parameters
     */
    public IClassifier getModel() {
        return this.model;
    }

    /**
     * @return the results for all combinations, in grid order
     */
    public List<SearchResult> getResults() {
        return this.results;
    }

    /**
     * @return TRUE if no combination met the acceptance threshold and the most accurate one was used instead
     */
    public boolean isFallback() {
        return this.fallback;
    }

    /**
     * @return a printable summary of the search
     */
    public String getReport() {
        return this.report;
    }

}
