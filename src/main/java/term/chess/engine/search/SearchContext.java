package term.chess.engine.search;

import term.chess.engine.common.Difficulty;
import term.chess.engine.search.evaluator.EvalWeights;

/**
 * Mutable per-search state. One context belongs to one search at a time, never shared across threads.
 */
public final class SearchContext {
    public final Difficulty difficulty;
    public final EvalWeights weights;

    // Counters
    public long nodes, totalNodes;
    // Depth of the latest root search, the interrupted one after a timeout
    public int currentDepth;

    // Set by the first node that observes the deadline; the depth being searched is then discarded
    public boolean aborted;

    public SearchContext(SearchConfig cfg) {
        this(cfg.difficulty, cfg.weights);
    }

    public SearchContext(Difficulty difficulty, EvalWeights weights) {
        this.difficulty = difficulty;
        this.weights = weights;
    }

    void newDepth(int depth) {
        currentDepth = depth;
        nodes = 0;
        aborted = false;
    }
}
