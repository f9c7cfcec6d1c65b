package term.chess.engine.search;

import term.chess.engine.common.Difficulty;
import term.chess.engine.search.evaluator.EvalWeights;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of one minimax engine instance.
 */
public final class SearchConfig {
    public static final int MIN_DEPTH = 1;
    public static final int MAX_DEPTH = 20;

    public static final String DEPTH_RANGE_MESSAGE = "search depth must be " + MIN_DEPTH + "-" + MAX_DEPTH;
    public static final String TIME_LIMIT_MESSAGE = "time limit must be positive";

    public final Difficulty difficulty;
    public final int maxDepth;
    public final Duration timeLimit;
    public final EvalWeights weights;

    private SearchConfig(Builder b) {
        this.difficulty = b.difficulty;
        this.maxDepth = b.maxDepth;
        this.timeLimit = b.timeLimit;
        this.weights = b.weights;
    }

    /**
     * Default settings of a searching tier: medium searches 4 plies for 4 s, hard 6 plies for 8 s.
     *
     * @throws IllegalArgumentException for {@link Difficulty#EASY}, which plays random moves
     */
    public static SearchConfig defaults(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> throw new IllegalArgumentException("invalid difficulty for minimax: " + difficulty + " (expected Medium or Hard)");
            case MEDIUM -> new Builder().difficulty(Difficulty.MEDIUM).maxDepth(4).timeLimit(Duration.ofSeconds(4)).build();
            case HARD -> new Builder().difficulty(Difficulty.HARD).maxDepth(6).timeLimit(Duration.ofSeconds(8)).build();
        };
    }

    public static boolean isValidDepth(int depth) {
        return depth >= MIN_DEPTH && depth <= MAX_DEPTH;
    }

    public static boolean isValidTimeLimit(Duration timeLimit) {
        return timeLimit != null && !timeLimit.isNegative() && !timeLimit.isZero();
    }

    public Builder toBuilder() {
        return new Builder().difficulty(difficulty).maxDepth(maxDepth).timeLimit(timeLimit).weights(weights);
    }

    @Override
    public String toString() {
        return "SearchConfig[difficulty=" + difficulty + ", maxDepth=" + maxDepth
                + ", timeLimit=" + timeLimit + ", weights=" + weights + "]";
    }

    public static class Builder {
        private Difficulty difficulty = Difficulty.MEDIUM;
        private int maxDepth = 4;
        private Duration timeLimit = Duration.ofSeconds(4);
        private EvalWeights weights = EvalWeights.DEFAULT;

        public Builder difficulty(Difficulty v){difficulty=v;return this;}
        public Builder maxDepth(int v){maxDepth=v;return this;}
        public Builder timeLimit(Duration v){timeLimit=v;return this;}
        public Builder weights(EvalWeights v){weights=v;return this;}

        /** @throws IllegalArgumentException when the depth or the time limit is out of range */
        public SearchConfig build() {
            Objects.requireNonNull(difficulty, "difficulty");
            Objects.requireNonNull(weights, "weights");
            if (!isValidDepth(maxDepth)) {
                throw new IllegalArgumentException(DEPTH_RANGE_MESSAGE + ", got " + maxDepth);
            }
            if (!isValidTimeLimit(timeLimit)) {
                throw new IllegalArgumentException(TIME_LIMIT_MESSAGE + ", got " + timeLimit);
            }
            return new SearchConfig(this);
        }
    }
}
