package term.chess.engine.bot;

import java.time.Duration;

/**
 * Partial update for a {@link Configurable} engine. {@code null} fields keep the engine's current value.
 * Depth must be within 1-20 and the time limit strictly positive; weights are free.
 */
public record MinimaxConfig(Integer searchDepth, Duration timeLimit,
                            Double materialWeight, Double pieceSquareWeight,
                            Double mobilityWeight, Double kingSafetyWeight) {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Integer searchDepth;
        private Duration timeLimit;
        private Double materialWeight;
        private Double pieceSquareWeight;
        private Double mobilityWeight;
        private Double kingSafetyWeight;

        public Builder searchDepth(int v){searchDepth=v;return this;}
        public Builder timeLimit(Duration v){timeLimit=v;return this;}
        public Builder materialWeight(double v){materialWeight=v;return this;}
        public Builder pieceSquareWeight(double v){pieceSquareWeight=v;return this;}
        public Builder mobilityWeight(double v){mobilityWeight=v;return this;}
        public Builder kingSafetyWeight(double v){kingSafetyWeight=v;return this;}

        public MinimaxConfig build() {
            return new MinimaxConfig(searchDepth, timeLimit, materialWeight, pieceSquareWeight, mobilityWeight, kingSafetyWeight);
        }
    }
}
