package term.chess.engine.search.evaluator;

/**
 * Multipliers applied to the evaluation layers. Terminal scores are never weighted.
 */
public record EvalWeights(double material, double pieceSquare, double mobility, double kingSafety) {
    public static final EvalWeights DEFAULT = new EvalWeights(1.0, 1.0, 1.0, 1.0);
}
