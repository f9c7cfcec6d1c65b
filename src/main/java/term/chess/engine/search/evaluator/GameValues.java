package term.chess.engine.search.evaluator;

public final class GameValues {
    public static final double CHECKMATE_VALUE = 10000.0;
    public static final double DRAW_VALUE = 0.0;
    // Anything at or beyond this magnitude is a mate score
    public static final double MATE_THRESHOLD = CHECKMATE_VALUE - 1.0;

    private GameValues() {}
}
