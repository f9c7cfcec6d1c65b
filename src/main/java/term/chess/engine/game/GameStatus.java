package term.chess.engine.game;

public enum GameStatus {
    ONGOING("ongoing"),
    // The side to move is mated, the opponent wins
    CHECKMATE("checkmate"),
    STALEMATE("stalemate"),
    DRAW_INSUFFICIENT_MATERIAL("draw (insufficient material)"),
    DRAW_FIFTY_MOVE_RULE("draw (fifty-move rule)"),
    DRAW_SEVENTY_FIVE_MOVE_RULE("draw (seventy-five-move rule)"),
    DRAW_THREEFOLD_REPETITION("draw (threefold repetition)"),
    DRAW_FIVEFOLD_REPETITION("draw (fivefold repetition)");

    private final String description;

    GameStatus(String description) {
        this.description = description;
    }

    public boolean isDraw() {
        return this != ONGOING && this != CHECKMATE;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
