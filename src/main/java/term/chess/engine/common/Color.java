package term.chess.engine.common;

public enum Color {
    WHITE, BLACK;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public boolean isWhite() {
        return this == WHITE;
    }

    // Rank direction pawns of this color move towards
    public int forward() {
        return this == WHITE ? 1 : -1;
    }
}
