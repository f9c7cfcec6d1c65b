package term.chess.engine.game;

import term.chess.engine.movegen.Move;

public class IllegalMoveException extends RuntimeException {
    private final transient Move move;

    public IllegalMoveException(Move move, String fen) {
        super("Illegal move " + move + " in position " + fen);
        this.move = move;
    }

    public Move move() {
        return move;
    }
}
