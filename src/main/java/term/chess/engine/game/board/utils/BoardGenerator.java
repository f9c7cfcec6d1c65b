package term.chess.engine.game.board.utils;

import term.chess.engine.game.Game;
import term.chess.engine.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private BoardGenerator() {}

    public static Game newStandardGameBoard() {
        return FENUtils.getBoardFrom(STANDARD_GAME);
    }

    public static Game from(String fen) {
        return FENUtils.getBoardFrom(fen);
    }
}
