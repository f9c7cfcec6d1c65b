package term.chess.engine.bot;

public class NoLegalMovesException extends EngineException {
    public NoLegalMovesException(String fen) {
        super("no legal moves available in " + fen);
    }
}
