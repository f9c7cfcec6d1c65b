package term.chess.engine.bot;

public class EngineClosedException extends EngineException {
    public EngineClosedException(String engineName) {
        super(engineName + ": engine is closed");
    }
}
