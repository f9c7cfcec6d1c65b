package term.chess.engine.bot;

public class InvalidConfigurationException extends EngineException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
