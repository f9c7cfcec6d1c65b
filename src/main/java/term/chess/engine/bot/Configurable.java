package term.chess.engine.bot;

public interface Configurable extends Engine {
    /**
     * Applies every non-null field of {@code config}, or none of them.
     *
     * @throws InvalidConfigurationException when a field is out of range; the engine is then left unchanged
     */
    void configure(MinimaxConfig config);
}
