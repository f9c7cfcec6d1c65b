package term.chess.engine.bot;

public interface Inspectable extends Engine {
    EngineInfo info();
}
