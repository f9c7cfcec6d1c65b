package term.chess.engine.bot;

import term.chess.engine.game.Game;

import java.util.List;

// For engines that want the positions leading to the current one, oldest first
public interface Stateful extends Engine {
    void setPositionHistory(List<Game> history);
}
