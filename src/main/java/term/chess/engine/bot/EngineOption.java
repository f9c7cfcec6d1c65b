package term.chess.engine.bot;

import term.chess.engine.search.SearchConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Creation-time option for {@link EngineFactory}. Options are validated when the factory applies them.
 */
@FunctionalInterface
public interface EngineOption {
    void applyTo(EngineFactory.Settings settings);

    static EngineOption withTimeLimit(Duration timeLimit) {
        return settings -> {
            if (!SearchConfig.isValidTimeLimit(timeLimit)) {
                throw new InvalidConfigurationException(SearchConfig.TIME_LIMIT_MESSAGE + ", got " + timeLimit);
            }
            settings.timeLimit = timeLimit;
        };
    }

    // Ignored by the random engine
    static EngineOption withSearchDepth(int depth) {
        return settings -> {
            if (!SearchConfig.isValidDepth(depth)) {
                throw new InvalidConfigurationException(SearchConfig.DEPTH_RANGE_MESSAGE + ", got " + depth);
            }
            settings.searchDepth = depth;
        };
    }

    /** Receives one info line per completed search depth. */
    static EngineOption withInfoListener(Consumer<String> listener) {
        Objects.requireNonNull(listener, "listener");
        return settings -> settings.infoListener = listener;
    }
}
