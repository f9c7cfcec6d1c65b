package term.chess.engine.bot;

import term.chess.engine.common.Difficulty;
import term.chess.engine.search.SearchConfig;

import java.time.Duration;
import java.util.Random;
import java.util.function.Consumer;

public final class EngineFactory {

    private EngineFactory() {}

    /** Values collected from {@link EngineOption}s before an engine is built. */
    public static final class Settings {
        Duration timeLimit;
        Integer searchDepth;
        Consumer<String> infoListener = line -> {};

        private Settings(Duration timeLimit, Integer searchDepth) {
            this.timeLimit = timeLimit;
            this.searchDepth = searchDepth;
        }
    }

    public static Engine newEngine(Difficulty difficulty, EngineOption... options) {
        if (difficulty == Difficulty.EASY) {
            return newRandomEngine(options);
        }
        return newMinimaxEngine(difficulty, options);
    }

    public static RandomEngine newRandomEngine(EngineOption... options) {
        Settings settings = apply(new Settings(RandomEngine.DEFAULT_TIME_LIMIT, null), options);
        return new RandomEngine(new Random(), settings.timeLimit);
    }

    /**
     * @throws InvalidConfigurationException for {@link Difficulty#EASY} or an out-of-range option
     */
    public static MinimaxEngine newMinimaxEngine(Difficulty difficulty, EngineOption... options) {
        if (difficulty == Difficulty.EASY) {
            throw new InvalidConfigurationException("invalid difficulty for minimax: " + difficulty + " (expected Medium or Hard)");
        }
        SearchConfig defaults = SearchConfig.defaults(difficulty);
        Settings settings = apply(new Settings(defaults.timeLimit, defaults.maxDepth), options);
        SearchConfig config = defaults.toBuilder()
                .timeLimit(settings.timeLimit)
                .maxDepth(settings.searchDepth)
                .build();
        return new MinimaxEngine(config, settings.infoListener);
    }

    private static Settings apply(Settings settings, EngineOption... options) {
        for (EngineOption option : options) {
            option.applyTo(settings);
        }
        return settings;
    }
}
