package term.chess.engine.match;

import term.chess.engine.bot.Engine;
import term.chess.engine.bot.EngineFactory;
import term.chess.engine.common.Difficulty;
import term.chess.engine.game.Game;
import term.chess.engine.game.board.utils.BoardGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Plays a series of independent games on a fixed pool of threads. Every game gets fresh engines,
 * closed when the game ends.
 */
public final class MatchRunner {
    public static final int MAX_CONCURRENT_GAMES = 50;

    private final Supplier<Engine> whiteEngines;
    private final Supplier<Engine> blackEngines;
    private final String whiteName;
    private final String blackName;
    private final int concurrency;
    private final Game startPosition;
    private final Duration moveTimeout;

    public MatchRunner(Difficulty white, Difficulty black) {
        this(() -> EngineFactory.newEngine(white), () -> EngineFactory.newEngine(black),
                white + " Bot", black + " Bot", defaultConcurrency(),
                BoardGenerator.newStandardGameBoard(), BotMatch.DEFAULT_MOVE_TIMEOUT);
    }

    public MatchRunner(Supplier<Engine> whiteEngines, Supplier<Engine> blackEngines, String whiteName, String blackName,
                       int concurrency, Game startPosition, Duration moveTimeout) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        this.whiteEngines = whiteEngines;
        this.blackEngines = blackEngines;
        this.whiteName = whiteName;
        this.blackName = blackName;
        this.concurrency = Math.min(concurrency, MAX_CONCURRENT_GAMES);
        this.startPosition = startPosition.copy();
        this.moveTimeout = moveTimeout;
    }

    public static int defaultConcurrency() {
        return defaultConcurrency(Runtime.getRuntime().availableProcessors());
    }

    // <= 2 CPUs: one game each, <= 4: 1.5 per CPU, above: 2 per CPU
    static int defaultConcurrency(int cpus) {
        int concurrency;
        if (cpus <= 2) {
            concurrency = cpus;
        } else if (cpus <= 4) {
            concurrency = (int) (cpus * 1.5);
        } else {
            concurrency = cpus * 2;
        }
        return Math.max(1, Math.min(concurrency, MAX_CONCURRENT_GAMES));
    }

    /** Results in game-number order, games numbered from 1. */
    public List<MatchResult> run(int gameCount) throws InterruptedException {
        if (gameCount < 1) {
            throw new IllegalArgumentException("game count must be at least 1, got " + gameCount);
        }
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, gameCount), r -> {
            Thread t = new Thread(r, "bvb-game-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<MatchResult>> futures = new ArrayList<>(gameCount);
            for (int i = 1; i <= gameCount; i++) {
                final int gameNumber = i;
                futures.add(pool.submit(() -> playOne(gameNumber)));
            }
            List<MatchResult> results = new ArrayList<>(gameCount);
            for (Future<MatchResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    throw new IllegalStateException("Game failed", e.getCause());
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    public MatchStats runAndSummarize(int gameCount) throws InterruptedException {
        return MatchStats.compute(run(gameCount), whiteName, blackName);
    }

    private MatchResult playOne(int gameNumber) {
        Engine white = whiteEngines.get();
        try {
            Engine black = blackEngines.get();
            try {
                return new BotMatch(gameNumber, white, black, whiteName, blackName, startPosition, moveTimeout).play();
            } finally {
                black.close();
            }
        } finally {
            white.close();
        }
    }

    public int concurrency() {
        return concurrency;
    }
}
