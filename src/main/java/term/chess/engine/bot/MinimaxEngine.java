package term.chess.engine.bot;

import term.chess.engine.common.Difficulty;
import term.chess.engine.game.Game;
import term.chess.engine.movegen.Move;
import term.chess.engine.search.Deadline;
import term.chess.engine.search.IterativeDeepening;
import term.chess.engine.search.SearchConfig;
import term.chess.engine.search.SearchContext;
import term.chess.engine.search.SearchResult;
import term.chess.engine.search.evaluator.EvalWeights;
import term.chess.engine.utils.notations.FENUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Medium and hard tiers: iterative deepening negamax with alpha-beta pruning, bounded by the earlier of the
 * caller's deadline and the configured time limit.
 */
public class MinimaxEngine implements Configurable, Inspectable {
    private final String name;
    private final Difficulty difficulty;
    private final Consumer<String> infoListener;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Replaced as a whole by configure(), a search reads it once
    private volatile SearchConfig config;

    public MinimaxEngine(Difficulty difficulty) {
        this(SearchConfig.defaults(difficulty), line -> {});
    }

    public MinimaxEngine(SearchConfig config, Consumer<String> infoListener) {
        if (config.difficulty == Difficulty.EASY) {
            throw new IllegalArgumentException("invalid difficulty for minimax: " + config.difficulty + " (expected Medium or Hard)");
        }
        this.name = config.difficulty + " Bot";
        this.difficulty = config.difficulty;
        this.config = config;
        this.infoListener = Objects.requireNonNull(infoListener, "infoListener");
    }

    @Override
    public Move selectMove(Game position, Deadline deadline) {
        if (closed.get()) {
            throw new EngineClosedException(name);
        }
        List<Move> moves = position.legalMoves();
        if (moves.isEmpty()) {
            throw new NoLegalMovesException(FENUtils.getFENFromBoard(position));
        }
        if (moves.size() == 1) {
            return moves.get(0);
        }

        final SearchConfig cfg = config;
        Deadline effective = Deadline.after(cfg.timeLimit).earliest(deadline == null ? Deadline.never() : deadline);
        SearchContext ctx = new SearchContext(cfg);
        SearchResult result = IterativeDeepening.run(position.copy(), ctx, cfg.maxDepth, effective, infoListener);
        return result.move();
    }

    @Override
    public synchronized void configure(MinimaxConfig update) {
        Objects.requireNonNull(update, "config");
        // Validate everything before touching the current configuration
        if (update.searchDepth() != null && !SearchConfig.isValidDepth(update.searchDepth())) {
            throw new InvalidConfigurationException(SearchConfig.DEPTH_RANGE_MESSAGE + ", got " + update.searchDepth());
        }
        if (update.timeLimit() != null && !SearchConfig.isValidTimeLimit(update.timeLimit())) {
            throw new InvalidConfigurationException(SearchConfig.TIME_LIMIT_MESSAGE + ", got " + update.timeLimit());
        }

        SearchConfig current = config;
        EvalWeights w = current.weights;
        EvalWeights weights = new EvalWeights(
                update.materialWeight() != null ? update.materialWeight() : w.material(),
                update.pieceSquareWeight() != null ? update.pieceSquareWeight() : w.pieceSquare(),
                update.mobilityWeight() != null ? update.mobilityWeight() : w.mobility(),
                update.kingSafetyWeight() != null ? update.kingSafetyWeight() : w.kingSafety());

        SearchConfig.Builder builder = current.toBuilder().weights(weights);
        if (update.searchDepth() != null) builder.maxDepth(update.searchDepth());
        if (update.timeLimit() != null) builder.timeLimit(update.timeLimit());
        config = builder.build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public SearchConfig config() {
        return config;
    }

    @Override
    public EngineInfo info() {
        Map<String, Boolean> features = new LinkedHashMap<>();
        features.put("alpha_beta", true);
        features.put("iterative_deepening", true);
        features.put("move_ordering", true);
        features.put("configurable", true);
        features.put("piece_square_tables", difficulty.atLeast(Difficulty.MEDIUM));
        features.put("mobility", difficulty.atLeast(Difficulty.MEDIUM));
        features.put("passed_pawns", difficulty.atLeast(Difficulty.MEDIUM));
        features.put("king_safety", difficulty.atLeast(Difficulty.HARD));
        return new EngineInfo(name, EngineInfo.AUTHOR, EngineInfo.VERSION, EngineType.INTERNAL, difficulty, features);
    }
}
