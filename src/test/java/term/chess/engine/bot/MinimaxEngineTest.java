package term.chess.engine.bot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import term.chess.engine.common.Difficulty;
import term.chess.engine.game.Game;
import term.chess.engine.game.board.utils.BoardGenerator;
import term.chess.engine.movegen.Move;
import term.chess.engine.search.Deadline;
import term.chess.engine.search.SearchConfig;
import term.chess.engine.utils.notations.FENUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MinimaxEngineTest {
    private static final String FOOLS_MATE = "rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3";

    private static MinimaxEngine engine(Difficulty difficulty, int depth) {
        SearchConfig config = SearchConfig.defaults(difficulty).toBuilder().maxDepth(depth).build();
        return new MinimaxEngine(config, line -> {});
    }

    @ParameterizedTest
    @EnumSource(value = Difficulty.class, names = {"MEDIUM", "HARD"})
    public void findsMateInOne(Difficulty difficulty) {
        Game game = FENUtils.getBoardFrom("6k1/5ppp/8/8/8/8/8/R6K w - - 0 1");
        assertEquals(Move.fromAlgebraicNotation("a1a8"), engine(difficulty, 3).selectMove(game));
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3})
    public void doesNotTradeQueenForRook(int depth) {
        // Qxd7+ Kxd7 leaves bare kings
        Game game = FENUtils.getBoardFrom("4k3/3r4/8/8/8/8/8/3Q1K2 w - - 0 1");
        Move move = engine(Difficulty.MEDIUM, depth).selectMove(game);
        assertNotEquals(Move.fromAlgebraicNotation("d1d7"), move);
        assertTrue(game.legalMoves().contains(move));
    }

    @Test
    public void takesHangingQueen() {
        Game game = FENUtils.getBoardFrom("6k1/8/5q2/4P3/8/8/8/6K1 w - - 0 1");
        assertEquals(Move.fromAlgebraicNotation("e5f6"), engine(Difficulty.MEDIUM, 2).selectMove(game));
    }

    @Test
    public void forcedMove_isReturnedImmediately() {
        Game game = FENUtils.getBoardFrom("k7/2K5/8/8/8/8/8/1R6 b - - 0 1");
        assertEquals(Move.fromAlgebraicNotation("a8a7"), new MinimaxEngine(Difficulty.HARD).selectMove(game));
    }

    @Test
    public void zeroBudget_stillReturnsALegalMove() {
        Game game = BoardGenerator.newStandardGameBoard();
        Move move = new MinimaxEngine(Difficulty.HARD).selectMove(game, Deadline.after(Duration.ZERO));
        assertTrue(game.legalMoves().contains(move));
    }

    @Test
    public void selectMove_doesNotModifyCallersGame() {
        Game game = FENUtils.getBoardFrom("r1bqkbnr/pppp1ppp/2n5/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R w KQkq - 2 3");
        String before = FENUtils.getFENFromBoard(game);

        engine(Difficulty.HARD, 2).selectMove(game);

        assertEquals(before, FENUtils.getFENFromBoard(game));
    }

    @Test
    public void noLegalMoves_isAnError() {
        Game game = FENUtils.getBoardFrom(FOOLS_MATE);
        NoLegalMovesException e = assertThrows(NoLegalMovesException.class,
                () -> engine(Difficulty.MEDIUM, 2).selectMove(game));
        assertTrue(e.getMessage().contains("no legal moves"));
    }

    @Test
    public void close_isIdempotentAndFinal() {
        MinimaxEngine engine = new MinimaxEngine(Difficulty.MEDIUM);
        engine.close();
        engine.close();

        assertTrue(engine.isClosed());
        EngineClosedException e = assertThrows(EngineClosedException.class,
                () -> engine.selectMove(BoardGenerator.newStandardGameBoard()));
        assertTrue(e.getMessage().contains("closed"));
    }

    @Test
    public void easyDifficulty_isRejected() {
        SearchConfig medium = SearchConfig.defaults(Difficulty.MEDIUM);
        SearchConfig easy = medium.toBuilder().difficulty(Difficulty.EASY).build();
        assertThrows(IllegalArgumentException.class, () -> new MinimaxEngine(easy, line -> {}));
        assertThrows(IllegalArgumentException.class, () -> new MinimaxEngine(Difficulty.EASY));
    }

    @Test
    public void defaults_dependOnDifficulty() {
        MinimaxEngine medium = new MinimaxEngine(Difficulty.MEDIUM);
        MinimaxEngine hard = new MinimaxEngine(Difficulty.HARD);

        assertEquals("Medium Bot", medium.name());
        assertEquals(4, medium.config().maxDepth);
        assertEquals(Duration.ofSeconds(4), medium.config().timeLimit);
        assertEquals("Hard Bot", hard.name());
        assertEquals(6, hard.config().maxDepth);
        assertEquals(Duration.ofSeconds(8), hard.config().timeLimit);
    }

    @Test
    public void configure_appliesValidUpdate() {
        MinimaxEngine engine = new MinimaxEngine(Difficulty.MEDIUM);

        engine.configure(MinimaxConfig.builder()
                .searchDepth(2)
                .timeLimit(Duration.ofMillis(750))
                .mobilityWeight(0.5)
                .build());

        SearchConfig config = engine.config();
        assertEquals(2, config.maxDepth);
        assertEquals(Duration.ofMillis(750), config.timeLimit);
        assertEquals(0.5, config.weights.mobility());
        assertEquals(1.0, config.weights.material(), "Unset weights keep their value");
    }

    @Test
    public void configure_rejectsOutOfRangeValuesWithoutChanges() {
        MinimaxEngine engine = new MinimaxEngine(Difficulty.HARD);
        SearchConfig before = engine.config();

        assertThrows(InvalidConfigurationException.class,
                () -> engine.configure(MinimaxConfig.builder().searchDepth(0).build()));
        assertThrows(InvalidConfigurationException.class,
                () -> engine.configure(MinimaxConfig.builder().searchDepth(21).build()));
        assertThrows(InvalidConfigurationException.class,
                () -> engine.configure(MinimaxConfig.builder().timeLimit(Duration.ZERO).build()));
        assertThrows(InvalidConfigurationException.class,
                () -> engine.configure(MinimaxConfig.builder().timeLimit(Duration.ofSeconds(-1)).build()));
        // A valid depth next to an invalid time limit is not applied either
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> engine.configure(MinimaxConfig.builder().searchDepth(3).timeLimit(Duration.ofMillis(-1)).materialWeight(4.0).build()));

        assertTrue(e.getMessage().startsWith(SearchConfig.TIME_LIMIT_MESSAGE));
        assertSame(before, engine.config());
    }

    @Test
    public void info_describesHardTier() {
        EngineInfo info = new MinimaxEngine(Difficulty.HARD).info();

        assertEquals("Hard Bot", info.name());
        assertEquals(EngineInfo.AUTHOR, info.author());
        assertEquals(EngineType.INTERNAL, info.type());
        assertEquals(Difficulty.HARD, info.difficulty());
        assertTrue(info.supports("alpha_beta"));
        assertTrue(info.supports("iterative_deepening"));
        assertTrue(info.supports("king_safety"));
        assertFalse(info.supports("opening_book"));
        assertFalse(new MinimaxEngine(Difficulty.MEDIUM).info().supports("king_safety"));
    }

    @Test
    public void infoListener_receivesOneLinePerDepth() {
        List<String> lines = new ArrayList<>();
        SearchConfig config = SearchConfig.defaults(Difficulty.MEDIUM).toBuilder().maxDepth(2).build();
        MinimaxEngine engine = new MinimaxEngine(config, lines::add);

        engine.selectMove(BoardGenerator.newStandardGameBoard());

        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("info depth 1 "));
        assertTrue(lines.get(1).startsWith("info depth 2 "));
    }
}
