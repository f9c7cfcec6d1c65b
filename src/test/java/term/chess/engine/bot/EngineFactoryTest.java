package term.chess.engine.bot;

import org.junit.jupiter.api.Test;
import term.chess.engine.common.Difficulty;
import term.chess.engine.game.board.utils.BoardGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EngineFactoryTest {

    @Test
    public void newEngine_picksImplementationByDifficulty() {
        Engine easy = EngineFactory.newEngine(Difficulty.EASY);
        Engine medium = EngineFactory.newEngine(Difficulty.MEDIUM);
        Engine hard = EngineFactory.newEngine(Difficulty.HARD);

        assertInstanceOf(RandomEngine.class, easy);
        assertInstanceOf(MinimaxEngine.class, medium);
        assertInstanceOf(MinimaxEngine.class, hard);
        assertEquals("Easy Bot", easy.name());
        assertEquals("Medium Bot", medium.name());
        assertEquals("Hard Bot", hard.name());
        assertInstanceOf(Configurable.class, medium);
        assertFalse(easy instanceof Configurable);
    }

    @Test
    public void defaults() {
        assertEquals(Duration.ofSeconds(2), EngineFactory.newRandomEngine().timeLimit());

        MinimaxEngine medium = EngineFactory.newMinimaxEngine(Difficulty.MEDIUM);
        assertEquals(4, medium.config().maxDepth);
        assertEquals(Duration.ofSeconds(4), medium.config().timeLimit);
        MinimaxEngine hard = EngineFactory.newMinimaxEngine(Difficulty.HARD);
        assertEquals(6, hard.config().maxDepth);
        assertEquals(Duration.ofSeconds(8), hard.config().timeLimit);
    }

    @Test
    public void options_overrideDefaults() {
        MinimaxEngine engine = EngineFactory.newMinimaxEngine(Difficulty.HARD,
                EngineOption.withSearchDepth(3),
                EngineOption.withTimeLimit(Duration.ofMillis(500)));
        assertEquals(3, engine.config().maxDepth);
        assertEquals(Duration.ofMillis(500), engine.config().timeLimit);

        RandomEngine random = EngineFactory.newRandomEngine(EngineOption.withTimeLimit(Duration.ofMillis(100)),
                EngineOption.withSearchDepth(12));
        assertEquals(Duration.ofMillis(100), random.timeLimit());
    }

    @Test
    public void invalidOptions_areRejected() {
        assertThrows(InvalidConfigurationException.class,
                () -> EngineFactory.newMinimaxEngine(Difficulty.MEDIUM, EngineOption.withSearchDepth(0)));
        assertThrows(InvalidConfigurationException.class,
                () -> EngineFactory.newMinimaxEngine(Difficulty.MEDIUM, EngineOption.withSearchDepth(21)));
        assertThrows(InvalidConfigurationException.class,
                () -> EngineFactory.newEngine(Difficulty.HARD, EngineOption.withTimeLimit(Duration.ZERO)));
        assertThrows(InvalidConfigurationException.class,
                () -> EngineFactory.newRandomEngine(EngineOption.withTimeLimit(Duration.ofSeconds(-3))));
    }

    @Test
    public void minimaxEngine_rejectsEasy() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> EngineFactory.newMinimaxEngine(Difficulty.EASY));
        assertTrue(e.getMessage().startsWith("invalid difficulty for minimax"));
    }

    @Test
    public void infoListener_isWiredIntoTheSearch() {
        List<String> lines = new ArrayList<>();
        Engine engine = EngineFactory.newEngine(Difficulty.MEDIUM,
                EngineOption.withSearchDepth(1),
                EngineOption.withInfoListener(lines::add));

        engine.selectMove(BoardGenerator.newStandardGameBoard());

        assertEquals(1, lines.size());
        assertTrue(lines.get(0).startsWith("info depth 1 "));
    }
}
