package term.chess.engine.search.evaluator;

import org.junit.jupiter.api.Test;
import term.chess.engine.game.Game;
import term.chess.engine.game.board.utils.BoardGenerator;
import term.chess.engine.utils.notations.FENUtils;

import static org.junit.jupiter.api.Assertions.*;

public class GamePhaseTest {

    @Test
    public void startIsFullPhase() {
        Game start = FENUtils.getBoardFrom(BoardGenerator.STANDARD_GAME);
        assertEquals(1.0, GamePhase.currentPhase(start), 1e-9);
    }

    @Test
    public void kingsAndPawnsIsPureEndgame() {
        Game game = FENUtils.getBoardFrom("4k3/pppppppp/8/8/8/8/PPPPPPPP/4K3 w - - 0 1");
        assertEquals(0.0, GamePhase.currentPhase(game));
    }

    @Test
    public void phaseFollowsRemainingPieceMaterial() {
        Game queenOnly = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/3QK3 w - - 0 1");
        assertEquals(9.0 / 63.0, GamePhase.currentPhase(queenOnly), 1e-9);
    }

    @Test
    public void promotionsCannotExceedOne() {
        Game game = FENUtils.getBoardFrom("qqqqk3/8/8/8/8/8/8/QQQQK3 w - - 0 1");
        assertEquals(1.0, GamePhase.currentPhase(game));
    }

    @Test
    public void queensOffDecreasesPhase() {
        Game start = FENUtils.getBoardFrom(BoardGenerator.STANDARD_GAME);
        Game noQueens = FENUtils.getBoardFrom("rnb1kbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNB1KBNR w KQkq - 0 1");
        assertTrue(GamePhase.currentPhase(noQueens) < GamePhase.currentPhase(start), "Trading queens moves towards the endgame");
    }

    @Test
    public void sideToMoveDoesNotAffectPhase() {
        Game a = FENUtils.getBoardFrom("r3k3/8/8/8/8/8/8/R3K1N1 w - - 0 1");
        Game b = FENUtils.getBoardFrom("r3k3/8/8/8/8/8/8/R3K1N1 b - - 0 1");
        assertEquals(GamePhase.currentPhase(a), GamePhase.currentPhase(b), "Phase must be independent of side to move");
    }
}
