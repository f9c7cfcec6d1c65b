package term.chess.engine.search.evaluator;

import org.junit.jupiter.api.Test;
import term.chess.engine.common.Color;
import term.chess.engine.game.Game;
import term.chess.engine.utils.notations.FENUtils;

import static org.junit.jupiter.api.Assertions.*;

public class KingSafetyTest {
    private static final double EPSILON = 1e-9;

    @Test
    public void bareKing_missesShieldAndSitsOnOpenFiles() {
        // Given
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/4K3 w - - 0 1");

        // Then
        assertEquals(0.9, KingSafety.pawnShield(game, 4, Color.WHITE), EPSILON);
        assertEquals(0.75, KingSafety.openFiles(game, 4), EPSILON);
        assertEquals(0.0, KingSafety.attackedZone(game, 4, Color.WHITE), EPSILON);
        assertEquals(1.65, KingSafety.penalty(game, 4, Color.WHITE), EPSILON);
        assertEquals(0.0, KingSafety.evaluate(game), EPSILON, "Mirror positions cancel out");
    }

    @Test
    public void cornerKing_countsOffBoardShieldSquaresAsMissing() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/K7 w - - 0 1");
        assertEquals(0.9, KingSafety.pawnShield(game, 0, Color.WHITE), EPSILON);
        assertEquals(0.5, KingSafety.openFiles(game, 0), EPSILON, "Only the a and b files exist");
    }

    @Test
    public void shelteredKing_isSaferThanExposedOne() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/3PPP2/4K3 w - - 0 1");
        assertEquals(0.0, KingSafety.penalty(game, 4, Color.WHITE), EPSILON);
        // Black lacks a shield, its files are closed by White's pawns
        assertEquals(0.9, KingSafety.penalty(game, 60, Color.BLACK), EPSILON);
        assertEquals(0.9, KingSafety.evaluate(game), EPSILON);
    }

    @Test
    public void attackedZoneSquares_arePenalized() {
        // Black rook sweeps d1 and e1, f1 is behind the king
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/r3K3 w - - 0 1");
        assertEquals(0.2, KingSafety.attackedZone(game, 4, Color.WHITE), EPSILON);
    }

    @Test
    public void blackShield_looksTowardsLowerRanks() {
        Game game = FENUtils.getBoardFrom("6k1/5ppp/8/8/8/8/8/6K1 w - - 0 1");
        assertEquals(0.0, KingSafety.pawnShield(game, 62, Color.BLACK), EPSILON);
        assertEquals(0.9, KingSafety.pawnShield(game, 6, Color.WHITE), EPSILON);
    }
}
