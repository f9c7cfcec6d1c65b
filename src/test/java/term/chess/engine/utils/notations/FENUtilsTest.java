package term.chess.engine.utils.notations;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;
import term.chess.engine.game.Game;
import term.chess.engine.game.Piece;
import term.chess.engine.game.board.utils.BoardGenerator;
import term.chess.engine.movegen.Move;

import static org.junit.jupiter.api.Assertions.*;

public class FENUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {
            BoardGenerator.STANDARD_GAME,
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
            "rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w KQkq e6 0 2",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 b - - 12 47",
    })
    public void fen_roundTrips(String fen) {
        assertEquals(fen, FENUtils.getFENFromBoard(FENUtils.getBoardFrom(fen)));
    }

    @Test
    public void parsedBoard_hasPiecesOnExpectedSquares() {
        Game game = FENUtils.getBoardFrom(BoardGenerator.STANDARD_GAME);
        assertEquals(Piece.of(PieceType.ROOK, Color.WHITE), game.pieceAt(0));
        assertEquals(Piece.of(PieceType.KING, Color.WHITE), game.pieceAt(4));
        assertEquals(Piece.of(PieceType.QUEEN, Color.BLACK), game.pieceAt(59));
        assertTrue(game.pieceAt(27).isEmpty());
        assertEquals(Color.WHITE, game.activeColor());
        assertTrue(game.canCastleKingSide(Color.BLACK));
    }

    @Test
    public void playedMove_isReflectedInFen() {
        Game game = BoardGenerator.newStandardGameBoard();
        game.playMove(Move.fromAlgebraicNotation("e2e4"));
        assertEquals("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1", FENUtils.getFENFromBoard(game));
    }

    @Test
    public void fourFieldFen_defaultsClocks() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/4K3 w - -");
        assertEquals(0, game.halfMoveClock());
        assertEquals(1, game.fullMoveClock());
        assertEquals("4k3/8/8/8/8/8/8/4K3 w - - 0 1", FENUtils.getFENFromBoard(game));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP w KQkq - 0 1",
            "rnbqkbnr/ppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNRR w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKXNR w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR c KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQXq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq z9 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - -1 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 x",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0",
    })
    public void malformedFen_isRejected(String fen) {
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getBoardFrom(fen), "Should reject: " + fen);
    }

    @Test
    public void moveText_roundTrips() {
        assertEquals("e2e4", Move.fromAlgebraicNotation("e2e4").toString());
        assertEquals("e7e8q", Move.fromAlgebraicNotation("e7e8q").toString());
        assertEquals(PieceType.KNIGHT, Move.fromAlgebraicNotation("b7b8N").promotion());
        assertEquals(12, MoveIOUtils.getIndexFromSquare("e2"));
        assertEquals("h8", MoveIOUtils.getSquareFromIndex(63));
        assertThrows(IllegalArgumentException.class, () -> Move.fromAlgebraicNotation("e2"));
        assertThrows(IllegalArgumentException.class, () -> Move.fromAlgebraicNotation("i2i4"));
    }
}
