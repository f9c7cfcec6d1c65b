package term.chess.engine.common;

/**
 * Difficulty tiers of the built-in engines, weakest first.
 * Evaluation layers are enabled cumulatively as the tier increases.
 */
public enum Difficulty {
    EASY("Easy"),
    MEDIUM("Medium"),
    HARD("Hard");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public boolean atLeast(Difficulty other) {
        return compareTo(other) >= 0;
    }

    @Override
    public String toString() {
        return label;
    }
}
