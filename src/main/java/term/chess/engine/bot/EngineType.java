package term.chess.engine.bot;

public enum EngineType {
    INTERNAL("Internal"),
    UCI("UCI"),
    RL("RL");

    private final String label;

    EngineType(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
