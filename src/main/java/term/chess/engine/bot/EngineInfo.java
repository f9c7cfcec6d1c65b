package term.chess.engine.bot;

import term.chess.engine.common.Difficulty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EngineInfo(String name, String author, String version, EngineType type,
                         Difficulty difficulty, Map<String, Boolean> features) {
    public static final String AUTHOR = "TermChess";
    public static final String VERSION = "1.0";

    public EngineInfo {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public boolean supports(String feature) {
        return features.getOrDefault(feature, false);
    }
}
