package ai.pyflow.graph;

import java.util.Locale;

/**
 * What a lookup returns for a name defined in more than one file.
 */
public enum CollisionPolicy {
    /** The file processed last wins. Known bias, kept as the default. */
    LAST_WINS,
    /** Colliding names resolve to nothing and are reported. */
    AMBIGUOUS,
    /** Freezing the table fails with {@link SymbolCollisionException}. */
    FAIL;

    public static CollisionPolicy parse(String value) {
        final String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (v) {
            case "last-wins", "" -> LAST_WINS;
            case "ambiguous" -> AMBIGUOUS;
            case "fail" -> FAIL;
            default -> throw new IllegalArgumentException("unknown collision policy: " + value);
        };
    }
}
