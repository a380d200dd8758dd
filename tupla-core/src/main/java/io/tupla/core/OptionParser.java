package io.tupla.core;

import java.util.Map;

/**
 * Turns a loosely typed option map into {@link TableOptions} plus a layout.
 * <p>
 * Entries are checked one at a time in the map's iteration order; the first illegal entry is
 * reported as {@code INVALID_OPTION(name, value)}. Pass a {@link java.util.LinkedHashMap} (or
 * {@link Map#of} for a single entry) when the reported option must be deterministic.
 */
public final class OptionParser {

    public static final String NAME = "name";
    public static final String VISIBILITY = "visibility";
    public static final String HEIR = "heir";
    public static final String KEY_POS = "key_pos";
    public static final String READ_CONCURRENCY = "read_concurrency";
    public static final String WRITE_CONCURRENCY = "write_concurrency";
    public static final String COMPRESSED = "compressed";
    public static final String ORDERED = "ordered";
    public static final String DUPLICATE = "duplicate";

    private OptionParser() {
    }

    /**
     * Parsed options.
     *
     * @param options typed options
     * @param layout  layout chosen by the kind's layout option, null for {@link TableKind#RAW}
     */
    public record Parsed(TableOptions options, Layout layout) {
    }

    public static Result<Parsed> parse(TableKind kind, Map<String, ?> options) {
        if (kind == null) {
            throw new IllegalArgumentException("kind required");
        }
        var builder = TableOptions.builder();
        var layoutFlag = false;
        if (options != null) {
            for (Map.Entry<String, ?> entry : options.entrySet()) {
                var key = entry.getKey();
                var value = entry.getValue();
                if (key == null) {
                    return Result.err(TableError.invalidOption(null, value));
                }
                if (key.equals(kind.layoutOption())) {
                    if (!(value instanceof Boolean flag)) {
                        return Result.err(TableError.invalidOption(key, value));
                    }
                    layoutFlag = flag;
                    continue;
                }
                var applied = apply(kind, builder, key, value);
                if (!applied) {
                    return Result.err(TableError.invalidOption(key, value));
                }
            }
        }
        var parsed = builder.build();
        var violation = parsed.firstViolation();
        if (violation.isPresent()) {
            return Result.err(violation.get());
        }
        var layout = kind == TableKind.RAW ? null : kind.layoutFor(layoutFlag);
        return Result.ok(new Parsed(parsed, layout));
    }

    private static boolean apply(TableKind kind, TableOptions.Builder builder, String key, Object value) {
        switch (key) {
            case NAME -> {
                if (value == null) {
                    return true;
                }
                if (!(value instanceof String name) || name.isBlank()) {
                    return false;
                }
                builder.name(name);
                return true;
            }
            case VISIBILITY -> {
                var visibility = value instanceof Visibility v ? v
                        : value instanceof String text ? Visibility.parse(text) : null;
                if (visibility == null) {
                    return false;
                }
                builder.visibility(visibility);
                return true;
            }
            case HEIR -> {
                if ("none".equals(value) || value == Heir.NONE) {
                    builder.heir(Heir.NONE);
                    return true;
                }
                if (value instanceof Heir heir && !heir.isNone()) {
                    builder.heir(heir);
                    return true;
                }
                return false;
            }
            case KEY_POS -> {
                if (!kind.keyPosAllowed()) {
                    return false;
                }
                if (!(value instanceof Integer || value instanceof Short || value instanceof Byte)) {
                    return false;
                }
                var keyPos = ((Number) value).intValue();
                if (keyPos < 1) {
                    return false;
                }
                builder.keyPos(keyPos);
                return true;
            }
            case READ_CONCURRENCY -> {
                if (!(value instanceof Boolean flag)) {
                    return false;
                }
                builder.readConcurrency(flag);
                return true;
            }
            case WRITE_CONCURRENCY -> {
                if (!(value instanceof Boolean flag)) {
                    return false;
                }
                builder.writeConcurrency(flag);
                return true;
            }
            case COMPRESSED -> {
                if (!(value instanceof Boolean flag)) {
                    return false;
                }
                builder.compressed(flag);
                return true;
            }
            default -> {
                return false;
            }
        }
    }
}
