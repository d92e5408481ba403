package io.fmtree.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fmtree.cli.dto.TreeConfigJson;
import io.fmtree.core.merkle.FixedMerkleTree;
import io.fmtree.core.merkle.HashFunction;
import io.fmtree.core.merkle.HashFunctions;
import io.fmtree.core.merkle.MerkleTree;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Validated tree description: depth, combiner, zero element and leaves.
 * <p>
 * Elements are kept as text until {@link #build()} so that the same file
 * format covers both combiners:
 *  - sum:    decimal longs, zero defaults to 0
 *  - sha256: 32-byte digests as hex, zero defaults to 32 zero bytes
 */
public final class TreeConfig {

    public enum HashKind {
        SUM("sum"),
        SHA256("sha256");

        private final String configName;

        HashKind(String configName) {
            this.configName = configName;
        }

        public String configName() { return configName; }

        public static HashKind fromName(String name) {
            for (var kind : values()) {
                if (kind.configName.equals(name)) return kind;
            }
            throw new IllegalArgumentException("Unknown hash function: " + name);
        }
    }

    /**
     * A built tree together with the parser for its element type, so callers
     * can look up elements given as text without knowing {@code T}.
     */
    public record LoadedTree<T>(MerkleTree<T> tree, Function<String, T> parser) {
        public int indexOf(String rawElement) {
            return tree.indexOf(parse(parser, rawElement, "element"));
        }
    }

    private static final HexFormat HEX = HexFormat.of();

    private final int levels;
    private final HashKind hash;
    private final String zeroElement;   // null => default for the hash kind
    private final List<String> elements;

    public TreeConfig(int levels, HashKind hash, String zeroElement, List<String> elements) {
        if (levels < 0 || levels > FixedMerkleTree.MAX_LEVELS) {
            throw new IllegalArgumentException("levels must be between 0 and " + FixedMerkleTree.MAX_LEVELS + ": " + levels);
        }
        this.levels = levels;
        this.hash = Objects.requireNonNull(hash, "hash");
        this.zeroElement = zeroElement;
        this.elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static TreeConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        TreeConfigJson cfg;
        try {
            cfg = mapper.readValue(path.toFile(), TreeConfigJson.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load tree config from " + path, e);
        }
        if (cfg.levels == null) {
            throw new IllegalArgumentException("levels is required in " + path);
        }
        var kind = cfg.hash == null ? HashKind.SUM : HashKind.fromName(cfg.hash);
        return new TreeConfig(cfg.levels, kind, cfg.zeroElement, cfg.elements);
    }

    /**
     * Parse the elements and build the tree.
     *
     * @throws IllegalArgumentException if an element or the zero element does not parse,
     *         or the depth is invalid
     * @throws io.fmtree.core.merkle.TreeFullException if there are more elements than the tree holds
     */
    public LoadedTree<?> build() {
        return switch (hash) {
            case SUM -> load(HashFunctions.longSum(), Long::valueOf, 0L);
            case SHA256 -> load(HashFunctions.sha256Hex(), TreeConfig::normalizeHex, HashFunctions.SHA256_HEX_ZERO);
        };
    }

    public int levels() { return levels; }

    public HashKind hash() { return hash; }

    public String zeroElement() { return zeroElement; }

    public List<String> elements() { return elements; }

    // ---------------- helpers ----------------

    private <T> LoadedTree<T> load(HashFunction<T> hashFunction, Function<String, T> parser, T defaultZero) {
        T zero = zeroElement == null ? defaultZero : parse(parser, zeroElement, "zeroElement");
        var leaves = new ArrayList<T>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            leaves.add(parse(parser, elements.get(i), "elements[" + i + "]"));
        }
        return new LoadedTree<>(MerkleTree.create(levels, leaves, hashFunction, zero), parser);
    }

    private static <T> T parse(Function<String, T> parser, String raw, String field) {
        if (raw == null) {
            throw new IllegalArgumentException(field + " must not be null");
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + field + ": " + raw, e);
        }
    }

    /** Lowercase hex so that equal digests compare equal as strings. Must be one SHA-256 digest. */
    private static String normalizeHex(String raw) {
        byte[] digest = HEX.parseHex(raw);
        if (digest.length != HashFunctions.SHA256_LEN) {
            throw new IllegalArgumentException("expected " + HashFunctions.SHA256_LEN + " bytes, got " + digest.length);
        }
        return HEX.formatHex(digest);
    }
}
