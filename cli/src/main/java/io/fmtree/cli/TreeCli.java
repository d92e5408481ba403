package io.fmtree.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fmtree.cli.dto.IndexResponse;
import io.fmtree.cli.dto.ProofResponse;
import io.fmtree.cli.dto.RootResponse;
import io.fmtree.core.merkle.LeafIndexOutOfBoundsException;
import io.fmtree.core.merkle.TreeFullException;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entrypoint: load a tree description and print one JSON document.
 *
 * Usage:
 *   fmtree-cli --config tree.json root
 *   fmtree-cli --config tree.json proof <index>
 *   fmtree-cli --config tree.json index-of <element>
 *
 * Exit codes: 0 ok, 1 usage/config/tree error, 2 unexpected failure.
 */
public final class TreeCli {
    private static final Logger log = Logger.getLogger(TreeCli.class.getName());

    private final ObjectMapper mapper = new ObjectMapper();
    private final PrintStream out;

    private TreeCli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Run one invocation and return the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            var cfg = CliConfig.fromArgs(args);
            if (cfg.help()) {
                out.print(CliConfig.USAGE);
                return 0;
            }
            new TreeCli(out).execute(cfg);
            return 0;
        } catch (CliConfig.UsageException e) {
            err.println("error: " + e.getMessage());
            err.print(CliConfig.USAGE);
            return 1;
        } catch (TreeFullException | LeafIndexOutOfBoundsException | IllegalArgumentException
                 | UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            return reportUnexpected(e, err);
        }
    }

    /** Unexpected failures get one stack trace on stderr and exit code 2. */
    static int reportUnexpected(Exception e, PrintStream err) {
        e.printStackTrace(err);
        return 2;
    }

    private void execute(CliConfig cfg) throws JsonProcessingException {
        var treeConfig = TreeConfig.fromJsonFile(cfg.configPath());
        var loaded = treeConfig.build();
        var tree = loaded.tree();
        log.log(Level.FINE, "Loaded {0}: levels={1} hash={2} leaves={3}",
                new Object[] { cfg.configPath(), tree.levels(), treeConfig.hash().configName(), tree.size() });

        Object response = switch (cfg.command()) {
            case "root" -> {
                var r = new RootResponse();
                r.root = tree.root();
                yield r;
            }
            case "proof" -> {
                int index = parseIndex(cfg.argument());
                var proof = tree.proof(index);
                var r = new ProofResponse();
                r.index = index;
                r.pathElements = proof.pathElements();
                r.pathIndices = proof.pathIndices();
                yield r;
            }
            case "index-of" -> {
                var r = new IndexResponse();
                r.index = loaded.indexOf(cfg.argument());
                yield r;
            }
            default -> throw new IllegalStateException("unhandled command: " + cfg.command());
        };
        out.println(mapper.writeValueAsString(response));
    }

    private static int parseIndex(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid index: " + raw, e);
        }
    }
}
