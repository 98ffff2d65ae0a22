package io.gamestate.core;

import io.gamestate.core.protocol.TransactionResult;
import io.gamestate.core.query.Filters;
import io.gamestate.core.store.GameStore;
import io.gamestate.core.store.InMemoryGameStore;
import io.gamestate.core.tree.StateJson;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static io.gamestate.core.protocol.Mutations.push;
import static io.gamestate.core.protocol.Mutations.set;
import static io.gamestate.core.protocol.Mutations.update;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final String DEFAULT_STATE = """
            {"turn": 1, "party": [{"id": "alice", "hp": 20}, {"id": "bob", "hp": 15}]}
            """;

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Object initial = options.statePath() != null
                ? StateJson.read(options.statePath())
                : StateJson.fromJson(DEFAULT_STATE);
        GameStore store = GameStore.createStore(initial);
        LOG.info("Store created from " + (options.statePath() != null ? options.statePath() : "built-in state"));

        if (options.demo()) {
            runDemoFlow(store);
        } else {
            LOG.info("Demo flow disabled (--no-demo)");
            System.out.println(StateJson.toJson(store.getState()));
        }
    }

    private static void runDemoFlow(GameStore store) {
        Object snapshot = store.getState();
        store.observe("party.*.hp", (now, before, ctx) ->
                LOG.info("hp changed at " + ctx.path() + ": " + before + " -> " + now));

        TransactionResult hit = store.dispatch(
                set("turn", 2),
                update("party.1.hp", hp -> ((Number) hp).intValue() - 7));
        LOG.info("Turn 2 committed=" + hit.valid() + " diff=" + hit.diff().paths());

        TransactionResult bad = store.dispatch(set("turn", 3), push("turn", "invalid"));
        LOG.info("Bad batch committed=" + bad.valid() + " error=" + bad.error());

        List<Object> wounded = store.query("party", Map.of("hp", Filters.lt(10)));
        LOG.info("Wounded: " + StateJson.toJson(wounded));

        store.replaceState(snapshot);
        LOG.info("Rewound to turn " + store.get("turn") + ", history size " + store.getHistory().size());

        if (store instanceof InMemoryGameStore inMemory) {
            LOG.info("=== Metrics ===\n" + inMemory.metrics().scrape());
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load logging.properties", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path statePath,
            boolean demo
    ) {
        static CliOptions parse(String[] args) {
            Path statePath = envPath("GAME_STORE_STATE", null);
            boolean demo = !"false".equalsIgnoreCase(System.getenv("GAME_STORE_DEMO"));
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--state=")) {
                        String value = arg.substring("--state=".length());
                        if (value.isBlank()) {
                            showHelp = true;
                            error = "Missing value for --state";
                        } else {
                            statePath = Path.of(value);
                        }
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(showHelp, error, statePath, demo);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: game-state-store [options]

Options:
  --help, -h            Show this help message and exit
  --state=<file>        JSON file holding the initial state tree (default: built-in party)
  --demo / --no-demo    Run (default) or skip the demo transaction flow;
                        with --no-demo the loaded state is printed as JSON

Environment overrides:
  GAME_STORE_STATE      Default for --state
  GAME_STORE_DEMO       Set to "false" to disable the demo without a CLI flag
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }
    }
}
