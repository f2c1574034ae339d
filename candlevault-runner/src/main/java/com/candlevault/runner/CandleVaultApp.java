package com.candlevault.runner;

import com.candlevault.core.error.CandleVaultException;
import com.candlevault.core.time.WindowRequest;
import com.candlevault.core.time.WindowResolver;
import com.candlevault.data.CandleSyncService;
import com.candlevault.data.config.CandleVaultConfig;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * CandleVault command line.
 *
 * <pre>
 * run   --operation NAME [--config config.yml] [--ops operations.yml]
 * sync  --symbol S --interval I [--start T] [--end T] [--lookback L] [--time-input-tz Z] [--dry-run] [--config F]
 * stats --symbol S --interval I [--start T] [--end T] [--lookback L] [--time-input-tz Z] [--config F]
 * slice --symbol S --interval I [--start T] [--end T] [--lookback L] [--time-input-tz Z] [--output PATH] [--config F]
 * </pre>
 *
 * Exits 0 when the operation succeeded and produced data, 1 otherwise.
 */
public class CandleVaultApp {
    private static final Logger LOG = LoggerFactory.getLogger(CandleVaultApp.class);

    private static final String DEFAULT_CONFIG = "config.yml";
    private static final String DEFAULT_OPERATIONS = "operations.yml";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || hasArg(args, "--help")) {
            printUsage(out);
            return args.length == 0 ? 1 : 0;
        }
        String command = args[0];

        CandleVaultConfig config;
        try {
            config = CandleVaultConfig.load(Path.of(getArg(args, "--config", DEFAULT_CONFIG)));
        } catch (CandleVaultException e) {
            return report(OperationOutcome.Failure.of(e), out, err);
        }
        applyLoggingLevel(config.getLoggingLevel());

        OperationRunner runner = new OperationRunner(new CandleSyncService(config), new WindowResolver());

        OperationOutcome outcome = switch (command) {
            case "run" -> runNamed(args, runner);
            case "sync" -> runner.sync("sync", getArg(args, "--symbol", null), getArg(args, "--interval", null),
                windowRequest(args), hasArg(args, "--dry-run"));
            case "stats" -> runner.stats("stats", getArg(args, "--symbol", null), getArg(args, "--interval", null),
                windowRequest(args));
            case "slice" -> {
                String output = getArg(args, "--output", null);
                yield runner.slice("slice", getArg(args, "--symbol", null), getArg(args, "--interval", null),
                    windowRequest(args), output != null ? Path.of(output) : null);
            }
            default -> {
                printUsage(err);
                yield OperationOutcome.Failure.of(CandleVaultException.invalidOperation("Unknown command '" + command + "'"));
            }
        };
        return report(outcome, out, err);
    }

    private static OperationOutcome runNamed(String[] args, OperationRunner runner) {
        String name = getArg(args, "--operation", null);
        if (name == null) {
            return OperationOutcome.Failure.of(CandleVaultException.invalidOperation("run requires --operation NAME"));
        }
        try {
            OperationCatalog catalog = OperationCatalog.load(Path.of(getArg(args, "--ops", DEFAULT_OPERATIONS)));
            Optional<OperationSpec> op = catalog.find(name);
            if (op.isEmpty()) {
                String available = catalog.names().isEmpty() ? "none" : String.join(", ", catalog.names());
                return OperationOutcome.Failure.of(CandleVaultException.invalidOperation(
                    "Operation '" + name + "' not found (available: " + available + ")"));
            }
            return runner.run(op.get());
        } catch (CandleVaultException e) {
            return OperationOutcome.Failure.of(e);
        }
    }

    private static WindowRequest windowRequest(String[] args) {
        return new WindowRequest(
            getArg(args, "--start", null),
            getArg(args, "--end", null),
            getArg(args, "--lookback", null),
            getArg(args, "--time-input-tz", null));
    }

    private static int report(OperationOutcome outcome, PrintStream out, PrintStream err) {
        if (outcome instanceof OperationOutcome.Failure f) {
            err.println("Error: " + f.summary());
        } else {
            out.println(outcome.summary());
        }
        return outcome.exitCode();
    }

    private static void applyLoggingLevel(String level) {
        if (level == null || level.isBlank()) return;
        Level parsed = Level.getLevel(level.trim().toUpperCase(Locale.ROOT));
        if (parsed == null) {
            LOG.warn("Unknown logging_level '{}', keeping the default", level);
            return;
        }
        Configurator.setRootLevel(parsed);
        Configurator.setLevel("com.candlevault", parsed);
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage:");
        out.println("  candlevault run --operation NAME [--config config.yml] [--ops operations.yml]");
        out.println("  candlevault sync|stats|slice --symbol SYMBOL --interval INTERVAL");
        out.println("      [--start TIME] [--end TIME] [--lookback 7d] [--time-input-tz ZONE]");
        out.println("      [--output PATH] [--dry-run] [--config config.yml]");
    }

    private static boolean hasArg(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) return true;
        }
        return false;
    }

    private static String getArg(String[] args, String flag, String defaultValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(flag)) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }
}
