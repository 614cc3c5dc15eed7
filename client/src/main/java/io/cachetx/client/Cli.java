package io.cachetx.client;

import io.cachetx.core.CachedValue;
import io.cachetx.core.KeyValueStore;
import io.cachetx.storage.Buffer;
import io.cachetx.transaction.Transaction;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Command-line client for a running cache server.
 *
 * Usage:
 *   cachetx-cli [--base-url http://host:port] get <key>
 *   cachetx-cli [--base-url http://host:port] set <key> <value> [expire]
 *   cachetx-cli [--base-url http://host:port] del|delete <key>
 *   cachetx-cli [--base-url http://host:port] incr|decr <key> [offset]
 *   cachetx-cli [--base-url http://host:port] flush
 *   cachetx-cli [--base-url http://host:port] tx
 *
 * In tx mode, commands are read one per line from stdin and run inside a single
 * {@link Transaction}. A "rollback" line discards everything; "commit" or end of
 * input commits. The outcome is printed as COMMITTED or ROLLED BACK.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:11311";

    private Cli() {
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            KeyValueStore store = new HttpStore(URI.create(parsed.getKey()));
            if ("tx".equals(rest[0])) {
                var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                boolean committed = runTransaction(store, in, System.out);
                System.exit(committed ? 0 : 1);
            }
            execute(store, rest, System.out);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Run commands read from {@code in} in one transaction over {@code backend}.
     *
     * @return true if the transaction committed
     */
    static boolean runTransaction(KeyValueStore backend, BufferedReader in, PrintStream out) throws IOException {
        try (var tx = new Transaction(new Buffer(), backend)) {
            String line;
            while ((line = in.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if ("rollback".equals(trimmed)) {
                    tx.rollback();
                    out.println("ROLLED BACK");
                    return false;
                }
                if ("commit".equals(trimmed)) {
                    break;
                }
                execute(tx, trimmed.split("\\s+"), out);
            }
            boolean committed = tx.commit();
            out.println(committed ? "COMMITTED" : "ROLLED BACK");
            return committed;
        }
    }

    /** Run one command against {@code store} and print its result. */
    static void execute(KeyValueStore store, String[] cmd, PrintStream out) {
        switch (cmd[0]) {
            case "get" -> {
                arity(cmd, 2, 2, "get requires <key>");
                CachedValue v = store.get(cmd[1]);
                out.println(v == null ? "(not found)" : v.asString());
            }
            case "set", "add", "replace" -> {
                arity(cmd, 3, 4, cmd[0] + " requires <key> <value> [expire]");
                byte[] value = cmd[2].getBytes(StandardCharsets.UTF_8);
                long expire = cmd.length == 4 ? number(cmd[3]) : 0L;
                boolean ok = switch (cmd[0]) {
                    case "set" -> store.set(cmd[1], value, expire);
                    case "add" -> store.add(cmd[1], value, expire);
                    default -> store.replace(cmd[1], value, expire);
                };
                out.println(ok ? "OK" : "NOT STORED");
            }
            case "del", "delete" -> {
                arity(cmd, 2, 2, cmd[0] + " requires <key>");
                out.println(store.delete(cmd[1]) ? "DELETED" : "NOT FOUND");
            }
            case "touch" -> {
                arity(cmd, 3, 3, "touch requires <key> <expire>");
                out.println(store.touch(cmd[1], number(cmd[2])) ? "TOUCHED" : "NOT FOUND");
            }
            case "incr", "decr" -> {
                arity(cmd, 2, 3, cmd[0] + " requires <key> [offset]");
                long offset = cmd.length == 3 ? number(cmd[2]) : 1L;
                OptionalLong n = "incr".equals(cmd[0])
                        ? store.increment(cmd[1], offset, 0L, 0L)
                        : store.decrement(cmd[1], offset, 0L, 0L);
                out.println(n.isPresent() ? Long.toString(n.getAsLong()) : "NOT NUMERIC");
            }
            case "flush" -> {
                arity(cmd, 1, 1, "flush takes no arguments");
                out.println(store.flush() ? "OK" : "FAILED");
            }
            default -> throw new CliException("unknown command: " + String.join(" ", Arrays.asList(cmd)));
        }
    }

    private static void arity(String[] cmd, int min, int max, String message) {
        if (cmd.length < min || cmd.length > max) {
            throw new CliException(message);
        }
    }

    private static long number(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new CliException("not a number: " + s);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            String[] rest = Arrays.copyOfRange(args, 2, args.length);
            return Map.entry(args[1], rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  cachetx-cli [--base-url http://host:port] get <key>
                  cachetx-cli [--base-url http://host:port] set <key> <value> [expire]
                  cachetx-cli [--base-url http://host:port] del|delete <key>
                  cachetx-cli [--base-url http://host:port] incr|decr <key> [offset]
                  cachetx-cli [--base-url http://host:port] flush
                  cachetx-cli [--base-url http://host:port] tx   < commands
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
