package io.cachetx.server;

/**
 * Cache server configuration parsed from CLI args.
 *
 * @param port       HTTP port to listen on
 * @param maxEntries capacity of the in-memory store, 0 for unbounded
 * @param redisUri   redis:// URI of a Redis server to use instead of the in-memory store, or null
 */
public record ServerConfig(int port, int maxEntries, String redisUri) {

    public static final int DEFAULT_PORT = 11311;

    /**
     * Supported flags:
     *   --port,        -p  <port>
     *   --max-entries, -m  <count>
     *   --redis,       -r  <uri>
     *   --help,        -h
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a bad number
     */
    public static ServerConfig fromArgs(String[] args) {
        int port = DEFAULT_PORT;
        int maxEntries = 0;
        String redisUri = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port", "-p" -> port = intValue(args, ++i, "port");
                case "--max-entries", "-m" -> maxEntries = intValue(args, ++i, "max-entries");
                case "--redis", "-r" -> redisUri = stringValue(args, ++i, "redis");
                case "--help", "-h" -> throw new HelpRequested();
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxEntries < 0) {
            throw new IllegalArgumentException("max-entries must be >= 0");
        }
        if (redisUri != null && !redisUri.startsWith("redis://") && !redisUri.startsWith("rediss://")) {
            throw new IllegalArgumentException("redis must be a redis:// or rediss:// URI: " + redisUri);
        }
        return new ServerConfig(port, maxEntries, redisUri);
    }

    private static String stringValue(String[] args, int i, String name) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + name);
        }
        return args[i];
    }

    private static int intValue(String[] args, int i, String name) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + name);
        }
        try {
            return Integer.parseInt(args[i]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + args[i], e);
        }
    }

    static String usage() {
        return """
            Usage: cache-server [options]

            Options:
              --port,        -p   HTTP port (default: 11311)
              --max-entries, -m   Max entries before LRU eviction, 0 = unbounded (default: 0)
              --redis,       -r   Serve a Redis server (redis://host:port) instead of memory
              --help,        -h   Show this help message
            """;
    }

    /** Thrown by {@link #fromArgs} when --help is given. */
    static final class HelpRequested extends RuntimeException {
        HelpRequested() {
            super("help requested");
        }
    }
}
