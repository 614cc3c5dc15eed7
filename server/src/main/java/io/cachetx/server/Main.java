package io.cachetx.server;

import io.cachetx.core.KeyValueStore;
import io.cachetx.redis.RedisStore;
import io.cachetx.storage.MemoryStore;
import redis.clients.jedis.JedisPool;

import java.net.URI;
import java.util.logging.Logger;

/**
 * Entry point for a standalone cache server, backed by an in-memory store or,
 * with --redis, by a Redis server.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromArgs(args);
        } catch (ServerConfig.HelpRequested help) {
            System.out.println(ServerConfig.usage());
            return;
        } catch (IllegalArgumentException bad) {
            System.err.println(bad.getMessage());
            System.err.println(ServerConfig.usage());
            System.exit(1);
            return;
        }

        RedisStore redis = cfg.redisUri() == null ? null : new RedisStore(new JedisPool(URI.create(cfg.redisUri())));
        KeyValueStore store = redis != null ? redis : new MemoryStore(cfg.maxEntries());
        var server = new CacheServer(cfg.port(), store);
        server.start();

        log.info(() -> String.format("Cache server listening on http://localhost:%d (backend=%s)",
                cfg.port(), cfg.redisUri() != null ? cfg.redisUri() : "memory, max-entries=" + cfg.maxEntries()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            if (redis != null) {
                redis.close();
            }
        }));
    }
}
