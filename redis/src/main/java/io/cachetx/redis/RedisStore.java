package io.cachetx.redis;

import io.cachetx.core.CacheAccessException;
import io.cachetx.core.CachedValue;
import io.cachetx.core.CasToken;
import io.cachetx.core.Expiry;
import io.cachetx.core.KeyValueStore;
import io.cachetx.core.NumericValues;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * {@link KeyValueStore} backed by a Redis server through a Jedis connection pool.
 * <p>
 * Responsibilities:
 *  - Convert memcached-style expire arguments into Redis TTLs. Redis cannot store
 *    an already-expired value, so such writes delete the key instead.
 *  - Derive CAS tokens from a digest of the value read; Redis has no version
 *    counter of its own.
 *  - Run read-check-write operations (cas, increment, decrement) under
 *    WATCH/MULTI/EXEC, so a concurrent change of the key aborts the write and the
 *    operation reports failure.
 * <p>
 * Connection and protocol errors surface as {@link CacheAccessException}.
 * Counters keep their TTL when updated (SET ... KEEPTTL, Redis 6+).
 */
public final class RedisStore implements KeyValueStore, AutoCloseable {

    private static final Logger log = Logger.getLogger(RedisStore.class.getName());

    /** TTL meaning "the value is already expired". */
    static final long EXPIRED_TTL = -1L;

    private final JedisPool pool;
    private final Clock clock;

    public RedisStore(JedisPool pool) {
        this(pool, Clock.systemUTC());
    }

    public RedisStore(JedisPool pool, Clock clock) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CachedValue get(String key) {
        Objects.requireNonNull(key, "key");
        byte[] value = withJedis("get", jedis -> jedis.get(bytes(key)));
        return value == null ? null : new CachedValue(value, token(value));
    }

    @Override
    public Map<String, CachedValue> getMulti(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        List<String> ordered = List.copyOf(keys);
        Map<String, CachedValue> found = new LinkedHashMap<>();
        if (ordered.isEmpty()) {
            return found;
        }

        List<byte[]> values = withJedis("getMulti", jedis -> jedis.mget(bytes(ordered)));
        for (int i = 0; i < ordered.size(); i++) {
            byte[] value = values.get(i);
            if (value != null) {
                found.put(ordered.get(i), new CachedValue(value, token(value)));
            }
        }
        return found;
    }

    @Override
    public boolean set(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long ttl = ttl(expire);

        return withJedis("set", jedis -> {
            if (ttl < 0) {
                jedis.del(bytes(key));
                return true;
            }
            String reply = ttl == 0
                    ? jedis.set(bytes(key), value)
                    : jedis.set(bytes(key), value, SetParams.setParams().ex(ttl));
            return "OK".equals(reply);
        });
    }

    @Override
    public Map<String, Boolean> setMulti(Map<String, byte[]> items, long expire) {
        Objects.requireNonNull(items, "items");
        items.forEach((key, value) -> {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        });
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (items.isEmpty()) {
            return results;
        }
        long ttl = ttl(expire);

        if (ttl < 0) {
            deleteMulti(items.keySet());
            items.keySet().forEach(key -> results.put(key, true));
            return results;
        }

        List<Object> replies = withJedis("setMulti", jedis -> {
            Transaction multi = jedis.multi();
            items.forEach((key, value) -> {
                if (ttl == 0) {
                    multi.set(bytes(key), value);
                } else {
                    multi.set(bytes(key), value, SetParams.setParams().ex(ttl));
                }
            });
            return multi.exec();
        });

        int i = 0;
        for (String key : items.keySet()) {
            results.put(key, replies != null && i < replies.size() && "OK".equals(replies.get(i)));
            i++;
        }
        return results;
    }

    @Override
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        return withJedis("delete", jedis -> jedis.del(bytes(key)) > 0);
    }

    /**
     * DEL only reports how many keys went away, so existence is read first to
     * report per-key results.
     */
    @Override
    public Map<String, Boolean> deleteMulti(Collection<String> keys) {
        Objects.requireNonNull(keys, "keys");
        List<String> ordered = List.copyOf(keys);
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (ordered.isEmpty()) {
            return results;
        }

        Map<String, CachedValue> existing = getMulti(ordered);
        withJedis("deleteMulti", jedis -> jedis.del(bytes(ordered)));
        for (String key : ordered) {
            results.put(key, existing.containsKey(key));
        }
        return results;
    }

    @Override
    public boolean add(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long ttl = ttl(expire);

        return withJedis("add", jedis -> {
            if (ttl < 0) {
                // nothing to store, but add still fails on an existing key
                return !jedis.exists(bytes(key));
            }
            SetParams params = SetParams.setParams().nx();
            if (ttl > 0) {
                params.ex(ttl);
            }
            return "OK".equals(jedis.set(bytes(key), value, params));
        });
    }

    @Override
    public boolean replace(String key, byte[] value, long expire) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long ttl = ttl(expire);

        return withJedis("replace", jedis -> {
            if (ttl < 0) {
                return jedis.del(bytes(key)) > 0;
            }
            SetParams params = SetParams.setParams().xx();
            if (ttl > 0) {
                params.ex(ttl);
            }
            return "OK".equals(jedis.set(bytes(key), value, params));
        });
    }

    @Override
    public boolean cas(CasToken token, String key, byte[] value, long expire) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long ttl = ttl(expire);

        return withJedis("cas", jedis -> {
            byte[] k = bytes(key);
            jedis.watch(k);

            byte[] current = jedis.get(k);
            if (current == null || !token(current).equals(token)) {
                jedis.unwatch();
                return false;
            }

            // EXEC is aborted if the watched key changed since the read above.
            Transaction multi = jedis.multi();
            if (ttl < 0) {
                multi.del(k);
            } else if (ttl == 0) {
                multi.set(k, value);
            } else {
                multi.set(k, value, SetParams.setParams().ex(ttl));
            }
            return committed(multi.exec());
        });
    }

    @Override
    public OptionalLong increment(String key, long offset, long initial, long expire) {
        return adjust(key, offset, initial, expire, true);
    }

    @Override
    public OptionalLong decrement(String key, long offset, long initial, long expire) {
        return adjust(key, offset, initial, expire, false);
    }

    @Override
    public boolean touch(String key, long expire) {
        Objects.requireNonNull(key, "key");
        long ttl = ttl(expire);

        return withJedis("touch", jedis -> {
            byte[] k = bytes(key);
            if (ttl < 0) {
                return jedis.del(k) > 0;
            }
            if (ttl == 0) {
                if (!jedis.exists(k)) {
                    return false;
                }
                jedis.persist(k);
                return true;
            }
            return jedis.expire(k, ttl) > 0;
        });
    }

    @Override
    public boolean flush() {
        return withJedis("flush", jedis -> "OK".equals(jedis.flushAll()));
    }

    @Override
    public void close() {
        pool.close();
    }

    /**
     * Redis TTL in seconds for a memcached-style expire argument:
     * 0 for no expiration, a negative value if the key would already be expired.
     */
    static long ttl(long expire, long nowSeconds) {
        if (expire == 0) {
            return 0;
        }
        if (expire < 0) {
            return EXPIRED_TTL;
        }
        if (expire <= Expiry.MAX_RELATIVE_SECONDS) {
            return expire;
        }
        long remaining = expire - nowSeconds;
        return remaining > 0 ? remaining : EXPIRED_TTL;
    }

    // ------------ helpers ------------

    private long ttl(long expire) {
        return ttl(expire, clock.instant().getEpochSecond());
    }

    private OptionalLong adjust(String key, long offset, long initial, long expire, boolean up) {
        Objects.requireNonNull(key, "key");
        if (offset <= 0 || initial < 0) {
            return OptionalLong.empty();
        }
        long ttl = ttl(expire);

        return withJedis(up ? "increment" : "decrement", jedis -> {
            byte[] k = bytes(key);
            jedis.watch(k);

            byte[] current = jedis.get(k);
            long next;
            Transaction multi;
            if (current == null) {
                if (ttl < 0) {
                    // initialised and expired in the same breath: nothing to store
                    jedis.unwatch();
                    return OptionalLong.of(initial);
                }
                next = initial;
                multi = jedis.multi();
                if (ttl == 0) {
                    multi.set(k, NumericValues.encode(next));
                } else {
                    multi.set(k, NumericValues.encode(next), SetParams.setParams().ex(ttl));
                }
            } else {
                OptionalLong number = NumericValues.parse(current);
                if (number.isEmpty()) {
                    jedis.unwatch();
                    return OptionalLong.empty();
                }
                next = NumericValues.applyClamped(number.getAsLong(), up ? offset : -offset);
                // Existing counters keep their expiration.
                multi = jedis.multi();
                multi.set(k, NumericValues.encode(next), SetParams.setParams().keepttl());
            }

            if (!committed(multi.exec())) {
                log.fine(() -> "Counter " + key + " changed concurrently, update aborted");
                return OptionalLong.empty();
            }
            return OptionalLong.of(next);
        });
    }

    /** EXEC returns null when a watched key changed; failed commands come back as exceptions. */
    private static boolean committed(List<Object> replies) {
        if (replies == null) {
            return false;
        }
        for (Object reply : replies) {
            if (reply == null || reply instanceof Exception) {
                return false;
            }
        }
        return true;
    }

    private <T> T withJedis(String op, Function<Jedis, T> call) {
        try (Jedis jedis = pool.getResource()) {
            return call.apply(jedis);
        } catch (JedisException e) {
            throw new CacheAccessException("Redis " + op + " failed: " + e.getMessage(), e);
        }
    }

    /** Token for a value as read: equal values yield equal tokens. */
    static CasToken token(byte[] value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value);
            return CasToken.of("sha256:" + HexFormat.of().formatHex(digest));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[][] bytes(List<String> keys) {
        List<byte[]> out = new ArrayList<>(keys.size());
        keys.forEach(k -> out.add(bytes(k)));
        return out.toArray(new byte[0][]);
    }
}
