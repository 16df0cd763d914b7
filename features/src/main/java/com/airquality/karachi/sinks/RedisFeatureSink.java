package com.airquality.karachi.sinks;

import com.airquality.karachi.models.FeatureSpec;
import com.airquality.karachi.models.FeatureTable;
import com.airquality.karachi.serialization.FeatureFormat;
import com.airquality.karachi.utils.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Online feature store sink backed by Redis.
 *
 * Each row becomes a hash at {@code <prefix>v<version>:<timestamp>} holding every
 * spec column; the ordered feature column list is stored at {@code <prefix>v<version>:spec}
 * so serving can rebuild vectors in training order, and the set of row keys at
 * {@code <prefix>v<version>:rows} so the next run can drop rows it no longer produces.
 */
public class RedisFeatureSink implements FeatureSink, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RedisFeatureSink.class);

    private final JedisPool jedisPool;
    private final String keyPrefix;

    public RedisFeatureSink(JedisPool jedisPool, String keyPrefix) {
        this.jedisPool = jedisPool;
        this.keyPrefix = keyPrefix;
    }

    public static RedisFeatureSink fromEnvironment() {
        String host = ConfigLoader.redisHost();
        int port = ConfigLoader.redisPort();

        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(4); // single-threaded batch writer
        poolConfig.setMaxWait(Duration.ofSeconds(5));

        JedisPool pool = new JedisPool(poolConfig, host, port, 2000, ConfigLoader.redisPassword());
        LOG.info("Redis feature sink initialized for host {}:{}", host, port);
        return new RedisFeatureSink(pool, ConfigLoader.redisKeyPrefix());
    }

    /**
     * Replaces the stored rows of this schema version in a single MULTI/EXEC transaction:
     * row keys recorded by an earlier run but absent from this table are deleted, every
     * current row is written and the row set and spec list are rebuilt. A failure before
     * EXEC leaves the previous run's data untouched.
     */
    @Override
    public void write(FeatureTable table, FeatureSpec spec) throws IOException {
        FeatureFormat.requireConforms(table, spec);
        int version = spec.getVersion();
        String rowsKey = rowsKey(keyPrefix, version);
        String specKey = specKey(keyPrefix, version);

        Set<String> current = new LinkedHashSet<>();
        for (int row = 0; row < table.size(); row++) {
            current.add(rowKey(keyPrefix, version, table.getTimestamp(row)));
        }

        int staleCount;
        try (Jedis jedis = jedisPool.getResource()) {
            Set<String> stale = new HashSet<>(jedis.smembers(rowsKey));
            stale.removeAll(current);
            staleCount = stale.size();

            try (Transaction tx = jedis.multi()) {
                if (!stale.isEmpty()) {
                    tx.del(stale.toArray(new String[0]));
                }
                for (int row = 0; row < table.size(); row++) {
                    tx.hset(rowKey(keyPrefix, version, table.getTimestamp(row)), rowFields(table, spec, row));
                }
                tx.del(rowsKey);
                if (!current.isEmpty()) {
                    tx.sadd(rowsKey, current.toArray(new String[0]));
                }
                tx.del(specKey);
                tx.rpush(specKey, spec.getFeatureColumns().toArray(new String[0]));
                tx.exec();
            }
        } catch (JedisException e) {
            throw new IOException("Redis write failed: " + e.getMessage(), e);
        }
        LOG.info("Pushed {} feature rows to Redis under {}v{}:*, removed {} stale rows",
                table.size(), keyPrefix, version, staleCount);
    }

    public static String rowKey(String prefix, int version, long timestamp) {
        return prefix + "v" + version + ":" + timestamp;
    }

    public static String specKey(String prefix, int version) {
        return prefix + "v" + version + ":spec";
    }

    /** Set of the row keys written by the last run of a version. */
    public static String rowsKey(String prefix, int version) {
        return prefix + "v" + version + ":rows";
    }

    /**
     * Hash fields of one row, formatted exactly as in the CSV table.
     */
    public static Map<String, String> rowFields(FeatureTable table, FeatureSpec spec, int row) {
        List<String> header = spec.getColumns();
        List<String> cells = FeatureFormat.formatRow(table, spec, row);
        Map<String, String> fields = new LinkedHashMap<>();
        for (int c = 0; c < header.size(); c++) {
            fields.put(header.get(c), cells.get(c));
        }
        return fields;
    }

    @Override
    public String describe() {
        return "redis:" + keyPrefix;
    }

    @Override
    public void close() {
        if (jedisPool != null) {
            jedisPool.close();
            LOG.info("Redis connection pool closed.");
        }
    }
}
