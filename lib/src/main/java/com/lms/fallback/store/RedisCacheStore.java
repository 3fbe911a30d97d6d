package com.lms.fallback.store;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Cache store backed by a Redis server through a Lettuce connection.
 * Values are stored as raw bytes with {@code SETEX}, so expiry is enforced by Redis.
 */
public class RedisCacheStore implements CacheStore, AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);
    
    private static final RedisCodec<String, byte[]> CODEC = RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE);
    
    private final StatefulRedisConnection<String, byte[]> connection;
    private final RedisClient ownedClient;
    
    /**
     * Wraps an existing connection. The caller keeps ownership of it.
     */
    public RedisCacheStore(StatefulRedisConnection<String, byte[]> connection) {
        this(connection, null);
    }
    
    private RedisCacheStore(StatefulRedisConnection<String, byte[]> connection, RedisClient ownedClient) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.ownedClient = ownedClient;
    }
    
    /**
     * Connects to the given Redis endpoint. The returned store owns the client and
     * closes it in {@link #close()}.
     * 
     * @param redisUri the Redis endpoint
     * @param commandTimeout upper bound applied by Lettuce to each command
     */
    public static RedisCacheStore connect(RedisURI redisUri, Duration commandTimeout) {
        RedisClient client = RedisClient.create();
        client.setOptions(ClientOptions.builder()
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.builder().fixedTimeout(commandTimeout).build())
                .build());
        
        try {
            StatefulRedisConnection<String, byte[]> connection = client.connect(CODEC, redisUri);
            logger.info("Connected Redis cache store to {}:{}", redisUri.getHost(), redisUri.getPort());
            return new RedisCacheStore(connection, client);
        } catch (RedisException e) {
            client.shutdown();
            throw new CacheStoreException("Failed to connect to Redis at " + redisUri.getHost() + ":" + redisUri.getPort(), e);
        }
    }
    
    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.ofNullable(commands().get(key));
        } catch (RedisException e) {
            throw new CacheStoreException("Redis GET failed for key " + key, e);
        }
    }
    
    @Override
    public void put(String key, byte[] value, long ttlSeconds) {
        try {
            commands().setex(key, ttlSeconds, value);
        } catch (RedisException e) {
            throw new CacheStoreException("Redis SETEX failed for key " + key, e);
        }
    }
    
    private RedisCommands<String, byte[]> commands() {
        return connection.sync();
    }
    
    @Override
    public void close() {
        if (ownedClient != null) {
            connection.close();
            ownedClient.shutdown();
            logger.info("Redis cache store closed");
        }
    }
}
