package com.levertrader.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the document store.
 *
 * <p>Values are plain JSON strings with snake_case field names (see the document classes in
 * {@code com.levertrader.persistence}); no type hints are embedded, so documents stay
 * readable by other consumers of the same store. The gateway converts them with
 * {@link #documentObjectMapper()}.
 *
 * <p>Key schema:
 * <pre>
 *   levertrader:account:{id}     → Account document
 *   levertrader:position:{id}    → Position document
 *   levertrader:positions:all    → Set of position IDs
 *   levertrader:order:{id}       → Order document
 *   levertrader:orders:all       → Set of order IDs
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "levertrader:";

    public static final String KEY_PREFIX_ACCOUNT = KEY_PREFIX + "account:";
    public static final String KEY_PREFIX_POSITION = KEY_PREFIX + "position:";
    public static final String KEY_PREFIX_ORDER = KEY_PREFIX + "order:";

    public static final String KEY_SET_ACCOUNTS_ALL = KEY_PREFIX + "accounts:all";
    public static final String KEY_SET_POSITIONS_ALL = KEY_PREFIX + "positions:all";
    public static final String KEY_SET_ORDERS_ALL = KEY_PREFIX + "orders:all";

    @Bean
    public ObjectMapper documentObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Untyped reads land in maps; keep amounts as BigDecimal rather than double.
        objectMapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        return objectMapper;
    }

    @Bean
    public RedisTemplate<String, Object> redisTemplate(
            RedisConnectionFactory redisConnectionFactory, ObjectMapper documentObjectMapper) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        Jackson2JsonRedisSerializer<Object> jsonRedisSerializer =
                new Jackson2JsonRedisSerializer<>(documentObjectMapper, Object.class);

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
