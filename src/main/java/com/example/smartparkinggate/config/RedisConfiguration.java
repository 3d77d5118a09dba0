package com.example.smartparkinggate.config;

import com.example.smartparkinggate.model.ParkingSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Session records are stored as JSON documents. The occupancy counter goes
 * through Boot's {@code StringRedisTemplate} so that INCR/DECR operate on the
 * plain integer value.
 */
@Configuration
public class RedisConfiguration {

    @Bean
    public RedisTemplate<String, ParkingSession> sessionRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                      ObjectMapper objectMapper) {
        RedisTemplate<String, ParkingSession> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        Jackson2JsonRedisSerializer<ParkingSession> valueSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, ParkingSession.class);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(valueSerializer);
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(valueSerializer);
        template.setEnableTransactionSupport(false);

        template.afterPropertiesSet();
        return template;
    }
}
