package com.wangbin.alerting.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wangbin.alerting.common.domain.entity.Alert;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * 告警 Redis 存储配置，仅在 alerting.persistence.type=redis 时生效
 */
@Configuration
@ConditionalOnProperty(prefix = "alerting.persistence", name = "type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public Jackson2JsonRedisSerializer<Alert> alertRedisSerializer(ObjectMapper objectMapper) {
        // 复制一份，避免影响全局配置
        ObjectMapper redisObjectMapper = objectMapper.copy();
        redisObjectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new Jackson2JsonRedisSerializer<>(redisObjectMapper, Alert.class);
    }

    @Bean("alertRedisTemplate")
    public RedisTemplate<String, Alert> alertRedisTemplate(
            RedisConnectionFactory connectionFactory,
            Jackson2JsonRedisSerializer<Alert> alertRedisSerializer) {

        RedisTemplate<String, Alert> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        RedisSerializer<String> stringSerializer = new StringRedisSerializer();

        // Key使用String序列化
        template.setKeySerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);

        // Value使用JSON序列化
        template.setValueSerializer(alertRedisSerializer);
        template.setHashValueSerializer(alertRedisSerializer);

        template.setEnableTransactionSupport(false);

        template.afterPropertiesSet();
        return template;
    }
}
