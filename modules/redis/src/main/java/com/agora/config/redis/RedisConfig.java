package com.agora.config.redis;

import io.lettuce.core.ReadFrom;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisStaticMasterReplicaConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Redis 연결 설정.
 * <p>
 * 기본 템플릿은 레플리카 우선으로 읽습니다. 랭킹 조회나 설정 캐시처럼 약간 늦은 값이 허용되는 곳에서 사용합니다.
 * 출석 락, 작업 큐, 랭킹 쓰기처럼 방금 쓴 값을 다시 읽어야 하는 곳은 {@link #REDIS_TEMPLATE_MASTER} 템플릿을 주입받습니다.
 * 레플리카가 설정되지 않은 환경에서는 두 템플릿 모두 마스터에서 읽습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {
    public static final String REDIS_TEMPLATE_MASTER = "redisTemplateMaster";
    private static final String CONNECTION_MASTER = "redisConnectionMaster";

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    @Primary
    @Bean
    public LettuceConnectionFactory replicaPreferredConnectionFactory() {
        ReadFrom readFrom = redisProperties.hasReplicas() ? ReadFrom.REPLICA_PREFERRED : ReadFrom.MASTER;
        return connectionFactory(readFrom, "-reader");
    }

    @Qualifier(CONNECTION_MASTER)
    @Bean
    public LettuceConnectionFactory masterConnectionFactory() {
        return connectionFactory(ReadFrom.MASTER, "-writer");
    }

    @Primary
    @Bean
    public RedisTemplate<String, String> replicaPreferredRedisTemplate(LettuceConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Qualifier(REDIS_TEMPLATE_MASTER)
    @Bean
    public RedisTemplate<String, String> masterRedisTemplate(
            @Qualifier(CONNECTION_MASTER) LettuceConnectionFactory connectionFactory
    ) {
        return new StringRedisTemplate(connectionFactory);
    }

    private LettuceConnectionFactory connectionFactory(ReadFrom readFrom, String clientSuffix) {
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .readFrom(readFrom)
                .commandTimeout(redisProperties.commandTimeout())
                .clientName(redisProperties.clientName() + clientSuffix)
                .build();

        RedisNodeInfo master = redisProperties.master();
        RedisStaticMasterReplicaConfiguration topology =
                new RedisStaticMasterReplicaConfiguration(master.host(), master.port());
        topology.setDatabase(redisProperties.database());
        redisProperties.replicas().forEach(replica -> topology.addNode(replica.host(), replica.port()));
        return new LettuceConnectionFactory(topology, clientConfig);
    }
}
