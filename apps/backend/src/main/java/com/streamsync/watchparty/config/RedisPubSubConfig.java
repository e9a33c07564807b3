package com.streamsync.watchparty.config;

import com.streamsync.watchparty.websocket.socketio.pubsub.RedisMessageSubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

/**
 * Redis Pub/Sub 설정.
 *
 * 같은 방의 참가자가 서로 다른 서버에 연결될 수 있으므로
 * 모든 방 이벤트를 "watchparty:events" 채널로 발행하고, 모든 서버가 구독한다.
 * 각 서버는 자신에게 연결된 클라이언트에게만 Socket.IO로 전송한다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "watchparty.broadcast.type", havingValue = "redis", matchIfMissing = true)
public class RedisPubSubConfig {

    public static final String EVENT_CHANNEL = "watchparty:events";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter listenerAdapter) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(listenerAdapter, new ChannelTopic(EVENT_CHANNEL));

        log.info("Redis Pub/Sub 리스너 등록 완료 - 채널: {}", EVENT_CHANNEL);
        return container;
    }

    @Bean
    public MessageListenerAdapter listenerAdapter(RedisMessageSubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "onMessage");
    }
}
