package com.streamsync.watchparty.config;

import com.corundumstudio.socketio.AuthTokenListener;
import com.corundumstudio.socketio.SocketConfig;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.corundumstudio.socketio.namespace.Namespace;
import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.corundumstudio.socketio.store.MemoryStoreFactory;
import com.corundumstudio.socketio.store.RedissonStoreFactory;
import com.corundumstudio.socketio.store.StoreFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
public class SocketIOConfig {

    @Value("${socketio.server.host:0.0.0.0}")
    private String host;

    @Value("${socketio.server.port:5002}")
    private Integer port;

    @Value("${socketio.store.type:redis}")
    private String storeType;

    /**
     * Socket.IO 세션 스토어 팩토리.
     *
     * redis: RedissonStoreFactory - 멀티 서버 환경에서 세션 공유
     * local: MemoryStoreFactory - 단일 서버 환경 (개발용)
     */
    @Bean
    public StoreFactory socketIOStoreFactory(ObjectProvider<RedissonClient> redissonClient) {
        if ("local".equalsIgnoreCase(storeType)) {
            log.warn("Using MemoryStoreFactory - NOT suitable for multi-server environment");
            return new MemoryStoreFactory();
        }

        log.info("Using RedissonStoreFactory for multi-server session sharing");
        return new RedissonStoreFactory(redissonClient.getObject());
    }

    @Bean(destroyMethod = "stop")
    public SocketIOServer socketIOServer(AuthTokenListener authTokenListener, StoreFactory storeFactory) {
        com.corundumstudio.socketio.Configuration config = new com.corundumstudio.socketio.Configuration();
        int cores = Runtime.getRuntime().availableProcessors();

        config.setHostname(host);
        config.setPort(port);

        config.setBossThreads(1);
        config.setWorkerThreads(cores * 2);

        config.setPingInterval(25000);
        config.setPingTimeout(60000);
        config.setUpgradeTimeout(10000);

        config.setMaxFramePayloadLength(64 * 1024);
        config.setMaxHttpContentLength(64 * 1024);
        config.setTransports(Transport.POLLING, Transport.WEBSOCKET);

        config.setAllowCustomRequests(true);
        config.setOrigin("*");

        var socketConfig = new SocketConfig();
        socketConfig.setReuseAddress(true);
        socketConfig.setTcpNoDelay(true);
        config.setSocketConfig(socketConfig);

        config.setJsonSupport(new JacksonJsonSupport(new JavaTimeModule()));
        config.setStoreFactory(storeFactory);

        SocketIOServer server = new SocketIOServer(config);
        server.getNamespace(Namespace.DEFAULT_NAME)
                .addAuthTokenListener(authTokenListener);

        log.info("Socket.IO server configured on {}:{} (worker={})", host, port, config.getWorkerThreads());
        return server;
    }
}
