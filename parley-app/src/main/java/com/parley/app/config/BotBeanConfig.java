package com.parley.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.app.store.JsonlExchangeStore;
import com.parley.channel.delivery.ResponseDelivery;
import com.parley.channel.discord.DiscordPlatform;
import com.parley.channel.discord.DiscordRestClient;
import com.parley.channel.dispatch.Collaborator;
import com.parley.channel.dispatch.CommandCoordinator;
import com.parley.channel.dispatch.ExchangeStore;
import com.parley.channel.thread.ThreadResolutionCache;
import com.parley.channel.thread.ThreadResolver;
import com.parley.common.config.ConfigService;
import com.parley.common.config.ParleyConfig;
import com.parley.common.infra.DedupeCache;
import com.parley.common.infra.PollWait;
import com.parley.common.infra.Sleeper;
import com.parley.common.infra.UserRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the bot: config, platform client, caches and the
 * command coordinator.
 */
@Slf4j
@Configuration
public class BotBeanConfig {

    static final int MIN_CACHE_SIZE = 2;

    @Value("${parley.config.path:~/.parley/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(Path.of(configPath)));
    }

    @Bean
    public ParleyConfig parleyConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public DiscordPlatform discordPlatform(ParleyConfig config) {
        return new DiscordRestClient(config);
    }

    @Bean
    public ThreadResolver threadResolver(DiscordPlatform platform, ParleyConfig config) {
        ParleyConfig.ThreadsConfig threads = config.getThreads();
        ParleyConfig.AutoThreadWaitConfig wait = threads.getAutoThreadWait();
        return new ThreadResolver(platform,
                new ThreadResolutionCache(atLeast("threads.cacheSize", threads.getCacheSize(), MIN_CACHE_SIZE)),
                new PollWait.Config(Math.max(1, wait.getInitialDelayMs()), Math.max(1.0, wait.getMultiplier()),
                        Math.max(1, wait.getMaxDelayMs()), Math.max(0, wait.getTimeoutMs())),
                threads.getNamePrefix(),
                Sleeper.SYSTEM);
    }

    @Bean
    public ResponseDelivery responseDelivery(DiscordPlatform platform, ParleyConfig config) {
        return new ResponseDelivery(platform, config.getDelivery(),
                config.getMessages().getAttachmentsDropped(), Sleeper.SYSTEM);
    }

    @Bean
    public ExchangeStore exchangeStore(ParleyConfig config, ObjectMapper objectMapper) {
        if (!config.getStore().isEnabled()) {
            log.info("Exchange store disabled");
            return ExchangeStore.NOOP;
        }
        Path file = ConfigService.expandHome(Path.of(config.getStore().getPath()));
        log.info("Recording exchanges to {}", file);
        return new JsonlExchangeStore(file, objectMapper);
    }

    @Bean
    public CommandCoordinator commandCoordinator(DiscordPlatform platform,
            ThreadResolver threadResolver,
            ResponseDelivery responseDelivery,
            ExchangeStore exchangeStore,
            ObjectProvider<Collaborator> collaborators,
            ParleyConfig config) {
        Collaborator collaborator = collaborators.getIfAvailable(() -> {
            log.warn("No Collaborator bean registered; every request will be answered with the error notice");
            return unavailableCollaborator();
        });

        ParleyConfig.RateLimitConfig rl = config.getRateLimit();
        UserRateLimiter rateLimiter = rl.isEnabled()
                ? new UserRateLimiter(rl.getCooldownSeconds(), rl.getMaxPerMinute(), rl.getMaxTrackedUsers())
                : null;

        return CommandCoordinator.builder()
                .platform(platform)
                .messageDedup(dedupeCache("messages", config.getDedup().getMessageCacheSize()))
                .commandDedup(dedupeCache("commands", config.getDedup().getCommandCacheSize()))
                .threadResolver(threadResolver)
                .delivery(responseDelivery)
                .collaborator(collaborator)
                .exchangeStore(exchangeStore)
                .rateLimiter(rateLimiter)
                .messages(config.getMessages())
                .executor(lifecycleExecutor(config.getWorkers().getPoolSize()))
                .build();
    }

    @Bean
    public CoordinatorLifecycle coordinatorLifecycle(CommandCoordinator coordinator) {
        return new CoordinatorLifecycle(coordinator);
    }

    static DedupeCache dedupeCache(String name, int size) {
        return new DedupeCache(name, atLeast("dedup." + name + " size", size, MIN_CACHE_SIZE));
    }

    /**
     * Clamp a configured bound; the startup check has already reported it.
     */
    static int atLeast(String setting, int value, int min) {
        if (value < min) {
            log.warn("{} is {}, using {}", setting, value, min);
            return min;
        }
        return value;
    }

    static Collaborator unavailableCollaborator() {
        return (event, command) -> CompletableFuture.failedFuture(
                new IllegalStateException("no collaborator configured"));
    }

    private static ExecutorService lifecycleExecutor(int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "parley-lifecycle-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, poolSize), factory);
    }

    /**
     * Drains running lifecycles on shutdown.
     */
    public static class CoordinatorLifecycle implements DisposableBean {
        private final CommandCoordinator coordinator;

        public CoordinatorLifecycle(CommandCoordinator coordinator) {
            this.coordinator = coordinator;
        }

        @Override
        public void destroy() {
            log.info("Shutting down command coordinator");
            coordinator.close();
        }
    }
}
