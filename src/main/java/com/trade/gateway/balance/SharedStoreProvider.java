package com.trade.gateway.balance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 进程级共享存储客户端
 * 首次使用时创建，进程内所有网关复用，由 {@link #shutdown()}
 * 或创建时注册的 JVM 关闭钩子关闭
 */
public final class SharedStoreProvider {

    private static final Logger logger = LoggerFactory.getLogger(SharedStoreProvider.class);

    private static RedisSharedStore store;
    private static boolean hookRegistered;

    private SharedStoreProvider() {
    }

    /**
     * 之后的调用忽略 {@code config}，返回首次创建的客户端
     */
    public static synchronized SharedStore getStore(RedisConfig config) throws SharedStoreException {
        if (store != null) {
            return store;
        }
        RedisSharedStore candidate = new RedisSharedStore(config);
        try {
            candidate.ping();
        } catch (SharedStoreException e) {
            candidate.close();
            throw e;
        }
        store = candidate;
        logger.info("共享存储已连接: {}", config);
        if (!hookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(SharedStoreProvider::shutdown, "shared-store-shutdown"));
            hookRegistered = true;
        }
        return store;
    }

    public static synchronized boolean isOpen() {
        return store != null;
    }

    public static synchronized void shutdown() {
        if (store == null) {
            return;
        }
        try {
            store.close();
            logger.info("共享存储连接已关闭");
        } catch (RuntimeException e) {
            logger.warn("关闭共享存储失败: {}", e.getMessage());
        } finally {
            store = null;
        }
    }
}
