package com.trade.gateway.balance;

import com.trade.gateway.core.UnifiedBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 按角色决定余额请求读共享缓存还是直接拉取
 * <ul>
 *   <li>LEADER：每次都拉取并发布</li>
 *   <li>FOLLOWER：从不拉取，依次尝试新鲜缓存、过期但可用的缓存、短暂等待，否则不可用</li>
 *   <li>AUTO：持有锁才拉取，未抢到锁的进程读缓存</li>
 * </ul>
 */
public class SharedBalanceCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(SharedBalanceCoordinator.class);

    private final SharedBalanceCache cache;
    private final String exchange;

    public SharedBalanceCoordinator(SharedBalanceCache cache, String exchange) {
        this.cache = cache;
        this.exchange = exchange;
    }

    public SharedBalanceRole getRole() {
        return cache.getConfig().getRole();
    }

    public <E extends Exception> UnifiedBalance fetchBalance(BalanceFetcher<E> fetcher)
            throws E, SharedBalanceUnavailableException {
        SharedBalanceConfig config = cache.getConfig();
        SharedBalanceRole role = config.getRole();
        if (role == SharedBalanceRole.LEADER) {
            logger.debug("[{}] leader: 直接拉取余额", exchange);
            return fetchAndPublish(fetcher);
        }

        Optional<CachedBalance> cached = read();
        if (cached.isPresent() && cached.get().isWithin(config.getTtlMs(), cache.now())) {
            logger.debug("[{}] 共享余额命中 (age={}ms)", exchange, cached.get().ageMs(cache.now()));
            return cached.get().balance();
        }

        if (role == SharedBalanceRole.FOLLOWER) {
            return followerFallback(cached);
        }
        return autoFallback(fetcher, cached);
    }

    private UnifiedBalance followerFallback(Optional<CachedBalance> cached) throws SharedBalanceUnavailableException {
        Optional<UnifiedBalance> usable = staleOrFresh(cached);
        if (usable.isPresent()) {
            return usable.get();
        }
        throw unavailable("follower 无可用共享余额", null);
    }

    private <E extends Exception> UnifiedBalance autoFallback(BalanceFetcher<E> fetcher, Optional<CachedBalance> cached)
            throws E, SharedBalanceUnavailableException {
        String token = lock();
        if (token != null) {
            return fetchUnderLock(fetcher, token);
        }

        Optional<UnifiedBalance> usable = staleOrFresh(cached);
        if (usable.isPresent()) {
            return usable.get();
        }

        token = lock();
        if (token != null) {
            return fetchUnderLock(fetcher, token);
        }

        if (cached.isPresent() && cache.getConfig().getFallback() == StaleFallbackMode.LENIENT) {
            logger.warn("[{}] 共享余额已过期 {}ms，按宽松模式返回", exchange, cached.get().ageMs(cache.now()));
            return cached.get().balance();
        }
        throw unavailable("未获得锁且无可用共享余额", null);
    }

    /**
     * 先用过期但可用的记录，再限时等待新写入
     */
    private Optional<UnifiedBalance> staleOrFresh(Optional<CachedBalance> cached)
            throws SharedBalanceUnavailableException {
        if (cached.isPresent() && cached.get().isWithin(cache.getConfig().getStaleMaxMs(), cache.now())) {
            logger.debug("[{}] 使用过期但可用的共享余额 (age={}ms)", exchange, cached.get().ageMs(cache.now()));
            return Optional.of(cached.get().balance());
        }
        try {
            return cache.waitForFresh(exchange).map(CachedBalance::balance);
        } catch (SharedStoreException e) {
            throw unavailable("等待共享余额失败", e);
        }
    }

    private <E extends Exception> UnifiedBalance fetchUnderLock(BalanceFetcher<E> fetcher, String token) throws E {
        logger.debug("[{}] 获得余额锁，直接拉取", exchange);
        try {
            return fetchAndPublish(fetcher);
        } finally {
            try {
                cache.releaseLock(exchange, token);
            } catch (SharedStoreException e) {
                // 锁会在 lockTtlMs 后自动过期
                logger.warn("[{}] 释放余额锁失败: {}", exchange, e.getMessage());
            }
        }
    }

    private <E extends Exception> UnifiedBalance fetchAndPublish(BalanceFetcher<E> fetcher) throws E {
        UnifiedBalance balance = fetcher.fetch();
        try {
            cache.set(exchange, balance);
        } catch (SharedStoreException e) {
            logger.warn("[{}] 写入共享余额失败: {}", exchange, e.getMessage());
        }
        return balance;
    }

    private Optional<CachedBalance> read() throws SharedBalanceUnavailableException {
        try {
            return cache.get(exchange);
        } catch (SharedStoreException e) {
            throw unavailable("读取共享余额失败", e);
        }
    }

    private String lock() throws SharedBalanceUnavailableException {
        try {
            return cache.acquireLock(exchange);
        } catch (SharedStoreException e) {
            throw unavailable("获取余额锁失败", e);
        }
    }

    private SharedBalanceUnavailableException unavailable(String reason, Throwable cause) {
        String message = "[" + exchange + "] 共享余额不可用: " + reason;
        return cause == null
                ? new SharedBalanceUnavailableException(exchange, message)
                : new SharedBalanceUnavailableException(exchange, message, cause);
    }
}
