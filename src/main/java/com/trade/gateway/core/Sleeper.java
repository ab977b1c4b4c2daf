package com.trade.gateway.core;

/**
 * 阻塞等待，重试退避和缓存轮询共用；测试中替换为记录型实现
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
