package com.hartwig.miniwt;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

public final class ThreadUtil {
    private ThreadUtil() {
    }

    /**
     * Fixed-size pool with an unbounded queue, so a batch larger than the pool waits instead of being rejected.
     */
    public static ExecutorService createExecutorService(int nMaxThreads, String nameTemplate) {
        var executor = new ThreadPoolExecutor(nMaxThreads,
                nMaxThreads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
