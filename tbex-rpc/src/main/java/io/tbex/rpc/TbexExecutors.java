// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used to run blocking node calls off the caller's thread.
 */
public final class TbexExecutors {

    private TbexExecutors() {
    }

    /**
     * Cached pool of daemon threads named {@code tbex-io-N}. Threads idle for 60 s
     * are released, so an unused explorer holds no threads.
     */
    public static ExecutorService newIoExecutor() {
        final AtomicInteger counter = new AtomicInteger(1);
        final ThreadFactory factory = runnable -> {
            final Thread thread = new Thread(runnable, "tbex-io-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
