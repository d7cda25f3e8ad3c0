/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.seeker.infrastructure.concurrent;

import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool that runs each task with the submitting thread's MDC
 * context, so reader logs keep the caller's {@code runId}.
 */
public class MdcAwareExecutor implements AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int workers, String namePrefix) {
        this.delegate = Executors.newFixedThreadPool(workers, namedDaemonThreads(namePrefix));
    }

    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /**
     * Stops accepting work and interrupts running tasks. Transports that ignore
     * interruption finish in the background; their results are discarded by
     * the caller.
     */
    public List<Runnable> abandon() {
        return delegate.shutdownNow();
    }

    @Override
    public void close() {
        delegate.shutdown();
    }

    private static ThreadFactory namedDaemonThreads(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
