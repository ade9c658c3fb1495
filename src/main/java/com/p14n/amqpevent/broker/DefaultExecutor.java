package com.p14n.amqpevent.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a cached pool of
 * named daemon threads.
 * Background loops (reconnect, delivery dispatch) each occupy one thread for
 * as long as they run.
 */
public class DefaultExecutor implements AsyncExecutor {
        private static final Logger logger = LoggerFactory.getLogger(DefaultExecutor.class);
        private static final long CLOSE_TIMEOUT_SECONDS = 5;

        private final ExecutorService es;

        /**
         * Creates a new executor.
         *
         * @param nameFormat thread name format, e.g. {@code "amqp-event-reconnect-%d"}
         */
        public DefaultExecutor(String nameFormat) {
                this.es = Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build());
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public List<Runnable> shutdownNow() {
                return es.shutdownNow();
        }

        /**
         * Stops accepting tasks and waits briefly for running ones before
         * interrupting them.
         */
        @Override
        public void close() {
                es.shutdown();
                try {
                        if (!es.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                                logger.atWarn().log("Executor did not terminate in time, interrupting tasks");
                                es.shutdownNow();
                        }
                } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        es.shutdownNow();
                }
        }
}
