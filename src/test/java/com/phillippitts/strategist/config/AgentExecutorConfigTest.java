package com.phillippitts.strategist.config;

import com.phillippitts.strategist.config.properties.AgentPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class AgentExecutorConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateExecutorWithDefaultSizing() {
        executor = new AgentExecutorConfig(new AgentPoolProperties()).agentExecutorFactory().create();

        assertThat(executor.getCorePoolSize()).isEqualTo(3);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("agent-pool-");
    }

    @Test
    void shouldCreateFreshPoolPerCall() {
        AgentExecutorConfig config = new AgentExecutorConfig(new AgentPoolProperties());
        executor = config.agentExecutorFactory().create();
        ThreadPoolTaskExecutor other = config.agentExecutorFactory().create();
        try {
            assertThat(other).isNotSameAs(executor);
        } finally {
            other.shutdown();
        }
    }

    @Test
    void shouldRunOverflowOnCallerInsteadOfRejecting() throws InterruptedException {
        AgentPoolProperties properties = new AgentPoolProperties();
        properties.setSize(1);
        executor = new AgentExecutorConfig(properties).agentExecutorFactory().create();

        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        AtomicReference<String> overflowThread = new AtomicReference<>();
        executor.execute(() -> overflowThread.set(Thread.currentThread().getName()));
        release.countDown();

        assertThat(overflowThread.get()).isEqualTo(Thread.currentThread().getName());
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        executor = new AgentExecutorConfig(new AgentPoolProperties()).agentExecutorFactory().create();
        ThreadContext.put("sessionId", "s-42");

        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-42");
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() throws InterruptedException {
        AgentPoolProperties properties = new AgentPoolProperties();
        properties.setSize(1);
        executor = new AgentExecutorConfig(properties).agentExecutorFactory().create();

        ThreadContext.put("sessionId", "first");
        CountDownLatch first = new CountDownLatch(1);
        executor.execute(first::countDown);
        assertThat(first.await(5, TimeUnit.SECONDS)).isTrue();

        ThreadContext.clearAll();
        CountDownLatch second = new CountDownLatch(1);
        AtomicReference<String> leaked = new AtomicReference<>("unset");
        executor.execute(() -> {
            leaked.set(ThreadContext.get("sessionId"));
            second.countDown();
        });

        assertThat(second.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(leaked.get()).isNull();
    }

    @Test
    void shouldNotInterruptRunningTaskOnShutdown() throws InterruptedException {
        executor = new AgentExecutorConfig(new AgentPoolProperties()).agentExecutorFactory().create();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger interrupted = new AtomicInteger();
        CountDownLatch finished = new CountDownLatch(1);

        executor.execute(() -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
            }
            finished.countDown();
        });

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        release.countDown();

        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted.get()).isZero();
    }
}
