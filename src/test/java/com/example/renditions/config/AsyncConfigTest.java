package com.example.renditions.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AsyncConfig Tests")
class AsyncConfigTest {

    private final AsyncConfig config = new AsyncConfig();
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("✅ Pool has exactly K threads and an unbounded queue")
    void transcodeExecutor_FixedSize() {
        executor = config.transcodeTaskExecutor(3);
        executor.initialize();

        assertThat(executor.getCorePoolSize()).isEqualTo(3);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getQueueCapacity()).isEqualTo(Integer.MAX_VALUE);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("transcode-worker-");
    }

    @Test
    @DisplayName("❌ K below one is rejected")
    void transcodeExecutor_InvalidLimit() {
        assertThatThrownBy(() -> config.transcodeTaskExecutor(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("transcode.max-concurrent-transcodes");
    }

    @Test
    @DisplayName("⚠️ Decorated task swallows and logs a runtime exception")
    void uncaughtExceptionLogger_SwallowsRuntimeException() {
        TaskDecorator decorator = AsyncConfig.uncaughtExceptionLogger();
        Runnable failing = decorator.decorate(() -> {
            throw new IllegalStateException("boom");
        });

        assertThatCode(failing::run).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("✅ Decorated task runs the original task")
    void uncaughtExceptionLogger_RunsTask() {
        AtomicBoolean ran = new AtomicBoolean();
        AsyncConfig.uncaughtExceptionLogger().decorate(() -> ran.set(true)).run();

        assertThat(ran).isTrue();
    }
}
