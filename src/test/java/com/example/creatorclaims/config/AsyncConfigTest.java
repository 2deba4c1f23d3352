package com.example.creatorclaims.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("AsyncConfig Tests")
class AsyncConfigTest {

    private AsyncConfig asyncConfig;

    @BeforeEach
    void setUp() {
        asyncConfig = new AsyncConfig();
        ReflectionTestUtils.setField(asyncConfig, "corePoolSize", 1);
        ReflectionTestUtils.setField(asyncConfig, "maxPoolSize", 3);
        ReflectionTestUtils.setField(asyncConfig, "queueCapacity", 10);
    }

    public void dummyAsyncMethod(Long accountId) {
        throw new IllegalStateException("Async Test Error");
    }

    @Test
    @DisplayName("asyncTaskExecutor should be a bounded pool with the configured sizes")
    void asyncTaskExecutor_ConfiguredPool() {
        AsyncTaskExecutor executor = asyncConfig.asyncTaskExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) executor;
        assertThat(pool.getCorePoolSize()).isEqualTo(1);
        assertThat(pool.getMaxPoolSize()).isEqualTo(3);
        assertThat(pool.getQueueCapacity()).isEqualTo(10);
        assertThat(pool.getThreadNamePrefix()).isEqualTo("ownership-");
        pool.shutdown();
    }

    @Test
    @DisplayName("AsyncUncaughtExceptionHandler should log without rethrowing")
    void asyncUncaughtExceptionHandler_DoesNotThrow() throws NoSuchMethodException {
        AsyncUncaughtExceptionHandler handler = asyncConfig.getAsyncUncaughtExceptionHandler();
        Method method = AsyncConfigTest.class.getDeclaredMethod("dummyAsyncMethod", Long.class);

        assertThat(handler).isNotNull();
        assertThatCode(() -> handler.handleUncaughtException(new IllegalStateException("boom"), method, 42L))
                .doesNotThrowAnyException();
    }
}
