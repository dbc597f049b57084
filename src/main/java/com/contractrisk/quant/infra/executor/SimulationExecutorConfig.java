package com.contractrisk.quant.infra.executor;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class SimulationExecutorConfig {

    @Value("${quant.executor.pool-size:0}")
    private int poolSize;

    @Value("${quant.executor.shutdown-timeout-ms:5000}")
    private long shutdownTimeoutMs;

    private ExecutorService simulationExecutor;

    @Bean(name = "simulationExecutor")
    public ExecutorService simulationExecutor() {
        int threads = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        simulationExecutor = Executors.newFixedThreadPool(threads, namedThreadFactory("quant-sim"));
        log.info("[Executor] 시뮬레이션 워커 풀 기동: threads={}", threads);
        return simulationExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (simulationExecutor == null) return;
        log.info("[Executor] 시뮬레이션 워커 풀 종료 시작...");
        simulationExecutor.shutdown();
        try {
            if (!simulationExecutor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                simulationExecutor.shutdownNow();
                log.warn("[Executor] 종료 대기 초과, 강제 종료: timeout={}ms", shutdownTimeoutMs);
            }
        } catch (InterruptedException e) {
            simulationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
