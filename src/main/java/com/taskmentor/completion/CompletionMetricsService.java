package com.taskmentor.completion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class CompletionMetricsService {

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicLong fallbackCount = new AtomicLong();

    public void recordRequest(String purpose) {
        long count = requestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}).", count, purpose);
    }

    public void recordFailure(String purpose, String reason) {
        long count = failureCount.incrementAndGet();
        log.warn("LLM request failed (purpose={}, reason={}). Total failures={}.", purpose, reason, count);
    }

    public void recordFallback(String purpose, String route) {
        long count = fallbackCount.incrementAndGet();
        log.info("Fell back to {} after {} failed. Total fallbacks={}.", route, purpose, count);
    }

    public long requests() {
        return requestCount.get();
    }

    public long failures() {
        return failureCount.get();
    }

    public long fallbacks() {
        return fallbackCount.get();
    }

    public void logSummary() {
        log.info("LLM stats: totalRequests={}, totalFailures={}, totalFallbacks={}.",
                requestCount.get(), failureCount.get(), fallbackCount.get());
    }
}
