package com.agora.task;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * 작업 처리 결과 카운터.
 */
class TaskMetrics {

    private final MeterRegistry meterRegistry;

    TaskMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    void enqueued(String name) {
        meterRegistry.counter("task.enqueued", "name", name).increment();
    }

    void succeeded(String name) {
        meterRegistry.counter("task.processed", "name", name, "result", "success").increment();
    }

    void retried(String name) {
        meterRegistry.counter("task.processed", "name", name, "result", "retry").increment();
    }

    void deadLettered(String name) {
        meterRegistry.counter("task.processed", "name", name, "result", "dead").increment();
    }

    void skipped(String name) {
        meterRegistry.counter("task.recurring.skipped", "name", name).increment();
    }
}
