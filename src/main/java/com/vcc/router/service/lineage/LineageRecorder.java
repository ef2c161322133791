package com.vcc.router.service.lineage;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.DecisionTrace;
import com.vcc.router.service.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Persists each decision trace exactly once. Writes never hold up the response; a failed or slow
 * write parks the trace in a bounded local buffer that is retried on a fixed schedule.
 */
@Service
public class LineageRecorder {
    private static final Logger log = LoggerFactory.getLogger(LineageRecorder.class);

    private final LineageSink sink;
    private final MetricsSink metrics;
    private final Duration writeTimeout;
    private final BlockingQueue<DecisionTrace> buffer;

    public LineageRecorder(LineageSink sink, MetricsSink metrics, RouterProperties properties) {
        this.sink = sink;
        this.metrics = metrics;
        this.writeTimeout = properties.getTimeouts().getLineage();
        this.buffer = new ArrayBlockingQueue<>(properties.getLineage().getBufferCapacity());
        log.info("LineageRecorder initialized: writeTimeout={}, bufferCapacity={}",
                writeTimeout, properties.getLineage().getBufferCapacity());
    }

    /**
     * Freeze the trace and write it in the background. A trace that was already recorded is ignored.
     */
    public void record(DecisionTrace trace) {
        persist(trace).subscribe();
    }

    /**
     * Freeze and write the trace. Completes once the write finished or the trace was buffered;
     * never signals an error.
     */
    public Mono<Void> persist(DecisionTrace trace) {
        if (!trace.freeze()) {
            log.debug("Decision trace auditId={} already recorded", trace.getAuditId());
            return Mono.empty();
        }
        return write(trace);
    }

    private Mono<Void> write(DecisionTrace trace) {
        return Mono.defer(() -> sink.write(trace))
                .timeout(writeTimeout)
                .onErrorResume(e -> {
                    log.warn("Lineage write failed for auditId={}, buffering: {}", trace.getAuditId(), e.toString());
                    buffer(trace);
                    return Mono.empty();
                });
    }

    private void buffer(DecisionTrace trace) {
        while (!buffer.offer(trace)) {
            DecisionTrace dropped = buffer.poll();
            if (dropped != null) {
                log.warn("Lineage buffer full, dropping oldest trace auditId={}", dropped.getAuditId());
            }
        }
        metrics.increment("lineage_buffered", trace.getContext().appId());
    }

    /**
     * Retry buffered traces. Traces that fail again go back into the buffer.
     */
    @Scheduled(fixedDelayString = "${router.lineage.flush-interval:PT15S}")
    public void flush() {
        flushNow().subscribe();
    }

    /**
     * Retry every buffered trace once.
     *
     * @return number of traces retried
     */
    public Mono<Integer> flushNow() {
        List<DecisionTrace> pending = new ArrayList<>();
        buffer.drainTo(pending);
        if (pending.isEmpty()) {
            return Mono.just(0);
        }
        log.info("Flushing {} buffered decision traces", pending.size());
        return Flux.fromIterable(pending)
                .concatMap(this::write)
                .then(Mono.just(pending.size()));
    }

    public int buffered() {
        return buffer.size();
    }
}
