package org.iceforge.bifrost.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persists access events into the {@code access_log} table from a background writer.
 *
 * <p>{@link #append} only enqueues. When the queue is full the event is dropped and counted;
 * the {@code bifrost.audit} log line still exists for it.
 */
public final class JdbcAccessLogSink implements AuditSink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcAccessLogSink.class);

    private static final String INSERT = "INSERT INTO access_log "
            + "(occurred_at, protocol, connector_id, share_id, operation, outcome, error_code, caller, "
            + "remote_address, latency_ms, response_bytes) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final int BATCH = 128;

    private final DataSource dataSource;
    private final BlockingQueue<AccessEvent> queue;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong writeErrors = new AtomicLong();
    private final AtomicLong pending = new AtomicLong();
    private final Thread writer;

    public JdbcAccessLogSink(DataSource dataSource, int queueCapacity) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.writer = new Thread(this::writerLoop, "access-log-writer");
        this.writer.setDaemon(true);
        this.writer.start();
    }

    @Override
    public void append(AccessEvent event) {
        if (event == null || !running.get()) {
            return;
        }
        pending.incrementAndGet();
        if (!queue.offer(event)) {
            pending.decrementAndGet();
            long n = dropped.incrementAndGet();
            if (n == 1 || n % 1000 == 0) {
                log.warn("access_log queue full, {} events dropped so far", n);
            }
        }
    }

    public long droppedEvents() {
        return dropped.get();
    }

    public long writeErrorCount() {
        return writeErrors.get();
    }

    /** Blocks until everything queued so far is written or {@code timeout} passes. */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    private void writerLoop() {
        List<AccessEvent> batch = new ArrayList<>(BATCH);
        while (running.get() || !queue.isEmpty()) {
            try {
                AccessEvent first = queue.poll(200, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, BATCH - 1);
                write(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (SQLException e) {
                writeErrors.incrementAndGet();
                log.warn("access_log write of {} events failed: {}", batch.size(), e.getMessage());
            } finally {
                pending.addAndGet(-batch.size());
                batch.clear();
            }
        }
    }

    private void write(List<AccessEvent> events) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT)) {
            for (AccessEvent e : events) {
                ps.setObject(1, OffsetDateTime.ofInstant(e.timestamp(), ZoneOffset.UTC));
                ps.setString(2, e.protocol());
                setNullable(ps, 3, e.connectorId());
                setNullable(ps, 4, e.shareId());
                setNullable(ps, 5, e.operation());
                ps.setString(6, e.outcome().name());
                setNullable(ps, 7, e.errorCode() == null ? null : e.errorCode().name());
                ps.setString(8, e.caller());
                setNullable(ps, 9, e.remoteAddress());
                ps.setLong(10, e.latencyMillis());
                ps.setLong(11, e.bytes());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void setNullable(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }

    @Override
    public void close() {
        running.set(false);
        try {
            writer.join(Duration.ofSeconds(5).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
