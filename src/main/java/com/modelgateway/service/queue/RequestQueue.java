package com.modelgateway.service.queue;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.exception.RequestExpiredException;
import com.modelgateway.model.dto.QueueStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded admission queue in front of the router.
 *
 * <p>
 * Higher priority tiers are always served first. Within a tier each caller has
 * its own FIFO, so one caller's requests leave in arrival order, and callers
 * take turns in weighted round robin ({@code gateway.queue.caller-weights},
 * default weight 1) so a single busy caller cannot starve the others.
 *
 * <p>
 * A full queue rejects immediately instead of blocking the producer. Requests
 * whose deadline passes while queued are removed by {@link #sweepExpired()} and
 * their futures fail with {@link RequestExpiredException}.
 */
@Slf4j
public class RequestQueue {

    private final GatewayProperties.QueueConfig config;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final NavigableMap<Integer, Tier> tiers = new TreeMap<>(Collections.reverseOrder());
    private int depth;

    private long accepted;
    private long rejected;
    private long expired;
    private long dequeued;

    public RequestQueue(GatewayProperties.QueueConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public QueueAdmission enqueue(QueuedRequest item) {
        lock.lock();
        try {
            if (depth >= config.getMaxDepth()) {
                rejected++;
                log.info("Queue full ({}), rejecting request {} from {}",
                        depth, item.getRequest().getRequestId(), item.getCallerId());
                return QueueAdmission.rejected(depth, "Queue is full (" + config.getMaxDepth() + " requests)");
            }
            tiers.computeIfAbsent(item.getRequest().getPriority(), priority -> new Tier()).add(item);
            depth++;
            accepted++;
            notEmpty.signal();
            return QueueAdmission.accepted(depth);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next request to serve, or null when the queue is empty.
     */
    public QueuedRequest dequeue() {
        lock.lock();
        try {
            return takeNext();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code timeout} for a request.
     *
     * @return the next request, or null if none arrived in time
     */
    public QueuedRequest poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (depth == 0) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return takeNext();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every queued request whose deadline has passed and fail its future.
     *
     * @return number of requests expired
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        List<QueuedRequest> dropped = new ArrayList<>();

        lock.lock();
        try {
            Iterator<Tier> it = tiers.values().iterator();
            while (it.hasNext()) {
                Tier tier = it.next();
                tier.removeExpired(now, dropped);
                if (tier.isEmpty()) {
                    it.remove();
                }
            }
            depth -= dropped.size();
            expired += dropped.size();
        } finally {
            lock.unlock();
        }

        // Complete outside the lock; dependants may run inline
        for (QueuedRequest item : dropped) {
            item.getResult().completeExceptionally(new RequestExpiredException(item.getRequest().getRequestId()));
        }
        if (!dropped.isEmpty()) {
            log.warn("Expired {} queued requests past their deadline", dropped.size());
        }
        return dropped.size();
    }

    public int size() {
        lock.lock();
        try {
            return depth;
        } finally {
            lock.unlock();
        }
    }

    public QueueStatistics statistics() {
        lock.lock();
        try {
            Map<Integer, Integer> byPriority = new TreeMap<>(Collections.reverseOrder());
            tiers.forEach((priority, tier) -> byPriority.put(priority, tier.size));
            return QueueStatistics.builder()
                    .depth(depth)
                    .maxDepth(config.getMaxDepth())
                    .accepted(accepted)
                    .rejected(rejected)
                    .expired(expired)
                    .dequeued(dequeued)
                    .depthByPriority(byPriority)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private QueuedRequest takeNext() {
        Map.Entry<Integer, Tier> highest = tiers.firstEntry();
        if (highest == null) {
            return null;
        }
        Tier tier = highest.getValue();
        QueuedRequest next = tier.take();
        if (tier.isEmpty()) {
            tiers.remove(highest.getKey());
        }
        depth--;
        dequeued++;
        return next;
    }

    private int weightOf(String caller) {
        Integer weight = config.getCallerWeights().get(caller);
        return weight == null || weight < 1 ? 1 : weight;
    }

    /**
     * One priority level: per-caller FIFOs served in weighted round robin.
     */
    private final class Tier {

        private final Map<String, Deque<QueuedRequest>> byCaller = new HashMap<>();
        private final Deque<String> rotation = new ArrayDeque<>();
        private int turnsTaken;
        private int size;

        void add(QueuedRequest item) {
            Deque<QueuedRequest> pending = byCaller.get(item.getCallerId());
            if (pending == null) {
                pending = new ArrayDeque<>();
                byCaller.put(item.getCallerId(), pending);
                rotation.addLast(item.getCallerId());
            }
            pending.addLast(item);
            size++;
        }

        QueuedRequest take() {
            String caller = rotation.peekFirst();
            Deque<QueuedRequest> pending = byCaller.get(caller);
            QueuedRequest next = pending.pollFirst();
            size--;
            turnsTaken++;

            if (pending.isEmpty()) {
                byCaller.remove(caller);
                rotation.pollFirst();
                turnsTaken = 0;
            } else if (turnsTaken >= weightOf(caller)) {
                rotation.addLast(rotation.pollFirst());
                turnsTaken = 0;
            }
            return next;
        }

        void removeExpired(Instant now, List<QueuedRequest> dropped) {
            Iterator<String> callers = rotation.iterator();
            String head = rotation.peekFirst();
            while (callers.hasNext()) {
                String caller = callers.next();
                Deque<QueuedRequest> pending = byCaller.get(caller);
                Iterator<QueuedRequest> items = pending.iterator();
                while (items.hasNext()) {
                    QueuedRequest item = items.next();
                    if (item.getRequest().isExpired(now)) {
                        items.remove();
                        dropped.add(item);
                        size--;
                    }
                }
                if (pending.isEmpty()) {
                    byCaller.remove(caller);
                    callers.remove();
                    if (caller.equals(head)) {
                        turnsTaken = 0;
                    }
                }
            }
        }

        boolean isEmpty() {
            return size == 0;
        }
    }
}
