package com.len.directory.application.event;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 구독자 한 명의 수신 버퍼.
 *
 * - 버퍼가 가득 차면 가장 오래된 미수신 이벤트를 버리고 missed 를 올린다 (발행자는 절대 기다리지 않음)
 * - 다음 poll 에서 warning 이벤트 1건으로 missed 개수를 알려주고, 이후 남은 이벤트를 이어서 준다
 * - close() 하면 EventBus 에서 빠진다
 */
public class EventSubscription implements AutoCloseable {

    private final int capacity;
    private final ArrayDeque<DirectoryEvent> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Runnable onClose;

    private long missed;
    private boolean closed;

    EventSubscription(int capacity, Runnable onClose) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
        this.onClose = onClose;
    }

    void offer(DirectoryEvent event) {
        lock.lock();
        try {
            if (closed) return;
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
                missed++;
            }
            buffer.addLast(event);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 다음 이벤트를 최대 timeout 만큼 기다린다.
     * @return timeout 이나 close 면 empty
     */
    public Optional<DirectoryEvent> poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (!closed && missed == 0 && buffer.isEmpty()) {
                if (remainingNanos <= 0) {
                    return Optional.empty();
                }
                remainingNanos = notEmpty.awaitNanos(remainingNanos);
            }
            if (closed) {
                return Optional.empty();
            }
            if (missed > 0) {
                long count = missed;
                missed = 0;
                return Optional.of(DirectoryEvent.missed(count));
            }
            return Optional.ofNullable(buffer.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public int buffered() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            buffer.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.run();
    }
}
