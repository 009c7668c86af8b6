package com.z254.prophantom.hive.dispatch;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * FIFO execution lane with a fixed number of workers. Work submitted beyond the
 * worker count waits in arrival order. Cancelling waiting work removes it from the queue.
 */
class AgentLane {

    private final String name;
    private final int workers;
    private final Deque<Runnable> waiting = new ArrayDeque<>();
    private int running;
    private int holders;

    AgentLane(String name, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("Lane " + name + " needs at least one worker");
        }
        this.name = name;
        this.workers = workers;
    }

    <T> Mono<T> submit(Supplier<Mono<T>> work) {
        return Mono.create(sink -> {
            Slot<T> slot = new Slot<>(sink, work);
            sink.onCancel(slot::cancel);
            enqueue(slot);
        });
    }

    synchronized int running() {
        return running;
    }

    synchronized int waiting() {
        return waiting.size();
    }

    /**
     * Registers a pending turn. Callers pair it with {@link #drop()}.
     */
    synchronized void hold() {
        holders++;
    }

    /**
     * @return true when no pending turn holds the lane any more
     */
    synchronized boolean drop() {
        return --holders <= 0;
    }

    String name() {
        return name;
    }

    private void enqueue(Slot<?> slot) {
        boolean start;
        synchronized (this) {
            start = running < workers;
            if (start) {
                running++;
            } else {
                waiting.addLast(slot);
            }
        }
        if (start) {
            slot.run();
        }
    }

    /**
     * Hands the finishing worker to the oldest waiting slot, or frees it when none waits.
     */
    synchronized Runnable next() {
        Runnable next = waiting.pollFirst();
        if (next == null) {
            running--;
        }
        return next;
    }

    private void release() {
        Runnable next = next();
        if (next != null) {
            next.run();
        }
    }

    private synchronized boolean dequeue(Slot<?> slot) {
        return waiting.remove(slot);
    }

    private final class Slot<T> implements Runnable {
        private final MonoSink<T> sink;
        private final Supplier<Mono<T>> work;
        private boolean started;
        private boolean finished;
        private boolean cancelled;
        private Disposable subscription;

        private Slot(MonoSink<T> sink, Supplier<Mono<T>> work) {
            this.sink = sink;
            this.work = work;
        }

        @Override
        public void run() {
            boolean skip;
            synchronized (this) {
                skip = cancelled;
                started = !skip;
            }
            if (skip) {
                // Cancelled after leaving the queue but before starting
                finish();
                return;
            }
            Mono<T> mono;
            try {
                mono = work.get();
            } catch (RuntimeException e) {
                finish();
                sink.error(e);
                return;
            }
            Disposable disposable = mono.subscribe(
                    value -> {
                        finish();
                        sink.success(value);
                    },
                    error -> {
                        finish();
                        sink.error(error);
                    },
                    () -> {
                        finish();
                        sink.success();
                    });
            boolean disposeNow;
            synchronized (this) {
                subscription = disposable;
                disposeNow = cancelled;
            }
            if (disposeNow) {
                disposable.dispose();
            }
        }

        void cancel() {
            if (dequeue(this)) {
                return;
            }
            Disposable toDispose;
            synchronized (this) {
                cancelled = true;
                if (!started) {
                    return;
                }
                toDispose = subscription;
            }
            if (toDispose != null) {
                toDispose.dispose();
            }
            finish();
        }

        private void finish() {
            synchronized (this) {
                if (finished) {
                    return;
                }
                finished = true;
            }
            release();
        }
    }
}
