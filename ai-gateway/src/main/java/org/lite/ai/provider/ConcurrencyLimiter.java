package org.lite.ai.provider;

import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Non-blocking permit pool bounding in-flight calls to one provider. Waiters queue in FIFO order and
 * leave the queue when their subscriber cancels.
 */
public class ConcurrencyLimiter {

    private final int maxConcurrent;
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int inFlight;

    public ConcurrencyLimiter(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1");
        }
        this.maxConcurrent = maxConcurrent;
    }

    public <T> Mono<T> withPermit(Supplier<Mono<T>> call) {
        return Mono.usingWhen(acquire(), permit -> call.get(), permit -> Mono.fromRunnable(permit::release));
    }

    public synchronized int getInFlight() {
        return inFlight;
    }

    public synchronized int getWaiting() {
        return waiters.size();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    Mono<Permit> acquire() {
        return Mono.create(sink -> {
            Waiter waiter = null;
            synchronized (this) {
                if (inFlight < maxConcurrent) {
                    inFlight++;
                } else {
                    waiter = new Waiter(sink);
                    waiters.addLast(waiter);
                }
            }
            if (waiter == null) {
                sink.success(new Permit());
                return;
            }
            Waiter queued = waiter;
            sink.onCancel(() -> {
                queued.cancelled.set(true);
                if (queued.done.compareAndSet(false, true)) {
                    synchronized (this) {
                        waiters.remove(queued);
                    }
                }
            });
        });
    }

    private void releaseOne() {
        while (true) {
            Waiter next;
            synchronized (this) {
                next = waiters.pollFirst();
                if (next == null) {
                    inFlight--;
                    return;
                }
            }
            // the permit passes straight to the next waiter, inFlight stays the same
            if (next.done.compareAndSet(false, true)) {
                Permit permit = new Permit();
                next.sink.success(permit);
                // cancelled between the hand-over and delivery: nobody will release it downstream
                if (next.cancelled.get()) {
                    permit.release();
                }
                return;
            }
        }
    }

    private static final class Waiter {
        private final MonoSink<Permit> sink;
        private final AtomicBoolean done = new AtomicBoolean();
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }
    }

    final class Permit {
        private final AtomicBoolean released = new AtomicBoolean();

        void release() {
            if (released.compareAndSet(false, true)) {
                releaseOne();
            }
        }
    }
}
