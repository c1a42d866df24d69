package com.waybackminer.core.harvest;

import com.waybackminer.core.model.UrlRecord;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 실행 하나의 출력 스트림.
 * - 생산자(워커)는 emit(), 소비자는 iterator()/stream() 으로 읽는다.
 * - 버퍼가 차면 생산자가 기다린다. 단 cancel() 이후에는 누구도 기다리지 않는다.
 * - 소비자가 더 읽지 않을 거면 close() 로 취소해야 워커가 멈춘다.
 * 반복자는 큐를 비우며 읽으므로 한 소비자만 쓰는 것을 전제로 한다.
 */
public final class HarvestRun implements Iterable<UrlRecord>, AutoCloseable {

    static final long POLL_MS = 50;

    private final String domain;
    private final BlockingQueue<UrlRecord> queue;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile boolean finished = false;
    private volatile Runnable onCancel = () -> {};

    HarvestRun(String domain, int bufferSize) {
        this.domain = domain;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, bufferSize));
    }

    public String domain() { return domain; }

    // ---------- 생산자 측 ----------

    /**
     * 버퍼에 넣는다. 취소되었거나 인터럽트되면 false(레코드는 버려짐).
     */
    boolean emit(UrlRecord record) {
        try {
            while (!cancelled.get()) {
                if (queue.offer(record, POLL_MS, TimeUnit.MILLISECONDS)) return true;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    /** 모든 작업 단위가 끝났을 때 하베스터가 호출 */
    void finish() {
        finished = true;
        done.countDown();
    }

    void onCancel(Runnable hook) {
        this.onCancel = (hook == null ? () -> {} : hook);
    }

    AtomicBoolean cancelFlag() { return cancelled; }

    // ---------- 소비자 측 ----------

    /** 실행 중단. 진행 중 요청은 취소되고 스트림은 곧바로 끝난다. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            onCancel.run();
            queue.clear();
        }
    }

    /** 끝까지 읽은 뒤라면 아무 일도 하지 않는다. */
    @Override
    public void close() {
        if (!finished) cancel();
    }

    public boolean isCancelled() { return cancelled.get(); }

    /** 모든 작업 단위가 끝났는가(아직 읽지 않은 레코드가 남아 있을 수 있음) */
    public boolean isFinished() { return finished; }

    /** 파이프라인 종료까지 대기. 시간 안에 끝나면 true */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public Iterator<UrlRecord> iterator() {
        return new Iterator<>() {
            private UrlRecord next;

            @Override public boolean hasNext() {
                if (next != null) return true;
                try {
                    while (!cancelled.get()) {
                        UrlRecord r = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                        if (r != null) { next = r; return true; }
                        if (finished) {
                            // finish() 직전 마지막 emit 과의 경합 방지
                            next = queue.poll();
                            return next != null;
                        }
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    cancel();
                }
                return false;
            }

            @Override public UrlRecord next() {
                if (!hasNext()) throw new NoSuchElementException();
                UrlRecord r = next;
                next = null;
                return r;
            }
        };
    }

    /** 순차 스트림. 스트림을 close 하면 실행도 취소된다(끝까지 읽었다면 무해). */
    public Stream<UrlRecord> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.NONNULL), false)
                .onClose(this::close);
    }
}
