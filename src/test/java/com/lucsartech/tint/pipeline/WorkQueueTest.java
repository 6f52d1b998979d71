package com.lucsartech.tint.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class WorkQueueTest {

    @Test
    @DisplayName("should deliver items in FIFO order and then report closure")
    void shouldDeliverInOrder() throws InterruptedException {
        var queue = new WorkQueue<String>("test", 3);
        queue.send("a");
        queue.send("b");
        queue.send("c");
        queue.close();

        assertThat(queue.receive()).contains("a");
        assertThat(queue.receive()).contains("b");
        assertThat(queue.receive()).contains("c");
        assertThat(queue.receive()).isEmpty();
        assertThat(queue.receive()).isEmpty();
    }

    @Test
    @DisplayName("should reject sends after close")
    void shouldRejectSendAfterClose() throws InterruptedException {
        var queue = new WorkQueue<String>("closed", 2);
        queue.close();

        assertThat(queue.isClosed()).isTrue();
        assertThatThrownBy(() -> queue.send("late"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
    }

    @Test
    @DisplayName("should treat repeated close as a no-op")
    void shouldCloseIdempotently() throws InterruptedException {
        var queue = new WorkQueue<String>("twice", 1);
        queue.close();
        queue.close();

        assertThat(queue.receive()).isEmpty();
    }

    @Test
    @DisplayName("should block senders while full")
    void shouldApplyBackpressure() throws Exception {
        var queue = new WorkQueue<Integer>("bounded", 1);
        queue.send(1);
        var secondSent = new AtomicBoolean(false);
        var sent = new CountDownLatch(1);

        var sender = new Thread(() -> {
            try {
                queue.send(2);
                secondSent.set(true);
                sent.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sender.start();

        assertThat(sent.await(100, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(secondSent).isFalse();

        assertThat(queue.receive()).contains(1);
        assertThat(sent.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(queue.receive()).contains(2);
        sender.join();
    }

    @Test
    @DisplayName("should let every receiver observe closure after draining")
    void shouldReleaseAllReceivers() {
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            var queue = new WorkQueue<Integer>("shared", 4);
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                var futures = new ArrayList<Future<List<Integer>>>();
                for (int i = 0; i < 4; i++) {
                    futures.add(executor.submit(() -> {
                        var received = new ArrayList<Integer>();
                        while (true) {
                            var next = queue.receive();
                            if (next.isEmpty()) {
                                return received;
                            }
                            received.add(next.get());
                        }
                    }));
                }

                for (int i = 0; i < 100; i++) {
                    queue.send(i);
                }
                queue.close();

                var all = new ArrayList<Integer>();
                for (var future : futures) {
                    all.addAll(future.get());
                }
                assertThat(all).hasSize(100).doesNotHaveDuplicates();
            } finally {
                executor.shutdownNow();
            }
        });
    }

    @Test
    @DisplayName("should reject invalid arguments")
    void shouldValidate() {
        assertThatThrownBy(() -> new WorkQueue<String>("zero", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkQueue<String>("nulls", 1).send(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
