package fleetmon.monitoring.core;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class InboundQueueTest {

    @Test
    void deliversInFifoOrder() throws Exception {
        InboundQueue<String> queue = new InboundQueue<>("test", 4);
        queue.send("a");
        queue.send("b");
        assertTrue(queue.offer("c"));

        assertEquals(Optional.of("a"), queue.receive());
        assertEquals(Optional.of("b"), queue.receive());
        assertEquals(Optional.of("c"), queue.receive());
        assertEquals(0, queue.size());
    }

    @Test
    void offerFailsWhenFull() {
        InboundQueue<Integer> queue = new InboundQueue<>("test", 2);
        assertTrue(queue.offer(1));
        assertTrue(queue.offer(2));
        assertFalse(queue.offer(3));
        assertEquals(2, queue.size());
    }

    @Test
    void closedQueueDrainsThenEnds() throws Exception {
        InboundQueue<String> queue = new InboundQueue<>("test", 4);
        queue.send("x");
        queue.send("y");
        queue.close();

        assertEquals(Optional.of("x"), queue.receive());
        assertEquals(Optional.of("y"), queue.receive());
        assertTrue(queue.receive().isEmpty());
        assertTrue(queue.receive().isEmpty()); // stays ended
    }

    @Test
    void sendAfterCloseIsRejected() {
        InboundQueue<String> queue = new InboundQueue<>("test", 4);
        queue.close();
        queue.close(); // idempotent

        assertTrue(queue.isClosed());
        assertThrows(IllegalStateException.class, () -> queue.send("late"));
        assertThrows(IllegalStateException.class, () -> queue.offer("late"));
    }

    @Test
    void nullItemsAreRejected() {
        InboundQueue<String> queue = new InboundQueue<>("test", 4);
        assertThrows(NullPointerException.class, () -> queue.offer(null));
        assertThrows(NullPointerException.class, () -> queue.send(null));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InboundQueue<String>("test", 0));
    }

    @Test
    void closeWakesBlockedReceiver() throws Exception {
        InboundQueue<String> queue = new InboundQueue<>("test", 4);
        AtomicReference<Optional<String>> received = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                received.set(queue.receive());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();

        TimeUnit.MILLISECONDS.sleep(50);
        queue.close();

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(received.get().isEmpty());
    }

    @Test
    void blockedSenderProceedsWhenSpaceFrees() throws Exception {
        InboundQueue<Integer> queue = new InboundQueue<>("test", 1);
        queue.send(1);
        CountDownLatch sent = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            try {
                queue.send(2);
                sent.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        assertFalse(sent.await(100, TimeUnit.MILLISECONDS));
        assertEquals(Optional.of(1), queue.receive());
        assertTrue(sent.await(2, TimeUnit.SECONDS));
        assertEquals(Optional.of(2), queue.receive());
    }

    @Test
    void blockedSenderFailsWhenClosed() throws Exception {
        InboundQueue<Integer> queue = new InboundQueue<>("test", 1);
        queue.send(1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            try {
                queue.send(2);
            } catch (Throwable t) {
                failure.set(t);
            }
            done.countDown();
        });
        producer.start();

        TimeUnit.MILLISECONDS.sleep(50);
        queue.close();

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, failure.get());
        assertEquals(Optional.of(1), queue.receive());
        assertTrue(queue.receive().isEmpty());
    }
}
