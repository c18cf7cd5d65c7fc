package fleetmon.monitoring.scheduler;

import fleetmon.monitoring.core.InboundQueue;
import fleetmon.monitoring.core.InvalidAddressException;
import fleetmon.monitoring.model.ContainerList;
import fleetmon.monitoring.model.NodeInfo;
import fleetmon.monitoring.service.MonitoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs the two inbound consumer loops:
 * - node loop: one {@link MonitoringService#ingest} per utilization sample
 * - container loop: inventory messages, logged only
 *
 * Each loop ends when its queue is closed and drained. The loops share
 * nothing but the service, which serializes their access to the store.
 */
public class TelemetryDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetryDispatcher.class);

    private final InboundQueue<NodeInfo> nodeQueue;
    private final InboundQueue<ContainerList> containerQueue;
    private final MonitoringService service;
    private final ExecutorService executor;

    private final AtomicLong nodesProcessed = new AtomicLong();
    private final AtomicLong nodesRejected = new AtomicLong();
    private final AtomicLong containerListsProcessed = new AtomicLong();

    private volatile boolean started = false;

    public TelemetryDispatcher(InboundQueue<NodeInfo> nodeQueue,
            InboundQueue<ContainerList> containerQueue,
            MonitoringService service) {
        this.nodeQueue = nodeQueue;
        this.containerQueue = containerQueue;
        this.service = service;
        this.executor = Executors.newFixedThreadPool(2, namedDaemonThreads());
    }

    /**
     * Start both loops. Calling it again is a no-op.
     */
    public synchronized void start() {
        if (started) {
            log.warn("Dispatcher already started");
            return;
        }
        started = true;

        executor.submit(() -> consume(nodeQueue, this::handleNodeInfo));
        executor.submit(() -> consume(containerQueue, this::handleContainerList));
        executor.shutdown(); // no further loops; threads exit when both queues end

        log.info("Telemetry dispatcher started (node queue {}, container queue {})",
                nodeQueue.capacity(), containerQueue.capacity());
    }

    /**
     * Wait for both loops to finish, i.e. for both queues to be closed and drained.
     *
     * @return true if both loops finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }

    /**
     * Close both queues and wait for the loops to drain what was already queued.
     */
    @Override
    public void close() {
        nodeQueue.close();
        containerQueue.close();

        if (!started) {
            executor.shutdownNow();
            return;
        }

        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Telemetry dispatcher forcefully stopped");
            } else {
                log.info("Telemetry dispatcher stopped ({} samples, {} rejected, {} container lists)",
                        nodesProcessed.get(), nodesRejected.get(), containerListsProcessed.get());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public long nodesProcessed() {
        return nodesProcessed.get();
    }

    public long nodesRejected() {
        return nodesRejected.get();
    }

    public long containerListsProcessed() {
        return containerListsProcessed.get();
    }

    public InboundQueue<NodeInfo> nodeQueue() {
        return nodeQueue;
    }

    public InboundQueue<ContainerList> containerQueue() {
        return containerQueue;
    }

    void handleNodeInfo(NodeInfo node) {
        try {
            service.ingest(node);
            nodesProcessed.incrementAndGet();
        } catch (InvalidAddressException e) {
            nodesRejected.incrementAndGet();
            log.warn("Error storing NodeInfo for {}: {}", node.nodeName(), e.getMessage());
        }
    }

    void handleContainerList(ContainerList containerList) {
        service.observeContainers(containerList);
        containerListsProcessed.incrementAndGet();
    }

    private <T> void consume(InboundQueue<T> queue, Consumer<T> handler) {
        log.debug("{} loop started", queue.name());
        try {
            while (true) {
                Optional<T> next = queue.receive();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    handler.accept(next.get());
                } catch (RuntimeException e) {
                    log.error("{} loop error", queue.name(), e);
                }
            }
            log.info("{} stream closed, loop finished", queue.name());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} loop interrupted", queue.name());
        }
    }

    private static ThreadFactory namedDaemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        String[] names = { "monitor-node-loop", "monitor-container-loop" };
        return r -> {
            int i = counter.getAndIncrement();
            Thread t = new Thread(r, i < names.length ? names[i] : "monitor-loop-" + i);
            t.setDaemon(true);
            return t;
        };
    }
}
