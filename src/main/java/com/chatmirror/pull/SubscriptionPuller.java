package com.chatmirror.pull;

import com.chatmirror.projector.InvalidEventException;
import com.chatmirror.sqs.SqsMessageOperations;
import com.chatmirror.sqs.SqsMessageParser;
import com.chatmirror.sqs.SqsParsedMessage;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Receive loop for one (endpoint, subscription) pair.
 *
 * <p>Each {@link #start} runs the loop on its own daemon thread. The loop receives batches from the subscription's
 * queue and hands every decoded notification to the handler: success deletes the message, an
 * {@link InvalidEventException} drops it, any other error makes it visible again for redelivery. {@link #stop}
 * is cooperative and checked between messages, never interrupting a running handler.</p>
 *
 * <p>The local view (is a loop running in this process) and the persisted status record are compared on every
 * {@link #checkStatus}; a disagreement raises {@link PullStatusConsistencyException}.</p>
 */
public class SubscriptionPuller {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionPuller.class);

    private final SubscriptionKey key;
    private final String queueUrl;
    private final SqsClient sqsClient;
    private final PullStatusRepository statusRepository;
    private final PullerSettings settings;

    private final Counter acked;
    private final Counter dropped;
    private final Counter nacked;

    private final Object lock = new Object();
    private Future<PullStatus> loopFuture;
    private AtomicBoolean cancelRequested;
    private AtomicBoolean abandoned;
    private boolean pulling;

    public SubscriptionPuller(SubscriptionKey key, SqsClient sqsClient, PullStatusRepository statusRepository, PullerSettings settings) {
        this.key = key;
        this.queueUrl = SqsMessageOperations.queueUrl(key.endpoint(), key.subscriptionId());
        this.sqsClient = sqsClient;
        this.statusRepository = statusRepository;
        this.settings = settings;

        this.acked = messageCounter("acked");
        this.dropped = messageCounter("dropped");
        this.nacked = messageCounter("nacked");
    }

    private Counter messageCounter(String outcome) {
        return Counter
                .builder("chat_mirror_pull_messages_total")
                .description("counter for queue messages handled by subscription pullers")
                .tags("subscription", key.subscriptionId(), "outcome", outcome)
                .register(Metrics.globalRegistry);
    }

    public SubscriptionKey getKey() {
        return key;
    }

    public String getQueueUrl() {
        return queueUrl;
    }

    /**
     * Starts the receive loop and records RUNNING.
     *
     * @throws IllegalArgumentException if {@code handler} is null or the subscription's queue does not exist
     * @throws AlreadyRunningException  if a loop for this pair is already active in this process
     */
    public void start(NotificationHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        synchronized (lock) {
            if (isLocallyRunning()) {
                throw new AlreadyRunningException(key);
            }
            if (!SqsMessageOperations.queueExists(sqsClient, queueUrl)) {
                throw new IllegalArgumentException("Subscription " + key.subscriptionId() + " not found at " + queueUrl);
            }

            statusRepository.write(key.subscriptionId(), PullStatus.RUNNING, PullStatus.RUNNING.defaultMessage(key.subscriptionId()));

            AtomicBoolean cancel = new AtomicBoolean(false);
            AtomicBoolean abandon = new AtomicBoolean(false);
            ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                    .setNameFormat("pull-" + key.subscriptionId() + "-%d")
                    .setDaemon(true)
                    .build());
            this.cancelRequested = cancel;
            this.abandoned = abandon;
            this.loopFuture = executor.submit(() -> runLoop(handler, cancel, abandon));
            // the thread ends with the loop
            executor.shutdown();
            this.pulling = true;
        }
        LOGGER.info("started pulling {}", key);
    }

    /**
     * Requests the loop to stop and waits for it for at most the configured stop timeout.
     *
     * @return the status after stopping; a loop that had already ended is only re-checked
     * @throws StopTimeoutException if the loop does not finish in time; FAILED is recorded and the puller is
     *                              considered not running from then on
     */
    public PullStatusResponse stop() {
        Future<PullStatus> loop;
        AtomicBoolean abandon;
        synchronized (lock) {
            loop = this.loopFuture;
            if (loop == null || loop.isDone() || !pulling) {
                LOGGER.info("stop requested for {} with no active loop", key);
                this.pulling = false;
                return checkStatus();
            }
            abandon = this.abandoned;
            this.cancelRequested.set(true);
        }

        PullStatus outcome = null;
        try {
            outcome = loop.get(settings.stopTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon.set(true);
            synchronized (lock) {
                this.pulling = false;
            }
            LOGGER.error("pull loop for {} did not stop within {}ms", key, settings.stopTimeoutMs());
            statusRepository.write(key.subscriptionId(), PullStatus.FAILED,
                    PullStatus.FAILED.defaultMessage(key.subscriptionId(), "stop timed out after " + settings.stopTimeoutMs() + "ms"));
            throw new StopTimeoutException(key, settings.stopTimeoutMs());
        } catch (ExecutionException e) {
            LOGGER.error("pull loop for {} ended abnormally", key, e.getCause());
            writeFailedQuietly(key.subscriptionId(), describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while stopping " + key, e);
        }

        synchronized (lock) {
            this.pulling = false;
        }
        if (outcome == PullStatus.STOPPED) {
            statusRepository.write(key.subscriptionId(), PullStatus.STOPPED, PullStatus.STOPPED.defaultMessage(key.subscriptionId()));
            LOGGER.info("stopped pulling {}", key);
        }
        return checkStatus();
    }

    /**
     * Reconciles the local loop state with the persisted record.
     *
     * @throws PullStatusConsistencyException if the two disagree about whether the loop runs
     */
    public PullStatusResponse checkStatus() {
        boolean local;
        synchronized (lock) {
            local = isLocallyRunning();
        }
        String sub = key.subscriptionId();
        Optional<PullStatusResponse> persisted = statusRepository.read(sub);

        if (persisted.isPresent() && persisted.get().status() == PullStatus.RUNNING) {
            if (local) {
                return persisted.get();
            }
            throw new PullStatusConsistencyException("Status record for " + sub
                    + " says running but no loop is running in this process");
        }
        if (local) {
            throw new PullStatusConsistencyException("Loop for " + sub + " is running but its status record is "
                    + persisted.map(p -> p.status().code()).orElse("missing"));
        }
        return persisted.orElseGet(() -> new PullStatusResponse(sub, PullStatus.NOT_STARTED,
                PullStatus.NOT_STARTED.defaultMessage(sub), null));
    }

    public boolean isRunning() {
        synchronized (lock) {
            return isLocallyRunning();
        }
    }

    private boolean isLocallyRunning() {
        return pulling && loopFuture != null && !loopFuture.isDone();
    }

    private PullStatus runLoop(NotificationHandler handler, AtomicBoolean cancel, AtomicBoolean abandon) {
        String sub = key.subscriptionId();
        try {
            while (!cancel.get()) {
                List<Message> messages = SqsMessageOperations.receiveMessages(sqsClient, queueUrl,
                        settings.maxMessages(), settings.waitTimeSeconds(), settings.visibilityTimeoutSeconds());
                for (int i = 0; i < messages.size(); i++) {
                    if (cancel.get()) {
                        // unprocessed messages go straight back to the queue
                        for (Message remaining : messages.subList(i, messages.size())) {
                            SqsMessageOperations.nack(sqsClient, queueUrl, remaining);
                        }
                        break;
                    }
                    process(messages.get(i), handler);
                }
            }
            LOGGER.info("pull loop for {} exiting on stop request", key);
            return PullStatus.STOPPED;
        } catch (QueueDoesNotExistException e) {
            LOGGER.error("sqs_error: queue for {} no longer exists, removing its status record", key);
            releaseIfCurrent(cancel);
            if (!abandon.get()) {
                deleteStatusQuietly(sub);
            }
            return PullStatus.NOT_STARTED;
        } catch (Exception e) {
            LOGGER.error("sqs_error: pull loop for {} failed", key, e);
            releaseIfCurrent(cancel);
            // a loop abandoned by a timed-out stop must not overwrite a newer record
            if (!abandon.get()) {
                writeFailedQuietly(sub, describe(e));
            }
            return PullStatus.FAILED;
        }
    }

    /**
     * Marks this process as no longer pulling before a failed loop records its outcome, so status checks in
     * between see the persisted record rather than a running loop. A newer start owns its own cancel flag.
     */
    private void releaseIfCurrent(AtomicBoolean cancel) {
        synchronized (lock) {
            if (this.cancelRequested == cancel) {
                this.pulling = false;
            }
        }
    }

    private void process(Message message, NotificationHandler handler) {
        SqsParsedMessage parsed;
        try {
            parsed = SqsMessageParser.parse(message);
        } catch (InvalidEventException e) {
            LOGGER.warn("dropping message {} on {}: {}", message.messageId(), key, e.getMessage());
            SqsMessageOperations.ack(sqsClient, queueUrl, message);
            dropped.increment();
            return;
        }

        try {
            handler.handle(parsed.notification());
            SqsMessageOperations.ack(sqsClient, queueUrl, message);
            acked.increment();
        } catch (InvalidEventException e) {
            LOGGER.warn("dropping invalid event in message {} on {}: {}", message.messageId(), key, e.getMessage());
            SqsMessageOperations.ack(sqsClient, queueUrl, message);
            dropped.increment();
        } catch (Exception e) {
            LOGGER.error("error processing message {} on {}", message.messageId(), key, e);
            SqsMessageOperations.nack(sqsClient, queueUrl, message);
            nacked.increment();
        }
    }

    private void writeFailedQuietly(String sub, String error) {
        try {
            statusRepository.write(sub, PullStatus.FAILED, PullStatus.FAILED.defaultMessage(sub, error));
        } catch (RuntimeException storeError) {
            LOGGER.error("store_error: unable to record failure of {}", key, storeError);
        }
    }

    private void deleteStatusQuietly(String sub) {
        try {
            statusRepository.delete(sub);
        } catch (RuntimeException storeError) {
            LOGGER.error("store_error: unable to remove status record of {}", key, storeError);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
