package com.chatmirror.pull;

import software.amazon.awssdk.services.sqs.SqsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the single {@link SubscriptionPuller} of each (endpoint, subscription) pair in this process.
 * Closing the registry stops every puller it created.
 */
public class PullerRegistry implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PullerRegistry.class);

    private final SqsClient sqsClient;
    private final PullStatusRepository statusRepository;
    private final PullerSettings settings;
    private final Map<SubscriptionKey, SubscriptionPuller> pullers = new HashMap<>();

    public PullerRegistry(SqsClient sqsClient, PullStatusRepository statusRepository, PullerSettings settings) {
        this.sqsClient = sqsClient;
        this.statusRepository = statusRepository;
        this.settings = settings;
    }

    /**
     * @return the puller for the pair, creating it on first use
     * @throws IllegalArgumentException if either argument is empty
     */
    public SubscriptionPuller getOrCreate(String endpoint, String subscriptionId) {
        SubscriptionKey key = new SubscriptionKey(endpoint, subscriptionId);
        synchronized (pullers) {
            return pullers.computeIfAbsent(key, k -> {
                LOGGER.info("creating puller for {}", k);
                return new SubscriptionPuller(k, sqsClient, statusRepository, settings);
            });
        }
    }

    public Optional<SubscriptionPuller> find(String endpoint, String subscriptionId) {
        SubscriptionKey key = new SubscriptionKey(endpoint, subscriptionId);
        synchronized (pullers) {
            return Optional.ofNullable(pullers.get(key));
        }
    }

    public int size() {
        synchronized (pullers) {
            return pullers.size();
        }
    }

    @Override
    public void close() {
        List<SubscriptionPuller> all;
        synchronized (pullers) {
            all = new ArrayList<>(pullers.values());
        }
        for (SubscriptionPuller puller : all) {
            if (!puller.isRunning()) {
                continue;
            }
            try {
                puller.stop();
            } catch (RuntimeException e) {
                LOGGER.error("failed to stop puller {} on shutdown", puller.getKey(), e);
            }
        }
        LOGGER.info("puller registry closed, {} pullers", all.size());
    }
}
