package com.aigreentick.services.dispatcher.dispatch.service.impl;

import java.util.ArrayList;
import java.util.List;

/**
 * Round-robin split of the target sequence across senders.
 */
public final class TargetPartitioner {

    private TargetPartitioner() {
    }

    /**
     * Target {@code i} goes to partition {@code i mod senders}. Relative order is kept inside
     * each partition and partition sizes differ by at most one.
     */
    public static <T> List<List<T>> roundRobin(List<T> targets, int senders) {
        if (senders < 1) {
            throw new IllegalArgumentException("senders must be >= 1, got " + senders);
        }
        List<List<T>> partitions = new ArrayList<>(senders);
        for (int i = 0; i < senders; i++) {
            partitions.add(new ArrayList<>(targets.size() / senders + 1));
        }
        for (int i = 0; i < targets.size(); i++) {
            partitions.get(i % senders).add(targets.get(i));
        }
        return partitions;
    }
}
