package com.notropolis.economy.action;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent follow-up work (dirty marks, level checks) that failed after its
 * action was already committed. Retried by the next tick until it succeeds.
 */
public class FollowUpQueue {

    private static final Logger log = LoggerFactory.getLogger(FollowUpQueue.class);

    private final Queue<PendingFollowUp> pending = new ConcurrentLinkedQueue<>();

    /**
     * Runs the task now; on failure logs it and queues it for retry.
     *
     * @return true if the task ran successfully
     */
    public boolean runOrQueue(String description, Runnable task) {
        try {
            task.run();
            return true;
        } catch (RuntimeException e) {
            log.warn("Follow-up '{}' failed, queued for retry: {}", description, e.getMessage());
            pending.add(new PendingFollowUp(description, task));
            return false;
        }
    }

    /**
     * Retries every queued follow-up once. Those that fail again stay queued.
     *
     * @return number of follow-ups that succeeded
     */
    public int drain() {
        List<PendingFollowUp> batch = new ArrayList<>();
        PendingFollowUp next;
        while ((next = pending.poll()) != null) {
            batch.add(next);
        }
        int done = 0;
        for (PendingFollowUp followUp : batch) {
            try {
                followUp.task.run();
                done++;
            } catch (RuntimeException e) {
                log.warn("Follow-up '{}' failed again: {}", followUp.description, e.getMessage());
                pending.add(followUp);
            }
        }
        if (!batch.isEmpty()) {
            log.info("Drained follow-ups: {} succeeded, {} still pending", done, pending.size());
        }
        return done;
    }

    public int size() {
        return pending.size();
    }

    private static final class PendingFollowUp {
        private final String description;
        private final Runnable task;

        private PendingFollowUp(String description, Runnable task) {
            this.description = description;
            this.task = task;
        }
    }
}
