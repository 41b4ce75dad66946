package com.security.anomaly.engine.window;

import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Operations on time-ordered deques (oldest first). Callers hold the per-key
 * lock of the deque they pass in.
 */
public final class SlidingWindows {

    private SlidingWindows() {}

    /**
     * Drop entries strictly older than the cutoff. Idempotent.
     */
    public static <T extends Timestamped> void prune(Deque<T> entries, long cutoffMillis) {
        while (!entries.isEmpty() && entries.peekFirst().timestampMillis() < cutoffMillis) {
            entries.pollFirst();
        }
    }

    public static <T extends Timestamped> int countSince(Deque<T> entries, long cutoffMillis) {
        int count = 0;
        Iterator<T> it = entries.descendingIterator();
        while (it.hasNext()) {
            if (it.next().timestampMillis() < cutoffMillis) break;
            count++;
        }
        return count;
    }

    public static int sumSince(Deque<CounterBucket> buckets, long cutoffMillis) {
        int sum = 0;
        Iterator<CounterBucket> it = buckets.descendingIterator();
        while (it.hasNext()) {
            CounterBucket bucket = it.next();
            if (bucket.timestampMillis() < cutoffMillis) break;
            sum += bucket.count();
        }
        return sum;
    }

    /**
     * Count one request at {@code nowMillis}, merging into the newest bucket
     * when it is younger than {@code mergeMillis}.
     */
    public static void record(Deque<CounterBucket> buckets, long nowMillis, long mergeMillis) {
        CounterBucket last = buckets.peekLast();
        if (last != null && nowMillis - last.timestampMillis() < mergeMillis) {
            buckets.pollLast();
            buckets.addLast(last.increment());
        } else {
            buckets.addLast(new CounterBucket(nowMillis, 1));
        }
    }

    /**
     * Distinct counterparts among entries at or after the cutoff.
     */
    public static Set<String> distinctCounterparts(Deque<FailureEntry> entries, long cutoffMillis) {
        Set<String> distinct = new HashSet<>();
        Iterator<FailureEntry> it = entries.descendingIterator();
        while (it.hasNext()) {
            FailureEntry entry = it.next();
            if (entry.timestampMillis() < cutoffMillis) break;
            if (entry.counterpart() != null) {
                distinct.add(entry.counterpart());
            }
        }
        return distinct;
    }
}
