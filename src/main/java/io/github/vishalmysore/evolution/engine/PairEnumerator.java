package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.domain.Event;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Candidate pair generation over events sorted by (date, id).
 *
 * For each anchor the forward scan stops at the first event more than
 * {@code maxWindowDays} later, so work is bounded by the number of in-window
 * pairs rather than n². Pairs outside the window are never produced. Equal
 * dates are ordered by id, which fixes the direction of same-day pairs.
 */
public class PairEnumerator {

    public static final Comparator<Event> EVENT_ORDER = Comparator
            .comparing(Event::getDate)
            .thenComparing(Event::getId);

    private final List<Event> sorted;
    private final int maxWindowDays;

    // reach[i] = last index j >= i whose date is within the window of event i
    private final int[] reach;

    public PairEnumerator(Collection<Event> events, int maxWindowDays) {
        List<Event> copy = new ArrayList<>(events);
        copy.sort(EVENT_ORDER);
        this.sorted = Collections.unmodifiableList(copy);
        this.maxWindowDays = maxWindowDays;
        this.reach = computeReach();
    }

    private int[] computeReach() {
        int n = sorted.size();
        int[] result = new int[n];
        int j = 0;
        for (int i = 0; i < n; i++) {
            if (j < i)
                j = i;
            while (j + 1 < n && gap(i, j + 1) <= maxWindowDays)
                j++;
            result[i] = j;
        }
        return result;
    }

    private long gap(int i, int j) {
        return ChronoUnit.DAYS.between(sorted.get(i).getDate(), sorted.get(j).getDate());
    }

    public List<Event> getSortedEvents() {
        return sorted;
    }

    /**
     * Exact number of in-window pairs, computed without enumerating them.
     */
    public long countCandidatePairs() {
        long total = 0;
        for (int i = 0; i < reach.length; i++)
            total += reach[i] - i;
        return total;
    }

    /**
     * Events that take part in at least one candidate pair, in date order.
     */
    public List<Event> participatingEvents() {
        int n = sorted.size();
        boolean[] participates = new boolean[n];
        int coveredUpTo = -1;
        for (int i = 0; i < n; i++) {
            if (reach[i] > i) {
                participates[i] = true;
                for (int k = Math.max(i + 1, coveredUpTo + 1); k <= reach[i]; k++)
                    participates[k] = true;
                coveredUpTo = Math.max(coveredUpTo, reach[i]);
            }
        }
        List<Event> result = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (participates[i])
                result.add(sorted.get(i));
        }
        return result;
    }

    /**
     * Splits anchors into contiguous chunks of roughly {@code targetPairs}
     * pairs each. Anchors without partners are folded into neighbouring chunks.
     */
    public List<PairChunk> plan(int targetPairs) {
        List<PairChunk> chunks = new ArrayList<>();
        int start = 0;
        long pairs = 0;
        for (int i = 0; i < reach.length; i++) {
            pairs += reach[i] - i;
            if (pairs >= targetPairs) {
                chunks.add(new PairChunk(chunks.size(), start, i + 1, pairs));
                start = i + 1;
                pairs = 0;
            }
        }
        if (pairs > 0)
            chunks.add(new PairChunk(chunks.size(), start, reach.length, pairs));
        return chunks;
    }

    /**
     * Visits every in-window pair of the chunk's anchors as (earlier, later).
     */
    public void forEachPair(PairChunk chunk, BiConsumer<Event, Event> consumer) {
        for (int i = chunk.getAnchorStart(); i < chunk.getAnchorEnd(); i++) {
            Event anchor = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                if (gap(i, j) > maxWindowDays)
                    break;
                consumer.accept(anchor, sorted.get(j));
            }
        }
    }

    /**
     * Visits every candidate pair.
     */
    public void forEachPair(BiConsumer<Event, Event> consumer) {
        forEachPair(new PairChunk(0, 0, sorted.size(), countCandidatePairs()), consumer);
    }
}
