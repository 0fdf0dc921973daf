package com.agentsessions.payloads.scanner.api;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded collector for the spans of one scan.
 *
 * <p>Extractors stop feeding as soon as {@link #isFull()} turns true, either because the
 * match cap was reached or because a presence scan has its answer. An optional filter
 * runs on every offered span before it counts toward the cap; rejected spans are dropped
 * and the scan goes on.
 *
 * <p>The cap is applied in emission order. Dialects that emit on object close report a
 * nested block before the block enclosing it, so a capped scan keeps the first spans to
 * complete, which are not always the first spans to start.
 */
public final class SpanSink {

    private final int maxMatches;
    private final Predicate<LocatedSpan> filter;
    private final List<LocatedSpan> spans = new ArrayList<>();
    private boolean halted;

    public SpanSink(int maxMatches) {
        this(maxMatches, span -> true);
    }

    public SpanSink(int maxMatches, Predicate<LocatedSpan> filter) {
        this.maxMatches = Math.max(0, maxMatches);
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    /**
     * Adds a span unless the sink is already full or the filter rejects it.
     *
     * @return true if more spans are still wanted
     */
    public boolean accept(LocatedSpan span) {
        if (isFull()) {
            return false;
        }
        if (filter.test(span)) {
            spans.add(span);
        }
        return !isFull();
    }

    /**
     * Stops the scan regardless of the match cap.
     */
    public void halt() {
        halted = true;
    }

    public boolean isFull() {
        return halted || spans.size() >= maxMatches;
    }

    public int size() {
        return spans.size();
    }

    public int remaining() {
        return Math.max(0, maxMatches - spans.size());
    }

    /**
     * Collected spans in ascending start offset; emission order breaks ties.
     */
    public List<LocatedSpan> spans() {
        List<LocatedSpan> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingLong(s -> s.span().startOffset()));
        return List.copyOf(sorted);
    }
}
