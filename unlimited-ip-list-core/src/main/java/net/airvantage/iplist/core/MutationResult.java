/*
 * MIT License
 * Copyright (c) 2025 Semtech
 */
package net.airvantage.iplist.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one mutating call on {@link UnlimitedIpList}.
 *
 * <p>{@code added} holds the canonical text of the inputs that entered the
 * list, {@code removed} the stored prefixes that left it (explicitly removed or
 * displaced by a broader network), {@code discarded} the rejected inputs:
 * invalid ones in encounter order, then redundant ones in discovery order.
 */
public final class MutationResult {
    static final MutationResult EMPTY = new MutationResult(List.of(), List.of(), List.of());

    private final List<String> added;
    private final List<String> removed;
    private final List<DiscardedEntry> discarded;

    public MutationResult(List<String> added, List<String> removed, List<DiscardedEntry> discarded) {
        this.added = List.copyOf(added);
        this.removed = List.copyOf(removed);
        this.discarded = List.copyOf(discarded);
    }

    public List<String> getAdded() { return added; }
    public List<String> getRemoved() { return removed; }
    public List<DiscardedEntry> getDiscarded() { return discarded; }

    public List<String> getDiscardedInputs() {
        return discarded.stream().map(DiscardedEntry::getInput).collect(Collectors.toList());
    }

    public boolean isChanged() {
        return !added.isEmpty() || !removed.isEmpty();
    }

    @Override
    public String toString() {
        return "MutationResult{added=" + added + ", removed=" + removed + ", discarded=" + discarded + '}';
    }
}
