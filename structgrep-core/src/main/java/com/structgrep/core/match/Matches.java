package com.structgrep.core.match;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Finite, restartable, lazy sequence of matches.
 *
 * <p>Every call to {@link #stream()} or {@link #iterator()} reruns the search from the start.
 * Nothing runs in the background: a caller that stops pulling has cancelled the search.
 */
public final class Matches implements Iterable<Match> {

    private static final Matches EMPTY = new Matches(Stream::empty);

    private final Supplier<Stream<Match>> source;

    private Matches(Supplier<Stream<Match>> source) {
        this.source = source;
    }

    public static Matches of(Supplier<Stream<Match>> source) {
        return new Matches(Objects.requireNonNull(source, "source must not be null"));
    }

    public static Matches empty() {
        return EMPTY;
    }

    public Stream<Match> stream() {
        return source.get();
    }

    @Override
    public Iterator<Match> iterator() {
        return stream().iterator();
    }

    public Optional<Match> first() {
        return stream().findFirst();
    }

    /**
     * Returns true if at least one match exists; stops at the first one.
     */
    public boolean exists() {
        return first().isPresent();
    }

    /**
     * Drains the sequence, dropping duplicate (span, environment) pairs.
     */
    public List<Match> toList() {
        return stream().distinct().toList();
    }
}
