package edu.uw.easyqg.annotation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.Iterator;
import java.util.stream.Collectors;

/**
 * A contiguous run of tokens [start, end) of a token stream.
 */
public final class Span implements Iterable<AnnotatedToken> {
    private final TokenStream stream;
    private final int start;
    private final int end;

    Span(TokenStream stream, int start, int end) {
        Preconditions.checkArgument(0 <= start && start <= end && end <= stream.size(),
                "bad span [%s, %s) over %s tokens", start, end, stream.size());
        this.stream = stream;
        this.start = start;
        this.end = end;
    }

    public TokenStream getStream() {
        return stream;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public ImmutableList<AnnotatedToken> getTokens() {
        return stream.getTokens().subList(start, end);
    }

    @Override
    public Iterator<AnnotatedToken> iterator() {
        return getTokens().iterator();
    }

    public boolean contains(AnnotatedToken token) {
        return token.getIndex() >= start && token.getIndex() < end;
    }

    /**
     * The syntactic head of the span: the token closest to the root of its sentence, the leftmost one on ties.
     */
    public AnnotatedToken getRoot() {
        Preconditions.checkState(!isEmpty(), "empty span has no root");
        return getTokens().stream()
                .min(Comparator.comparingInt(stream::getDepth).thenComparingInt(AnnotatedToken::getIndex))
                .get();
    }

    /**
     * Noun chunks of the stream that lie entirely inside this span.
     */
    public ImmutableList<Span> getNounChunks() {
        return stream.getNounChunks().stream()
                .filter(chunk -> chunk.start >= start && chunk.end <= end)
                .collect(ImmutableList.toImmutableList());
    }

    public String getText() {
        return getTokens().stream().map(AnnotatedToken::getText).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return String.format("[%d, %d) %s", start, end, getText());
    }
}
