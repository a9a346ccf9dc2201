package edu.uw.easyqg.annotation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * An annotated passage: the tokens of all its sentences, the dependency tree over them and the noun chunks derived
 * from that tree. Immutable once built.
 */
public final class TokenStream implements Iterable<AnnotatedToken> {
    private final ImmutableList<AnnotatedToken> tokens;
    private final ImmutableList<ImmutableList<Integer>> children;
    private final int[] leftEdges;
    private final int[] rightEdges;
    private final int[] depths;
    private final ImmutableList<Span> nounChunks;

    private TokenStream(ImmutableList<AnnotatedToken> tokens) {
        this.tokens = tokens;
        final int size = tokens.size();
        final List<List<Integer>> childLists = new ArrayList<>();
        IntStream.range(0, size).forEach(i -> childLists.add(new ArrayList<>()));
        for (AnnotatedToken token : tokens) {
            if (!token.isRoot()) {
                childLists.get(token.getHeadIndex()).add(token.getIndex());
            }
        }
        this.children = childLists.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList());

        leftEdges = new int[size];
        rightEdges = new int[size];
        depths = new int[size];
        for (int i = 0; i < size; i++) {
            leftEdges[i] = i;
            rightEdges[i] = i;
        }
        // Walk up from every token, widening the edges of each ancestor. A malformed tree may contain a cycle, so
        // no walk takes more steps than there are tokens.
        for (int i = 0; i < size; i++) {
            int current = i;
            int depth = 0;
            while (!tokens.get(current).isRoot() && depth < size) {
                current = tokens.get(current).getHeadIndex();
                leftEdges[current] = Math.min(leftEdges[current], i);
                rightEdges[current] = Math.max(rightEdges[current], i);
                depth++;
            }
            depths[i] = depth;
        }
        this.nounChunks = NounChunker.chunk(this);
    }

    public int size() {
        return tokens.size();
    }

    public AnnotatedToken get(int index) {
        return tokens.get(index);
    }

    public ImmutableList<AnnotatedToken> getTokens() {
        return tokens;
    }

    @Override
    public Iterator<AnnotatedToken> iterator() {
        return tokens.iterator();
    }

    public AnnotatedToken getHead(AnnotatedToken token) {
        return tokens.get(token.getHeadIndex());
    }

    public ImmutableList<AnnotatedToken> getChildren(AnnotatedToken token) {
        return children.get(token.getIndex()).stream().map(tokens::get).collect(ImmutableList.toImmutableList());
    }

    /**
     * Index of the leftmost token in the subtree rooted at the given token.
     */
    public int getLeftEdge(AnnotatedToken token) {
        return leftEdges[token.getIndex()];
    }

    /**
     * Index of the rightmost token in the subtree rooted at the given token.
     */
    public int getRightEdge(AnnotatedToken token) {
        return rightEdges[token.getIndex()];
    }

    /**
     * Number of arcs between the token and the root of its sentence.
     */
    public int getDepth(AnnotatedToken token) {
        return depths[token.getIndex()];
    }

    public Span getSubtree(AnnotatedToken token) {
        return new Span(this, getLeftEdge(token), getRightEdge(token) + 1);
    }

    public Span span(int start, int end) {
        return new Span(this, start, end);
    }

    public ImmutableList<Span> getNounChunks() {
        return nounChunks;
    }

    public String tagDescription(AnnotatedToken token) {
        return token.getTag().getDescription();
    }

    @Override
    public String toString() {
        return tokens.stream().map(AnnotatedToken::getText).collect(Collectors.joining(" "));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<TokenSpec> specs = new ArrayList<>();

        public int size() {
            return specs.size();
        }

        public Builder add(String text, String tag, String label, int headIndex, String lemma) {
            return add(text, tag, label, headIndex, lemma, "");
        }

        public Builder add(String text, String tag, String label, int headIndex, String lemma, String entity) {
            specs.add(new TokenSpec(text, tag, label, headIndex, lemma, entity));
            return this;
        }

        public TokenStream build() {
            final int size = specs.size();
            final ImmutableList.Builder<AnnotatedToken> tokens = ImmutableList.builder();
            for (int i = 0; i < size; i++) {
                final TokenSpec spec = specs.get(i);
                Preconditions.checkArgument(spec.headIndex >= 0 && spec.headIndex < size,
                        "head %s of token %s (%s) is outside the stream", spec.headIndex, i, spec.text);
                final PartOfSpeech pos = PartOfSpeech.of(PennTag.fromString(spec.tag),
                        DependencyRole.fromLabel(spec.label), spec.lemma);
                tokens.add(new AnnotatedToken(spec.text, i, pos, spec.tag, spec.label, spec.lemma,
                        EntityType.fromLabel(spec.entity), spec.headIndex));
            }
            return new TokenStream(tokens.build());
        }
    }

    private static final class TokenSpec {
        final String text;
        final String tag;
        final String label;
        final int headIndex;
        final String lemma;
        final String entity;

        TokenSpec(String text, String tag, String label, int headIndex, String lemma, String entity) {
            this.text = text;
            this.tag = tag;
            this.label = label;
            this.headIndex = headIndex;
            this.lemma = lemma;
            this.entity = entity;
        }
    }
}
