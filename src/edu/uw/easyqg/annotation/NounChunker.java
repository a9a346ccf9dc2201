package edu.uw.easyqg.annotation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.EnumSet;
import java.util.Set;

/**
 * Derives base noun phrases from the dependency tree. A noun, proper noun or pronoun heading a nominal argument
 * (or a conjunct of one) yields the span from its left edge up to itself; chunks never overlap.
 */
final class NounChunker {
    private static final Set<DependencyRole> nounPhraseRoles = Sets.immutableEnumSet(EnumSet.of(
            DependencyRole.NSUBJ, DependencyRole.NSUBJPASS, DependencyRole.DOBJ, DependencyRole.POBJ,
            DependencyRole.DATIVE, DependencyRole.ATTR, DependencyRole.APPOS, DependencyRole.PCOMP,
            DependencyRole.ROOT));

    private NounChunker() {
    }

    static ImmutableList<Span> chunk(TokenStream stream) {
        final ImmutableList.Builder<Span> chunks = ImmutableList.builder();
        int previousEnd = -1;
        for (AnnotatedToken token : stream) {
            final PartOfSpeech pos = token.getPos();
            if (pos != PartOfSpeech.NOUN && pos != PartOfSpeech.PROPN && pos != PartOfSpeech.PRON) {
                continue;
            }
            final int leftEdge = stream.getLeftEdge(token);
            if (leftEdge <= previousEnd) {
                continue;
            }
            if (nounPhraseRoles.contains(token.getDependency()) || isConjunctOfNounPhrase(stream, token)) {
                previousEnd = token.getIndex();
                chunks.add(stream.span(leftEdge, token.getIndex() + 1));
            }
        }
        return chunks.build();
    }

    private static boolean isConjunctOfNounPhrase(TokenStream stream, AnnotatedToken token) {
        if (token.getDependency() != DependencyRole.CONJ) {
            return false;
        }
        AnnotatedToken head = stream.getHead(token);
        while (head.getDependency() == DependencyRole.CONJ && head.getHeadIndex() < head.getIndex()) {
            head = stream.getHead(head);
        }
        return nounPhraseRoles.contains(head.getDependency());
    }
}
