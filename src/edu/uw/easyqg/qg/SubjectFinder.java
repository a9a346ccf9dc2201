package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.PennTag;
import edu.uw.easyqg.annotation.Span;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the nominal or clausal subject of a clause. Words in parentheses, brackets and braces are never subjects.
 */
final class SubjectFinder {

    private SubjectFinder() {
    }

    /**
     * The root of the first noun chunk of the clause that acts as a subject.
     */
    static Optional<AnnotatedToken> findInNounChunks(Span clause) {
        final Set<Integer> bracketed = getBracketedIndices(clause);
        return clause.getNounChunks().stream()
                .map(Span::getRoot)
                .filter(root -> root.getDependency().isSubject())
                .filter(root -> !bracketed.contains(root.getIndex()))
                .findFirst();
    }

    /**
     * Scans the tokens of the clause for the first subject that is not a wh-determiner.
     */
    static Optional<AnnotatedToken> findInTokens(Span clause) {
        final BracketTracker brackets = new BracketTracker();
        for (AnnotatedToken token : clause) {
            if (brackets.skip(token)) {
                continue;
            }
            if (token.getDependency().isSubject() && token.getTag() != PennTag.WDT) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    private static Set<Integer> getBracketedIndices(Span clause) {
        final BracketTracker brackets = new BracketTracker();
        final Set<Integer> bracketed = new HashSet<>();
        for (AnnotatedToken token : clause) {
            if (brackets.skip(token)) {
                bracketed.add(token.getIndex());
            }
        }
        return bracketed;
    }
}
