package edu.uw.easyqg.qg;

import com.google.common.collect.ImmutableSet;
import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.DependencyRole;
import edu.uw.easyqg.annotation.TokenStream;

import java.util.OptionalInt;

/**
 * Splits a token stream into candidate clauses. A clause closes at sentence-final punctuation or at a coordinating
 * conjunction, but never inside brackets. Each candidate goes to a handler; if the handler rejects it, the scan
 * moves one token on and offers the longer clause at the next boundary, which steps over stray full stops such as
 * the ones in abbreviations.
 */
public class ClauseSegmenter {
    private static final ImmutableSet<String> clauseClosers = ImmutableSet.of(".", "!", "?", ";", "--", "...");

    public interface ClauseHandler {
        /**
         * @param start: first token of the candidate clause.
         * @param end: one past its last token.
         * @return the index where the accepted clause really ends, or empty to reject it.
         */
        OptionalInt accept(int start, int end);
    }

    private final TokenStream stream;

    public ClauseSegmenter(TokenStream stream) {
        this.stream = stream;
    }

    static boolean isBoundary(AnnotatedToken token) {
        return clauseClosers.contains(token.getText()) || token.getDependency() == DependencyRole.CC;
    }

    /**
     * Runs the scan, offering every candidate clause to the handler in order, and a last one covering whatever is
     * left after the final boundary.
     * @return the number of candidate clauses offered.
     */
    public int segment(ClauseHandler handler) {
        final int size = stream.size();
        final BracketTracker brackets = new BracketTracker();
        int numCandidates = 0;
        int start = 0;
        int end = start + 1;
        while (end < size && start < end) {
            final AnnotatedToken token = stream.get(end);
            if (brackets.skip(token) || !isBoundary(token)) {
                end++;
                continue;
            }
            numCandidates++;
            final OptionalInt clauseEnd = handler.accept(start, end);
            if (!clauseEnd.isPresent()) {
                end++;
                continue;
            }
            // Resume at the end of the accepted clause, or at the boundary if that would not move the scan forward.
            start = clauseEnd.getAsInt() > start ? clauseEnd.getAsInt() : end;
            end = start + 1;
        }
        if (start < size) {
            numCandidates++;
            handler.accept(start, size);
        }
        return numCandidates;
    }
}
