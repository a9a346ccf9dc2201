package edu.uw.easyqg.qg;

import com.google.common.collect.ImmutableSet;
import edu.uw.easyqg.annotation.AnnotatedToken;

/**
 * Tracks whether a left-to-right scan is inside a parenthesized, bracketed or braced aside.
 * The opening bracket counts as inside, the closing one as outside.
 */
final class BracketTracker {
    private static final ImmutableSet<String> openBrackets = ImmutableSet.of("(", "[", "{", "-LRB-", "-LSB-", "-LCB-");
    private static final ImmutableSet<String> closeBrackets = ImmutableSet.of(")", "]", "}", "-RRB-", "-RSB-", "-RCB-");

    private boolean inBracket = false;

    /**
     * Feeds the next token of the scan and returns whether it lies inside brackets.
     */
    boolean skip(AnnotatedToken token) {
        if (openBrackets.contains(token.getText())) {
            inBracket = true;
        }
        if (closeBrackets.contains(token.getText()) && inBracket) {
            inBracket = false;
        }
        return inBracket;
    }
}
