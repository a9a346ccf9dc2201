package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.TokenStream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Predicate;

public class TreeWalker {
    /**
     * Depth-first, pre-order search of the dependency subtree rooted at the given token, children left to right.
     * Returns the first token that matches, or empty if there is none or no start token was given.
     * Visits at most as many nodes as the stream has tokens, so a malformed tree cannot make it loop.
     */
    public static Optional<AnnotatedToken> findFirst(TokenStream stream, Optional<AnnotatedToken> start,
                                                     Predicate<AnnotatedToken> matches) {
        if (!start.isPresent()) {
            return Optional.empty();
        }
        final Deque<AnnotatedToken> stack = new ArrayDeque<>();
        stack.push(start.get());
        int visited = 0;
        while (!stack.isEmpty() && visited < stream.size()) {
            final AnnotatedToken token = stack.pop();
            visited++;
            if (matches.test(token)) {
                return Optional.of(token);
            }
            stream.getChildren(token).reverse().forEach(stack::push);
        }
        return Optional.empty();
    }

    /**
     * The first prepositional or direct object below the given token, the token itself included.
     */
    public static Optional<AnnotatedToken> findObject(TokenStream stream, Optional<AnnotatedToken> start) {
        return findFirst(stream, start, token -> token.getDependency().isObject());
    }
}
