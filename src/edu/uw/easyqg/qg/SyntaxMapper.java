package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.Span;
import edu.uw.easyqg.annotation.TokenStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Maps a clause to its subject, verb, auxiliary, object and WH-word, and works out where the clause really ends:
 * the verb phrase may reach past the punctuation that closed it.
 */
public class SyntaxMapper {
    private static final Logger log = LoggerFactory.getLogger(SyntaxMapper.class);

    private final TokenStream stream;
    private final WhSelector whSelector;

    public SyntaxMapper(TokenStream stream, WhSelector whSelector) {
        this.stream = stream;
        this.whSelector = whSelector;
    }

    /**
     * @param start: first token of the clause.
     * @param end: one past the last token of the clause.
     * @return the syntax of the clause, or empty when it has no subject.
     */
    public Optional<SyntaxMap> map(int start, int end) {
        final Span clause = stream.span(start, end);
        if (clause.isEmpty()) {
            return Optional.empty();
        }
        AnnotatedToken verb = clause.getRoot();
        int clauseEnd = stream.getRightEdge(verb);

        final Span subject;
        final Optional<AnnotatedToken> chunkSubject = SubjectFinder.findInNounChunks(clause);
        if (chunkSubject.isPresent()) {
            subject = stream.getSubtree(chunkSubject.get());
            // The real predicate may sit outside the clause root, e.g. when the clause opens with a subordinate one.
            verb = stream.getHead(chunkSubject.get());
            clauseEnd = stream.getRightEdge(verb);
        } else {
            final Optional<AnnotatedToken> tokenSubject = SubjectFinder.findInTokens(clause);
            if (!tokenSubject.isPresent()) {
                log.debug("No subject in clause {}", clause);
                return Optional.empty();
            }
            subject = stream.getSubtree(tokenSubject.get());
        }

        Optional<AnnotatedToken> object = Optional.empty();
        for (AnnotatedToken child : stream.getChildren(verb)) {
            object = TreeWalker.findObject(stream, Optional.of(child));
            if (object.isPresent()) {
                break;
            }
        }

        final WhWord wh = whSelector.select(subject.getRoot(), object);
        final Tense tense = TenseClassifier.classify(verb);
        final Optional<String> aux = VerbHelper.resolveAuxiliary(clause, verb, tense);
        final String verbText = VerbHelper.getVerbForm(verb, tense, aux.orElse(null));

        final SyntaxMap syntaxMap = new SyntaxMap(Optional.of(wh), Optional.of(subject), object,
                Optional.of(verbText), aux, clauseEnd);
        log.debug("Clause {} -> {}", clause, syntaxMap);
        return Optional.of(syntaxMap);
    }
}
