package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.Span;

import java.util.Optional;

/**
 * What the syntax mapper extracted from one clause. Any slot may be missing; only complete maps become questions.
 */
public final class SyntaxMap {
    public final Optional<WhWord> wh;
    public final Optional<Span> subject;
    public final Optional<AnnotatedToken> object;
    public final Optional<String> verb;
    public final Optional<String> aux;
    // index of the rightmost dependent of the verb, where scanning for the next clause resumes.
    public final int end;

    SyntaxMap(Optional<WhWord> wh, Optional<Span> subject, Optional<AnnotatedToken> object, Optional<String> verb,
              Optional<String> aux, int end) {
        this.wh = wh;
        this.subject = subject;
        this.object = object;
        this.verb = verb;
        this.aux = aux;
        this.end = end;
    }

    public boolean isComplete() {
        return wh.isPresent() && subject.isPresent() && verb.isPresent() && aux.isPresent();
    }

    @Override
    public String toString() {
        return String.format("wh=%s subject=%s verb=%s aux=%s object=%s end=%d",
                wh.orElse(null),
                subject.map(Span::getText).orElse(null),
                verb.orElse(null),
                aux.orElse(null),
                object.map(AnnotatedToken::getText).orElse(null),
                end);
    }
}
