package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;

import java.util.Objects;
import java.util.Optional;

/**
 * A generated question, kept as its slots. The text is rendered by {@link QuestionComposer#compose}.
 */
public final class Question {
    private final WhWord wh;
    private final String aux;
    private final String subject;
    private final String verb;
    private final Optional<AnnotatedToken> object;

    /**
     * @param subject: the subject as it appears in the question, already normalized.
     */
    public Question(WhWord wh, String aux, String subject, String verb, Optional<AnnotatedToken> object) {
        this.wh = wh;
        this.aux = aux;
        this.subject = subject;
        this.verb = verb;
        this.object = object;
    }

    public WhWord getWh() {
        return wh;
    }

    public String getAux() {
        return aux;
    }

    public String getSubject() {
        return subject;
    }

    public String getVerb() {
        return verb;
    }

    public Optional<AnnotatedToken> getObject() {
        return object;
    }

    public String getText() {
        return QuestionComposer.compose(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Question)) {
            return false;
        }
        final Question that = (Question) other;
        return wh == that.wh && aux.equals(that.aux) && subject.equals(that.subject) && verb.equals(that.verb)
                && object.map(AnnotatedToken::getIndex).equals(that.object.map(AnnotatedToken::getIndex));
    }

    @Override
    public int hashCode() {
        return Objects.hash(wh, aux, subject, verb, object.map(AnnotatedToken::getIndex));
    }

    @Override
    public String toString() {
        return getText();
    }
}
