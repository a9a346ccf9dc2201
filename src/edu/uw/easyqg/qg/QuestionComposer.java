package edu.uw.easyqg.qg;

import com.google.common.base.Joiner;
import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.EntityType;
import edu.uw.easyqg.annotation.PartOfSpeech;
import edu.uw.easyqg.annotation.Span;
import edu.uw.easyqg.annotation.TokenStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders questions. The question mark is joined like any other token: "What did the cat chase ?".
 */
public final class QuestionComposer {
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private QuestionComposer() {
    }

    public static String compose(Question question) {
        final String wh = question.getWh().getWord();
        final String subject = question.getSubject();
        final String verb = question.getVerb();
        String aux = question.getAux();
        if (verb.equals(aux)) {
            if (aux.equals("has")) {
                return spaceJoiner.join(wh, "does", subject, "have", "?");
            }
            if (aux.equals("to")) {
                aux = "will";
            }
            return spaceJoiner.join(wh, aux.toLowerCase(), subject, "?");
        }
        if (aux.equals("has")) {
            return spaceJoiner.join(wh, "did", subject, verb, "?");
        }
        if (aux.equals("to")) {
            aux = "will";
        }
        return spaceJoiner.join(wh, aux.toLowerCase(), subject, verb, "?");
    }

    /**
     * Writes a subject span the way it reads after the auxiliary: proper nouns, and the words of a named entity that
     * contains one, keep their case, "I" stays capitalized, everything else is lowercased. A bare relative "which"
     * becomes "it".
     */
    public static String normalizeSubject(Span subject) {
        final TokenStream stream = subject.getStream();
        final List<String> words = new ArrayList<>();
        for (AnnotatedToken token : subject) {
            final boolean keepCase = token.getPos() == PartOfSpeech.PROPN
                    || isFirstPersonSingular(token.getText())
                    || isInProperEntity(stream, token);
            words.add(keepCase ? token.getText() : token.getText().toLowerCase());
        }
        final String text = spaceJoiner.join(words);
        return text.equals("which") ? Pronoun.IT.toString() : text;
    }

    private static boolean isFirstPersonSingular(String word) {
        return Pronoun.fromString(word)
                .filter(pronoun -> pronoun.person == Pronoun.Person.FIRST)
                .filter(pronoun -> pronoun.number.map(number -> number == Pronoun.Number.SINGULAR).orElse(false))
                .isPresent();
    }

    /**
     * Whether the token belongs to a run of same-type entity tokens with a proper noun among them.
     */
    private static boolean isInProperEntity(TokenStream stream, AnnotatedToken token) {
        final EntityType entity = token.getEntity();
        if (entity == EntityType.NONE) {
            return false;
        }
        int first = token.getIndex();
        while (first > 0 && stream.get(first - 1).getEntity() == entity) {
            first--;
        }
        int last = token.getIndex();
        while (last + 1 < stream.size() && stream.get(last + 1).getEntity() == entity) {
            last++;
        }
        for (int i = first; i <= last; i++) {
            if (stream.get(i).getPos() == PartOfSpeech.PROPN) {
                return true;
            }
        }
        return false;
    }
}
