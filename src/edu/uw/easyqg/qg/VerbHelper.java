package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.DependencyRole;
import edu.uw.easyqg.annotation.PartOfSpeech;
import edu.uw.easyqg.annotation.PennTag;
import edu.uw.easyqg.annotation.Span;
import edu.uw.easyqg.annotation.TokenStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Picks the auxiliary verb a question is built around, and the form of the main verb that goes with it.
 */
public final class VerbHelper {
    private static final Logger log = LoggerFactory.getLogger(VerbHelper.class);

    private VerbHelper() {
    }

    /**
     * Uses the auxiliary right before the verb, else any auxiliary in the clause, else do-support by tense.
     * Returns empty when none of these apply.
     */
    public static Optional<String> resolveAuxiliary(Span clause, AnnotatedToken verb, Tense tense) {
        final TokenStream stream = clause.getStream();
        if (verb.getIndex() > 0) {
            final AnnotatedToken previous = stream.get(verb.getIndex() - 1);
            if (previous.getPos() == PartOfSpeech.AUX) {
                return Optional.of(fineTune(previous, tense));
            }
        }
        for (AnnotatedToken token : clause) {
            if (token.getPos() == PartOfSpeech.AUX || token.getDependency() == DependencyRole.AUX) {
                return Optional.of(fineTune(token.getIndex() == verb.getIndex() ? verb : token, tense));
            }
        }
        switch (tense) {
            case PAST_TENSE:
                return Optional.of("did");
            case PRESENT:
                return Optional.of(verb.getTag() == PennTag.VBP ? "do" : "does");
            default:
                log.debug("Could not determine auxiliary verb for '{}' ({})", verb.getText(), tense);
                return Optional.empty();
        }
    }

    /**
     * Adjusts an auxiliary found in the sentence to the form a question needs:
     * infinitival "to" takes the tense of the verb, bare "be" becomes "is".
     */
    static String fineTune(AnnotatedToken aux, Tense tense) {
        switch (aux.getText()) {
            case "to":
                if (tense == Tense.PRESENT) {
                    return "does";
                } else if (tense.isPast()) {
                    return "did";
                }
                return "will";
            case "be":
                return "is";
            default:
                return aux.getText();
        }
    }

    /**
     * chased + did -> chase. The auxiliary already carries simple past and present tense, so the verb goes back to
     * its base form; any other form is kept as written.
     */
    public static String getVerbForm(AnnotatedToken verb, Tense tense, String aux) {
        if ((tense == Tense.PAST_TENSE || tense == Tense.PRESENT) && !verb.getText().equals(aux)) {
            return verb.getLemma();
        }
        return verb.getText();
    }
}
