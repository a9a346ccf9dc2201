package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.DependencyRole;

import java.util.Optional;

/**
 * Picks the WH-word heading a question from the object's entity type and the voice of the subject.
 */
public class WhSelector {
    private final WhWord missingObjectWh;

    /**
     * @param missingObjectWh: WH-word for clauses without an object.
     */
    public WhSelector(WhWord missingObjectWh) {
        this.missingObjectWh = missingObjectWh;
    }

    public WhWord select(AnnotatedToken subjectRoot, Optional<AnnotatedToken> object) {
        if (!object.isPresent()) {
            return missingObjectWh;
        }
        if (subjectRoot.getDependency() == DependencyRole.NSUBJPASS && !Pronoun.isRelative(subjectRoot.getText())) {
            return WhWord.HOW;
        }
        switch (object.get().getEntity()) {
            case PERSON:
                return WhWord.WHO;
            case GPE:
                return WhWord.WHERE;
            case DATE:
                return WhWord.WHEN;
            default:
                return WhWord.WHAT;
        }
    }
}
