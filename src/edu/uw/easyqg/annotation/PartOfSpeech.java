package edu.uw.easyqg.annotation;

/**
 * Coarse (universal) part-of-speech, derived from the fine-grained tag and the dependency role.
 */
public enum PartOfSpeech {
    NOUN, PROPN, PRON, VERB, AUX, ADJ, ADV, ADP, DET, CCONJ, PART, NUM, INTJ, PUNCT, SYM, X;

    public static PartOfSpeech of(PennTag tag, DependencyRole role, String lemma) {
        if (tag == PennTag.TO) {
            return PART;
        }
        if (tag == PennTag.MD || role == DependencyRole.AUX || role == DependencyRole.AUXPASS
                || role == DependencyRole.COP) {
            return AUX;
        }
        if (tag.isVerb()) {
            return "be".equalsIgnoreCase(lemma) ? AUX : VERB;
        }
        if (tag.isPunctuation()) {
            return PUNCT;
        }
        switch (tag) {
            case NN:
            case NNS:
                return NOUN;
            case NNP:
            case NNPS:
                return PROPN;
            case PRP:
            case PRP$:
            case WP:
            case WP$:
            case WDT:
            case EX:
                return PRON;
            case JJ:
            case JJR:
            case JJS:
                return ADJ;
            case RB:
            case RBR:
            case RBS:
            case WRB:
                return ADV;
            case IN:
                return ADP;
            case DT:
            case PDT:
                return DET;
            case CC:
                return CCONJ;
            case RP:
            case POS:
                return PART;
            case CD:
                return NUM;
            case UH:
                return INTJ;
            case SYM:
            case DOLLAR:
            case HASH:
                return SYM;
            default:
                return X;
        }
    }
}
