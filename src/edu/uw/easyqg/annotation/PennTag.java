package edu.uw.easyqg.annotation;

import java.util.HashMap;
import java.util.Map;

/**
 * Penn Treebank part-of-speech tags, with the human-readable description of each.
 * Tags the annotator produces that are not listed here map to UNKNOWN.
 */
public enum PennTag {
    CC("CC", "conjunction, coordinating"),
    CD("CD", "cardinal number"),
    DT("DT", "determiner"),
    EX("EX", "existential there"),
    FW("FW", "foreign word"),
    IN("IN", "conjunction, subordinating or preposition"),
    JJ("JJ", "adjective"),
    JJR("JJR", "adjective, comparative"),
    JJS("JJS", "adjective, superlative"),
    LS("LS", "list item marker"),
    MD("MD", "verb, modal auxiliary"),
    NN("NN", "noun, singular or mass"),
    NNS("NNS", "noun, plural"),
    NNP("NNP", "noun, proper singular"),
    NNPS("NNPS", "noun, proper plural"),
    PDT("PDT", "predeterminer"),
    POS("POS", "possessive ending"),
    PRP("PRP", "pronoun, personal"),
    PRP$("PRP$", "pronoun, possessive"),
    RB("RB", "adverb"),
    RBR("RBR", "adverb, comparative"),
    RBS("RBS", "adverb, superlative"),
    RP("RP", "adverb, particle"),
    SYM("SYM", "symbol"),
    TO("TO", "infinitival \"to\""),
    UH("UH", "interjection"),
    VB("VB", "verb, base form"),
    VBD("VBD", "verb, past tense"),
    VBG("VBG", "verb, gerund or present participle"),
    VBN("VBN", "verb, past participle"),
    VBP("VBP", "verb, non-3rd person singular present"),
    VBZ("VBZ", "verb, 3rd person singular present"),
    WDT("WDT", "wh-determiner"),
    WP("WP", "wh-pronoun, personal"),
    WP$("WP$", "wh-pronoun, possessive"),
    WRB("WRB", "wh-adverb"),
    PERIOD(".", "punctuation mark, sentence closer"),
    COMMA(",", "punctuation mark, comma"),
    COLON(":", "punctuation mark, colon or ellipsis"),
    OPEN_QUOTE("``", "opening quotation mark"),
    CLOSE_QUOTE("''", "closing quotation mark"),
    LRB("-LRB-", "left round bracket"),
    RRB("-RRB-", "right round bracket"),
    HYPH("HYPH", "punctuation mark, hyphen"),
    NFP("NFP", "superfluous punctuation"),
    DOLLAR("$", "symbol, currency"),
    HASH("#", "symbol, number sign"),
    ADD("ADD", "email"),
    UNKNOWN("", "unknown");

    private static final Map<String, PennTag> tagsByString = new HashMap<>();
    static {
        for (PennTag tag : values()) {
            tagsByString.put(tag.tag, tag);
        }
        // CoreNLP keeps raw brackets for some tokenizer settings.
        tagsByString.put("(", LRB);
        tagsByString.put(")", RRB);
        tagsByString.put("\"", CLOSE_QUOTE);
    }

    private final String tag;
    private final String description;

    PennTag(String tag, String description) {
        this.tag = tag;
        this.description = description;
    }

    public static PennTag fromString(String tag) {
        return tag == null ? UNKNOWN : tagsByString.getOrDefault(tag, UNKNOWN);
    }

    public String getTag() {
        return tag;
    }

    public String getDescription() {
        return description;
    }

    public boolean isVerb() {
        return this == VB || this == VBD || this == VBG || this == VBN || this == VBP || this == VBZ;
    }

    public boolean isPunctuation() {
        switch (this) {
            case PERIOD:
            case COMMA:
            case COLON:
            case OPEN_QUOTE:
            case CLOSE_QUOTE:
            case LRB:
            case RRB:
            case HYPH:
            case NFP:
                return true;
            default:
                return false;
        }
    }
}
