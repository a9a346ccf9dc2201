package edu.uw.easyqg.qg;

// not really tenses... but the verb forms we need to pick an auxiliary.
public enum Tense {
    PAST_TENSE, PAST_PRIN, PAST_PART, PRESENT, FUTURE, BASE, UNKNOWN;

    public boolean isPast() {
        return this == PAST_TENSE || this == PAST_PRIN || this == PAST_PART;
    }
}
