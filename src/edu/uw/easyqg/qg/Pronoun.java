package edu.uw.easyqg.qg;

import com.google.common.collect.ImmutableSet;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Convenience class for dealing with pronouns in subject position: which ones keep their capitalization,
 * and which relative pronouns stand in for an antecedent.
 */
final class Pronoun {
    public static enum Number {
        SINGULAR, PLURAL
    }
    public static enum Person {
        FIRST, SECOND, THIRD
    }

    // "which" heading a relative clause refers back to a thing; as a question subject it reads as "it".
    public static final Pronoun IT = new Pronoun("it", Optional.of(Number.SINGULAR), Person.THIRD);

    private static final ImmutableSet<String> relativePronouns = ImmutableSet.of("which", "that");

    private static final Map<String, Pronoun> pronounsByLowerCaseString = new HashMap<>();
    static {
        add(new Pronoun("I", Optional.of(Number.SINGULAR), Person.FIRST));
        add(new Pronoun("we", Optional.of(Number.PLURAL), Person.FIRST));
        add(new Pronoun("you", Optional.empty(), Person.SECOND));
        add(new Pronoun("he", Optional.of(Number.SINGULAR), Person.THIRD));
        add(new Pronoun("she", Optional.of(Number.SINGULAR), Person.THIRD));
        add(IT);
        add(new Pronoun("they", Optional.of(Number.PLURAL), Person.THIRD));
    }

    private static void add(Pronoun pronoun) {
        pronounsByLowerCaseString.put(pronoun.form.toLowerCase(), pronoun);
    }

    public static Optional<Pronoun> fromString(String str) {
        return Optional.ofNullable(pronounsByLowerCaseString.get(str.toLowerCase()));
    }

    public static boolean isRelative(String str) {
        return relativePronouns.contains(str);
    }

    private final String form;
    public final Optional<Number> number;
    public final Person person;

    private Pronoun(String form, Optional<Number> number, Person person) {
        this.form = form;
        this.number = number;
        this.person = person;
    }

    /**
     * The written form. Only the first person singular is capitalized mid-sentence.
     */
    public String toString() {
        return form;
    }
}
