package edu.uw.easyqg.qg;

import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.SampleStreams;
import edu.uw.easyqg.annotation.TokenStream;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VerbHelperTest {

    // They want to be.
    private static TokenStream theyWantToBe() {
        return TokenStream.builder()
                .add("They", "PRP", "nsubj", 1, "they")
                .add("want", "VBP", "ROOT", 1, "want")
                .add("to", "TO", "aux", 3, "to")
                .add("be", "VB", "xcomp", 1, "be")
                .add(".", ".", "punct", 1, ".")
                .build();
    }

    @Test
    void usesTheAuxiliaryRightBeforeTheVerb() {
        final TokenStream stream = SampleStreams.mariaWillVisitParis();
        assertEquals(Optional.of("will"),
                VerbHelper.resolveAuxiliary(stream.span(0, 6), stream.get(2), Tense.BASE));
        final TokenStream passive = SampleStreams.letterWasWritten();
        assertEquals(Optional.of("was"),
                VerbHelper.resolveAuxiliary(passive.span(0, 7), passive.get(3), Tense.PAST_PART));
    }

    @Test
    void fallsBackToDoSupport() {
        final TokenStream cat = SampleStreams.catChasedMouse();
        assertEquals(Optional.of("did"), VerbHelper.resolveAuxiliary(cat.span(0, 6), cat.get(2), Tense.PAST_TENSE));
        final TokenStream birds = SampleStreams.birdsFly();
        assertEquals(Optional.of("do"), VerbHelper.resolveAuxiliary(birds.span(0, 3), birds.get(1), Tense.PRESENT));
        final TokenStream she = SampleStreams.sheHasACar();
        assertEquals(Optional.of("does"), VerbHelper.resolveAuxiliary(she.span(0, 5), she.get(1), Tense.PRESENT));
    }

    @Test
    void copulaIsItsOwnAuxiliary() {
        final TokenStream stream = SampleStreams.skyIsBlue();
        final AnnotatedToken is = stream.get(2);
        assertEquals(Optional.of("is"), VerbHelper.resolveAuxiliary(stream.span(0, 5), is, Tense.PRESENT));
        assertEquals("is", VerbHelper.getVerbForm(is, Tense.PRESENT, "is"));
    }

    @Test
    void infinitivalToTakesTheTenseOfTheVerb() {
        final TokenStream stream = theyWantToBe();
        final AnnotatedToken want = stream.get(1);
        assertEquals(Optional.of("does"), VerbHelper.resolveAuxiliary(stream.span(0, 5), want, Tense.PRESENT));
        assertEquals(Optional.of("did"), VerbHelper.resolveAuxiliary(stream.span(0, 5), want, Tense.PAST_TENSE));
        assertEquals("will", VerbHelper.fineTune(stream.get(2), Tense.BASE));
        assertEquals("is", VerbHelper.fineTune(stream.get(3), Tense.BASE));
    }

    @Test
    void noAuxiliaryForBareImperatives() {
        final TokenStream stream = SampleStreams.goHome();
        assertEquals(Optional.empty(), VerbHelper.resolveAuxiliary(stream.span(0, 3), stream.get(0), Tense.BASE));
    }

    @Test
    void verbReturnsToBaseFormUnderDoSupport() {
        assertEquals("chase", VerbHelper.getVerbForm(SampleStreams.catChasedMouse().get(2), Tense.PAST_TENSE, "did"));
        assertEquals("have", VerbHelper.getVerbForm(SampleStreams.sheHasACar().get(1), Tense.PRESENT, "does"));
        assertEquals("written",
                VerbHelper.getVerbForm(SampleStreams.letterWasWritten().get(3), Tense.PAST_PART, "was"));
        assertEquals("visit", VerbHelper.getVerbForm(SampleStreams.mariaWillVisitParis().get(2), Tense.BASE, "will"));
        assertEquals("Go", VerbHelper.getVerbForm(SampleStreams.goHome().get(0), Tense.BASE, null));
    }
}
