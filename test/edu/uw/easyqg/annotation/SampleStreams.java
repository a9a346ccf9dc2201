package edu.uw.easyqg.annotation;

/**
 * Hand-parsed passages, in the verb-headed form the converter produces. Heads are indices into the passage.
 */
public final class SampleStreams {

    private SampleStreams() {
    }

    // The cat chased the mouse.
    public static TokenStream catChasedMouse() {
        return TokenStream.builder()
                .add("The", "DT", "det", 1, "the")
                .add("cat", "NN", "nsubj", 2, "cat")
                .add("chased", "VBD", "ROOT", 2, "chase")
                .add("the", "DT", "det", 4, "the")
                .add("mouse", "NN", "dobj", 2, "mouse")
                .add(".", ".", "punct", 2, ".")
                .build();
    }

    // Maria will visit Paris tomorrow.
    public static TokenStream mariaWillVisitParis() {
        return TokenStream.builder()
                .add("Maria", "NNP", "nsubj", 2, "Maria", "PERSON")
                .add("will", "MD", "aux", 2, "will")
                .add("visit", "VB", "ROOT", 2, "visit")
                .add("Paris", "NNP", "dobj", 2, "Paris", "GPE")
                .add("tomorrow", "NN", "npadvmod", 2, "tomorrow", "DATE")
                .add(".", ".", "punct", 2, ".")
                .build();
    }

    // Birds fly.
    public static TokenStream birdsFly() {
        return TokenStream.builder()
                .add("Birds", "NNS", "nsubj", 1, "bird")
                .add("fly", "VBP", "ROOT", 1, "fly")
                .add(".", ".", "punct", 1, ".")
                .build();
    }

    // The letter was written by John.
    public static TokenStream letterWasWritten() {
        return TokenStream.builder()
                .add("The", "DT", "det", 1, "the")
                .add("letter", "NN", "nsubjpass", 3, "letter")
                .add("was", "VBD", "auxpass", 3, "be")
                .add("written", "VBN", "ROOT", 3, "write")
                .add("by", "IN", "agent", 3, "by")
                .add("John", "NNP", "pobj", 4, "John", "PERSON")
                .add(".", ".", "punct", 3, ".")
                .build();
    }

    // The sky is blue.
    public static TokenStream skyIsBlue() {
        return TokenStream.builder()
                .add("The", "DT", "det", 1, "the")
                .add("sky", "NN", "nsubj", 2, "sky")
                .add("is", "VBZ", "ROOT", 2, "be")
                .add("blue", "JJ", "acomp", 2, "blue")
                .add(".", ".", "punct", 2, ".")
                .build();
    }

    // She has a car.
    public static TokenStream sheHasACar() {
        return TokenStream.builder()
                .add("She", "PRP", "nsubj", 1, "she")
                .add("has", "VBZ", "ROOT", 1, "have")
                .add("a", "DT", "det", 3, "a")
                .add("car", "NN", "dobj", 1, "car")
                .add(".", ".", "punct", 1, ".")
                .build();
    }

    // The cat chased the mouse. Birds fly.
    public static TokenStream twoSentences() {
        return TokenStream.builder()
                .add("The", "DT", "det", 1, "the")
                .add("cat", "NN", "nsubj", 2, "cat")
                .add("chased", "VBD", "ROOT", 2, "chase")
                .add("the", "DT", "det", 4, "the")
                .add("mouse", "NN", "dobj", 2, "mouse")
                .add(".", ".", "punct", 2, ".")
                .add("Birds", "NNS", "nsubj", 7, "bird")
                .add("fly", "VBP", "ROOT", 7, "fly")
                .add(".", ".", "punct", 7, ".")
                .build();
    }

    // (she said) Birds fly.
    public static TokenStream bracketedAside() {
        return TokenStream.builder()
                .add("(", "-LRB-", "punct", 5, "(")
                .add("she", "PRP", "nsubj", 2, "she")
                .add("said", "VBD", "parataxis", 5, "say")
                .add(")", "-RRB-", "punct", 5, ")")
                .add("Birds", "NNS", "nsubj", 5, "bird")
                .add("fly", "VBP", "ROOT", 5, "fly")
                .add(".", ".", "punct", 5, ".")
                .build();
    }

    // Dr. Smith visited Paris.
    public static TokenStream abbreviation() {
        return TokenStream.builder()
                .add("Dr", "NNP", "compound", 2, "Dr", "PERSON")
                .add(".", "NFP", "punct", 2, ".")
                .add("Smith", "NNP", "nsubj", 3, "Smith", "PERSON")
                .add("visited", "VBD", "ROOT", 3, "visit")
                .add("Paris", "NNP", "dobj", 3, "Paris", "GPE")
                .add(".", ".", "punct", 3, ".")
                .build();
    }

    // The tool, which works, helps.
    public static TokenStream relativeClause() {
        return TokenStream.builder()
                .add("The", "DT", "det", 1, "the")
                .add("tool", "NN", "nsubj", 6, "tool")
                .add(",", ",", "punct", 1, ",")
                .add("which", "WDT", "nsubj", 4, "which")
                .add("works", "VBZ", "relcl", 1, "work")
                .add(",", ",", "punct", 1, ",")
                .add("helps", "VBZ", "ROOT", 6, "help")
                .add(".", ".", "punct", 6, ".")
                .build();
    }

    // Go home.
    public static TokenStream goHome() {
        return TokenStream.builder()
                .add("Go", "VB", "ROOT", 0, "go")
                .add("home", "RB", "advmod", 0, "home")
                .add(".", ".", "punct", 0, ".")
                .build();
    }

    // Hello.
    public static TokenStream hello() {
        return TokenStream.builder()
                .add("Hello", "UH", "ROOT", 0, "hello")
                .add(".", ".", "punct", 0, ".")
                .build();
    }
}
