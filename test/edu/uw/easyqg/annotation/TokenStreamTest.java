package edu.uw.easyqg.annotation;

import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenStreamTest {

    @Test
    void resolvesLabelsTagsAndEntitiesOnce() {
        final TokenStream stream = SampleStreams.mariaWillVisitParis();
        final AnnotatedToken maria = stream.get(0);
        assertEquals(DependencyRole.NSUBJ, maria.getDependency());
        assertEquals(PennTag.NNP, maria.getTag());
        assertEquals(PartOfSpeech.PROPN, maria.getPos());
        assertEquals(EntityType.PERSON, maria.getEntity());
        assertEquals(PartOfSpeech.AUX, stream.get(1).getPos());
        assertEquals(EntityType.GPE, stream.get(3).getEntity());
        assertEquals(DependencyRole.OTHER, stream.get(4).getDependency());
        assertEquals("npadvmod", stream.get(4).getRawLabel());
        assertTrue(stream.get(2).isRoot());
        assertEquals("verb, base form", stream.tagDescription(stream.get(2)));
    }

    @Test
    void computesChildrenEdgesAndDepths() {
        final TokenStream stream = SampleStreams.catChasedMouse();
        final AnnotatedToken chased = stream.get(2);
        assertEquals("cat mouse .", stream.getChildren(chased).stream()
                .map(AnnotatedToken::getText).collect(Collectors.joining(" ")));
        assertEquals(0, stream.getLeftEdge(chased));
        assertEquals(5, stream.getRightEdge(chased));
        assertEquals(3, stream.getLeftEdge(stream.get(4)));
        assertEquals(0, stream.getDepth(chased));
        assertEquals(2, stream.getDepth(stream.get(0)));
        assertEquals("the mouse", stream.getSubtree(stream.get(4)).getText());
    }

    @Test
    void spanRootIsTheTokenClosestToTheSentenceRoot() {
        final TokenStream stream = SampleStreams.catChasedMouse();
        assertEquals("chased", stream.span(0, 5).getRoot().getText());
        assertEquals("cat", stream.span(0, 2).getRoot().getText());
        // mouse and the full stop are equally deep; the leftmost token wins.
        assertEquals("mouse", stream.span(4, 6).getRoot().getText());
    }

    @Test
    void derivesNounChunksFromTheTree() {
        final TokenStream stream = SampleStreams.twoSentences();
        assertEquals("The cat|the mouse|Birds", stream.getNounChunks().stream()
                .map(Span::getText).collect(Collectors.joining("|")));
        assertEquals("The cat|the mouse", stream.span(0, 6).getNounChunks().stream()
                .map(Span::getText).collect(Collectors.joining("|")));
        // chunks reaching outside the span are left out.
        assertTrue(stream.span(1, 6).getNounChunks().stream().noneMatch(chunk -> chunk.getText().equals("The cat")));
    }

    @Test
    void chunksConjunctsSeparately() {
        // Cats and dogs sleep.
        final TokenStream stream = TokenStream.builder()
                .add("Cats", "NNS", "nsubj", 3, "cat")
                .add("and", "CC", "cc", 0, "and")
                .add("dogs", "NNS", "conj", 0, "dog")
                .add("sleep", "VBP", "ROOT", 3, "sleep")
                .add(".", ".", "punct", 3, ".")
                .build();
        assertEquals("Cats|dogs", stream.getNounChunks().stream()
                .map(Span::getText).collect(Collectors.joining("|")));
    }

    @Test
    void toleratesCyclicHeads() {
        final TokenStream stream = TokenStream.builder()
                .add("a", "NN", "dep", 1, "a")
                .add("b", "NN", "dep", 0, "b")
                .build();
        assertFalse(stream.get(0).isRoot());
        assertEquals(2, stream.getDepth(stream.get(0)));
    }

    @Test
    void rejectsHeadsOutsideTheStream() {
        final TokenStream.Builder builder = TokenStream.builder().add("a", "NN", "ROOT", 3, "a");
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsBadSpans() {
        final TokenStream stream = SampleStreams.birdsFly();
        assertThrows(IllegalArgumentException.class, () -> stream.span(2, 1));
        assertThrows(IllegalArgumentException.class, () -> stream.span(0, 4));
        assertThrows(IllegalStateException.class, () -> stream.span(1, 1).getRoot());
    }

    @Test
    void derivesCoarsePartsOfSpeech() {
        assertEquals(PartOfSpeech.AUX, PartOfSpeech.of(PennTag.VBZ, DependencyRole.ROOT, "be"));
        assertEquals(PartOfSpeech.VERB, PartOfSpeech.of(PennTag.VBZ, DependencyRole.ROOT, "have"));
        assertEquals(PartOfSpeech.AUX, PartOfSpeech.of(PennTag.VBZ, DependencyRole.AUX, "have"));
        assertEquals(PartOfSpeech.AUX, PartOfSpeech.of(PennTag.MD, DependencyRole.AUX, "will"));
        assertEquals(PartOfSpeech.PART, PartOfSpeech.of(PennTag.TO, DependencyRole.AUX, "to"));
        assertEquals(PartOfSpeech.PRON, PartOfSpeech.of(PennTag.WDT, DependencyRole.NSUBJ, "which"));
        assertEquals(PartOfSpeech.PUNCT, PartOfSpeech.of(PennTag.fromString("-LRB-"), DependencyRole.PUNCT, "("));
        assertEquals(PennTag.UNKNOWN, PennTag.fromString("XYZ"));
    }

    @Test
    void mapsEntityAndRoleLabels() {
        assertEquals(EntityType.GPE, EntityType.fromLabel("CITY"));
        assertEquals(EntityType.GPE, EntityType.fromLabel("COUNTRY"));
        assertEquals(EntityType.ORG, EntityType.fromLabel("ORGANIZATION"));
        assertEquals(EntityType.NONE, EntityType.fromLabel("O"));
        assertEquals(EntityType.NONE, EntityType.fromLabel(""));
        assertEquals(EntityType.OTHER, EntityType.fromLabel("MONEY"));
        assertEquals(DependencyRole.NSUBJPASS, DependencyRole.fromLabel("nsubj:pass"));
        assertEquals(DependencyRole.DOBJ, DependencyRole.fromLabel("obj"));
        assertEquals(DependencyRole.ROOT, DependencyRole.fromLabel("ROOT"));
        assertTrue(DependencyRole.CSUBJPASS.isSubject());
        assertTrue(DependencyRole.POBJ.isObject());
        assertFalse(DependencyRole.DATIVE.isObject());
    }
}
