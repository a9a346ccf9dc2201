package edu.uw.easyqg.annotation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Converts a Universal Dependencies parse of one sentence into the verb-headed trees the question generator walks:
 * <ul>
 *     <li>UD labels are renamed (nsubj:pass becomes nsubjpass, obj becomes dobj, ...);</li>
 *     <li>a nominal obl/nmod with a case marker becomes a pobj;</li>
 *     <li>a copula takes over the head of its predicate, along with the predicate's subject, auxiliaries,
 *     punctuation and coordination; the predicate becomes the copula's attr (acomp for adjectives, pobj for
 *     case-marked nominals);</li>
 *     <li>infinitival "to" marking a verb becomes its aux.</li>
 * </ul>
 */
public final class DependencyConverter {
    private static final ImmutableMap<String, String> renamedLabels = ImmutableMap.<String, String>builder()
            .put("nsubj:pass", "nsubjpass")
            .put("csubj:pass", "csubjpass")
            .put("obj", "dobj")
            .put("iobj", "dative")
            .put("aux:pass", "auxpass")
            .put("compound:prt", "prt")
            .put("nmod:poss", "poss")
            .put("root", "ROOT")
            .build();

    private static final ImmutableSet<String> copulaDependents = ImmutableSet.of(
            "nsubj", "nsubjpass", "csubj", "csubjpass", "aux", "auxpass", "punct", "cc", "conj", "mark", "expl");

    private DependencyConverter() {
    }

    /**
     * Appends one sentence to the stream being built.
     * @param heads: sentence-internal head index of each token, -1 for the root.
     * @param labels: UD relation of each token to its head.
     */
    public static void appendSentence(TokenStream.Builder builder, List<String> words, List<String> tags,
                                      List<String> lemmas, List<String> entities, int[] heads, String[] labels) {
        final int numTokens = words.size();
        Preconditions.checkArgument(tags.size() == numTokens && lemmas.size() == numTokens
                && entities.size() == numTokens && heads.length == numTokens && labels.length == numTokens,
                "sentence annotations have mismatched lengths");
        final int[] newHeads = heads.clone();
        final String[] newLabels = new String[numTokens];
        for (int i = 0; i < numTokens; i++) {
            newLabels[i] = newHeads[i] < 0 ? "ROOT" : renameLabel(labels[i]);
        }
        for (int i = 0; i < numTokens; i++) {
            if (isPrepositionalObject(i, tags, newHeads, newLabels)) {
                newLabels[i] = "pobj";
            }
        }
        for (int cop = 0; cop < numTokens; cop++) {
            if (newLabels[cop].equals("cop") && newHeads[cop] >= 0) {
                promoteCopula(cop, tags, newHeads, newLabels);
            }
        }
        for (int i = 0; i < numTokens; i++) {
            if (isInfinitivalMarker(i, tags, newHeads, newLabels)) {
                newLabels[i] = "aux";
            }
        }
        final int offset = builder.size();
        for (int i = 0; i < numTokens; i++) {
            final boolean isRoot = newHeads[i] < 0;
            builder.add(words.get(i), tags.get(i), isRoot ? "ROOT" : newLabels[i],
                    offset + (isRoot ? i : newHeads[i]), lemmas.get(i), entities.get(i));
        }
    }

    static String renameLabel(String label) {
        final String lowered = label == null ? "dep" : label.toLowerCase();
        return renamedLabels.getOrDefault(lowered, lowered);
    }

    private static boolean isPrepositionalObject(int index, List<String> tags, int[] heads, String[] labels) {
        final String label = labels[index];
        if (!label.startsWith("obl") && !label.startsWith("nmod")) {
            return false;
        }
        return isCaseMarkedNominal(index, tags, heads, labels);
    }

    private static boolean isCaseMarkedNominal(int index, List<String> tags, int[] heads, String[] labels) {
        final PartOfSpeech pos = PartOfSpeech.of(PennTag.fromString(tags.get(index)), DependencyRole.OTHER, "");
        if (pos != PartOfSpeech.NOUN && pos != PartOfSpeech.PROPN && pos != PartOfSpeech.PRON
                && pos != PartOfSpeech.NUM) {
            return false;
        }
        return IntStream.range(0, heads.length).anyMatch(i -> heads[i] == index && labels[i].equals("case"));
    }

    private static boolean isInfinitivalMarker(int index, List<String> tags, int[] heads, String[] labels) {
        return labels[index].equals("mark") && PennTag.fromString(tags.get(index)) == PennTag.TO
                && heads[index] >= 0 && PennTag.fromString(tags.get(heads[index])).isVerb();
    }

    private static void promoteCopula(int cop, List<String> tags, int[] heads, String[] labels) {
        final int predicate = heads[cop];
        for (int i = 0; i < heads.length; i++) {
            if (i != cop && heads[i] == predicate && copulaDependents.contains(labels[i])) {
                heads[i] = cop;
            }
        }
        heads[cop] = heads[predicate];
        labels[cop] = labels[predicate];
        heads[predicate] = cop;
        if (isCaseMarkedNominal(predicate, tags, heads, labels)) {
            labels[predicate] = "pobj";
        } else {
            labels[predicate] = tags.get(predicate).startsWith("JJ") ? "acomp" : "attr";
        }
    }
}
