package edu.uw.easyqg.annotation;

import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.ling.IndexedWord;
import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreSentence;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.semgraph.SemanticGraph;
import edu.stanford.nlp.semgraph.SemanticGraphCoreAnnotations;
import edu.stanford.nlp.semgraph.SemanticGraphEdge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Annotates text with Stanford CoreNLP: tokenization, sentence splitting, tagging, lemmatization, NER and basic
 * dependencies, converted sentence by sentence into one token stream.
 */
public class CoreNlpAnnotator implements Annotator {
    private static final Logger log = LoggerFactory.getLogger(CoreNlpAnnotator.class);

    private final StanfordCoreNLP pipeline;

    public CoreNlpAnnotator(final Properties properties) {
        log.info("Loading CoreNLP pipeline: {}", properties.getProperty("annotators"));
        this.pipeline = new StanfordCoreNLP(properties);
    }

    @Override
    public TokenStream annotate(final String text) {
        final CoreDocument document = new CoreDocument(text);
        pipeline.annotate(document);
        final TokenStream.Builder builder = TokenStream.builder();
        for (CoreSentence sentence : document.sentences()) {
            appendSentence(builder, sentence);
        }
        return builder.build();
    }

    private static void appendSentence(final TokenStream.Builder builder, final CoreSentence sentence) {
        final List<CoreLabel> tokens = sentence.tokens();
        final int numTokens = tokens.size();
        final int[] heads = new int[numTokens];
        final String[] labels = new String[numTokens];
        Arrays.fill(heads, -1);
        Arrays.fill(labels, "dep");

        final SemanticGraph graph = sentence.coreMap()
                .get(SemanticGraphCoreAnnotations.BasicDependenciesAnnotation.class);
        if (graph == null) {
            log.warn("No dependency parse for sentence: {}", sentence.text());
        } else {
            for (SemanticGraphEdge edge : graph.edgeIterable()) {
                final int dependent = edge.getDependent().index() - 1;
                heads[dependent] = edge.getGovernor().index() - 1;
                labels[dependent] = edge.getRelation().toString();
            }
            // Tokens the parser left unattached hang off the first root.
            final int root = graph.getRoots().stream().mapToInt(IndexedWord::index).min().orElse(1) - 1;
            for (int i = 0; i < numTokens; i++) {
                if (heads[i] < 0 && i != root) {
                    heads[i] = root;
                }
            }
            heads[root] = -1;
        }

        DependencyConverter.appendSentence(builder,
                tokens.stream().map(CoreLabel::word).collect(Collectors.toList()),
                tokens.stream().map(CoreLabel::tag).collect(Collectors.toList()),
                tokens.stream().map(token -> token.lemma() == null ? token.word() : token.lemma())
                        .collect(Collectors.toList()),
                tokens.stream().map(token -> token.ner() == null ? "O" : token.ner()).collect(Collectors.toList()),
                heads, labels);
    }
}
