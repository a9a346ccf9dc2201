package edu.uw.easyqg.qg;

import com.google.common.collect.ImmutableList;
import edu.uw.easyqg.annotation.Annotator;
import edu.uw.easyqg.annotation.TokenStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Generates one WH-question per clause of an annotated passage.
 * Clauses without a subject, or whose tense or auxiliary cannot be worked out, are skipped.
 */
public class QuestionGenerator {
    private static final Logger log = LoggerFactory.getLogger(QuestionGenerator.class);

    public static final WhWord DEFAULT_MISSING_OBJECT_WH = WhWord.WHY;

    private final TokenStream stream;
    private final SyntaxMapper syntaxMapper;
    private final ImmutableList.Builder<Question> questionsBuilder = ImmutableList.builder();
    private final ImmutableList<Question> questions;
    private final int numCandidateClauses;

    public QuestionGenerator(TokenStream stream) {
        this(stream, DEFAULT_MISSING_OBJECT_WH);
    }

    /**
     * @param missingObjectWh: WH-word for clauses without an object.
     */
    public QuestionGenerator(TokenStream stream, WhWord missingObjectWh) {
        this.stream = stream;
        this.syntaxMapper = new SyntaxMapper(stream, new WhSelector(missingObjectWh));
        this.numCandidateClauses = new ClauseSegmenter(stream).segment(this::acceptClause);
        this.questions = questionsBuilder.build();
        log.debug("{} questions from {} candidate clauses: {}", questions.size(), numCandidateClauses, stream);
    }

    public static QuestionGenerator fromText(Annotator annotator, String text, WhWord missingObjectWh) {
        return new QuestionGenerator(annotator.annotate(text), missingObjectWh);
    }

    private OptionalInt acceptClause(int start, int end) {
        final Optional<SyntaxMap> syntaxMap = syntaxMapper.map(start, end);
        if (!syntaxMap.isPresent() || !syntaxMap.get().isComplete()) {
            return OptionalInt.empty();
        }
        final SyntaxMap map = syntaxMap.get();
        questionsBuilder.add(new Question(
                map.wh.get(),
                map.aux.get(),
                QuestionComposer.normalizeSubject(map.subject.get()),
                map.verb.get().toLowerCase(),
                map.object));
        return OptionalInt.of(map.end);
    }

    public TokenStream getTokenStream() {
        return stream;
    }

    public ImmutableList<Question> getQuestions() {
        return questions;
    }

    public ImmutableList<String> getQuestionStrings() {
        return questions.stream().map(Question::getText).collect(ImmutableList.toImmutableList());
    }

    /**
     * Number of clauses offered to the syntax mapper; an upper bound on the number of questions.
     */
    public int getNumCandidateClauses() {
        return numCandidateClauses;
    }
}
