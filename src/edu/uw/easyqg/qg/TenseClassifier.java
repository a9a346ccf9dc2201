package edu.uw.easyqg.qg;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import edu.uw.easyqg.annotation.AnnotatedToken;
import edu.uw.easyqg.annotation.PennTag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Classifies the tense of a verb from the description of its tag. Descriptions are matched once per tag, in the
 * order below, so lookups switch on the tag alone.
 */
public final class TenseClassifier {
    private static final Logger log = LoggerFactory.getLogger(TenseClassifier.class);

    private static final ImmutableMap<String, Tense> descriptionKeywords = ImmutableMap.<String, Tense>builder()
            .put("past tense", Tense.PAST_TENSE)
            .put("past principle", Tense.PAST_PRIN)
            .put("past participle", Tense.PAST_PART)
            .put("present", Tense.PRESENT)
            .put("future", Tense.FUTURE)
            .put("base form", Tense.BASE)
            .build();

    private static final Map<PennTag, Tense> tenseByTag;
    static {
        final EnumMap<PennTag, Tense> tenses = new EnumMap<>(PennTag.class);
        for (PennTag tag : PennTag.values()) {
            tenses.put(tag, fromDescription(tag.getDescription()));
        }
        tenseByTag = Maps.immutableEnumMap(tenses);
    }

    private TenseClassifier() {
    }

    static Tense fromDescription(String description) {
        return descriptionKeywords.entrySet().stream()
                .filter(entry -> description.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(Tense.UNKNOWN);
    }

    public static Tense classify(AnnotatedToken verb) {
        final Tense tense = tenseByTag.get(verb.getTag());
        if (tense == Tense.UNKNOWN) {
            log.debug("Could not determine tense of '{}' ({})", verb.getText(), verb.getRawTag());
        }
        return tense;
    }
}
