package edu.uw.easyqg.annotation;

/**
 * One token of an annotated passage. Indices are positions in the whole passage; the root of each sentence is its
 * own head.
 */
public final class AnnotatedToken {
    private final String text;
    private final int index;
    private final PartOfSpeech pos;
    private final PennTag tag;
    private final String rawTag;
    private final DependencyRole dependency;
    private final String rawLabel;
    private final String lemma;
    private final EntityType entity;
    private final int headIndex;

    AnnotatedToken(String text, int index, PartOfSpeech pos, String rawTag, String rawLabel, String lemma,
                   EntityType entity, int headIndex) {
        this.text = text;
        this.index = index;
        this.pos = pos;
        this.tag = PennTag.fromString(rawTag);
        this.rawTag = rawTag;
        this.dependency = DependencyRole.fromLabel(rawLabel);
        this.rawLabel = rawLabel;
        this.lemma = lemma;
        this.entity = entity;
        this.headIndex = headIndex;
    }

    public String getText() {
        return text;
    }

    public int getIndex() {
        return index;
    }

    public PartOfSpeech getPos() {
        return pos;
    }

    public PennTag getTag() {
        return tag;
    }

    public String getRawTag() {
        return rawTag;
    }

    public DependencyRole getDependency() {
        return dependency;
    }

    public String getRawLabel() {
        return rawLabel;
    }

    public String getLemma() {
        return lemma;
    }

    public EntityType getEntity() {
        return entity;
    }

    public int getHeadIndex() {
        return headIndex;
    }

    public boolean isRoot() {
        return headIndex == index;
    }

    @Override
    public String toString() {
        return String.format("%s/%s/%s:%d", text, rawTag, rawLabel, index);
    }
}
