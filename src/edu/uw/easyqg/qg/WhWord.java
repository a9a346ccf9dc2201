package edu.uw.easyqg.qg;

public enum WhWord {
    WHAT("What"), WHO("Who"), WHERE("Where"), WHEN("When"), HOW("How"), WHY("Why");

    private final String word;

    WhWord(String word) {
        this.word = word;
    }

    public String getWord() {
        return word;
    }

    @Override
    public String toString() {
        return word;
    }
}
