package edu.uw.easyqg.annotation;

/**
 * Turns raw text into an annotated token stream.
 */
public interface Annotator {
    TokenStream annotate(String text);
}
