package net.storyframe.application.alignment;

/**
 * Condenses a scene intent into a short image-bank search query.
 */
public interface SearchKeywordExtractor {

    String extractSearchKeywords(String intent);
}
