package com.phillippitts.estatesearch.domain;

/** A news item cited by community analysis. */
public record NewsStory(String title, String summary, String url) {
}
