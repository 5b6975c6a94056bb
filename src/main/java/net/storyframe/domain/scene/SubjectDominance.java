package net.storyframe.domain.scene;

public enum SubjectDominance {
    WEAK,
    MODERATE,
    STRONG
}
