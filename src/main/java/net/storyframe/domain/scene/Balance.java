package net.storyframe.domain.scene;

public enum Balance {
    SYMMETRICAL,
    ASYMMETRICAL
}
