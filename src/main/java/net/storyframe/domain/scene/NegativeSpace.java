package net.storyframe.domain.scene;

public enum NegativeSpace {
    LEFT,
    RIGHT,
    CENTER
}
