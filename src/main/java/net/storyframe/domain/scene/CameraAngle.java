package net.storyframe.domain.scene;

public enum CameraAngle {
    LOW,
    EYE,
    HIGH
}
