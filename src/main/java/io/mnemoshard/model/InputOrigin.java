package io.mnemoshard.model;

public enum InputOrigin {
    PASTED,
    FILE
}
