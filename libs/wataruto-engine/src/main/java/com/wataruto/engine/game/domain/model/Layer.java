package com.wataruto.engine.game.domain.model;

/** 一格的两个独立层。SECONDARY 是叠在 PRIMARY 之上的架桥层。 */
public enum Layer {

    PRIMARY,
    SECONDARY;

    public int index() {
        return ordinal();
    }
}
