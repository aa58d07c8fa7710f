package com.asad.tendency_analyzer.model;

import java.util.function.Function;

/**
 * Groupings available to the by-category tables.
 */
public enum PlayCategory {

    PERSONNEL(p -> p.offPersonnel),
    FORMATION(p -> p.formationGroup),
    QB_ALIGNMENT(p -> p.qbAlignment),
    DEF_PACKAGE(p -> p.defPackage);

    private final Function<Play, String> key;

    PlayCategory(Function<Play, String> key) {
        this.key = key;
    }

    /** Category value of the play, null when the play has none. */
    public String keyOf(Play play) {
        return key.apply(play);
    }
}
