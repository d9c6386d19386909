package com.spintax.engine.core;

/** Sample grammar loaded into fresh editing sessions on request. */
public final class SpintaxPresets {

    public static final String EXAMPLE =
            "{Spintax is|Spintax can be|Using spintax is} {a great way|an effective method|a powerful tool}"
                    + " to {create|generate|produce} {diverse|varied|unique} {content|phrasing|text}"
                    + " without {manually rewriting|repeating yourself|starting from scratch}.";

    private SpintaxPresets() {}
}
