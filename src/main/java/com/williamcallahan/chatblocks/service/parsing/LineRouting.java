package com.williamcallahan.chatblocks.service.parsing;

/**
 * Decides whether an open code, math or thinking block captures lines that classify
 * as something else.
 */
public enum LineRouting {
    /**
     * Every line is classified on its own first; only plain-text lines are redirected
     * into an open block. A {@code |} line inside a code fence becomes a table row.
     * Matches the behavior of existing message histories.
     */
    CLASSIFIER_FIRST,

    /**
     * An open block captures every line until the line that closes it.
     */
    OPEN_BLOCK_FIRST
}
