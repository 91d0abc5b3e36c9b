package com.xml2md.core.sink.impl;

import com.xml2md.core.sink.OutputSink;

/**
 * Sink that drops all output while counting the characters it was given.
 *
 * <p>Lets a conversion run for its diagnostics only.
 */
public class DiscardingSink implements OutputSink {

    private long discarded;

    @Override
    public void append(String text) {
        if (text != null) {
            discarded += text.length();
        }
    }

    /**
     * Returns the number of characters dropped so far.
     *
     * @return character count
     */
    public long discardedCharacters() {
        return discarded;
    }
}
