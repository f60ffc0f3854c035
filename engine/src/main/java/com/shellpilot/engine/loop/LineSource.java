package com.shellpilot.engine.loop;

import java.io.IOException;

/** Where the loop gets its input lines from. */
public interface LineSource {

    /**
     * Show {@code prompt} and read one line.
     *
     * @return the line without its terminator, or null at end of input
     */
    String readLine(String prompt) throws IOException;
}
