package org.dxworks.logframe.reader.log;

import java.io.IOException;

/**
 * The input looked like a log file but its structure is broken, e.g. a frame
 * is never closed.
 */
public class DamagedFileException extends IOException {

    public DamagedFileException(String message) {
        super(message);
    }
}
