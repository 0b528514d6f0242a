package org.dxworks.logframe;

import java.io.IOException;

/**
 * No reader recognizes the input.
 */
public class UnknownTypeException extends IOException {

    public UnknownTypeException(String message) {
        super(message);
    }
}
