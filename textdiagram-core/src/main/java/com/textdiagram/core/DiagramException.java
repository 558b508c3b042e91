package com.textdiagram.core;

/**
 * Base class for every recoverable failure while turning diagram source into text.
 *
 * <p>A caller that receives this exception can fix the input or choose a larger width;
 * no partially drawn output is ever returned alongside it.
 */
public class DiagramException extends Exception {

    public DiagramException(String message) {
        super(message);
    }

    public DiagramException(String message, Throwable cause) {
        super(message, cause);
    }
}
