package com.flowmable.splitter;

/**
 * Raised when an image handed to the splitter is malformed (zero area, unsupported
 * channel layout, or a pixel buffer that does not match its declared size).
 * <p>
 * Ambiguous or empty content is never reported this way; it is expressed through
 * {@link SplitMode}.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
