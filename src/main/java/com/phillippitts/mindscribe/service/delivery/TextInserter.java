package com.phillippitts.mindscribe.service.delivery;

/**
 * Hands a finished transcript to the user (paste into the focused application, clipboard,
 * notification). Implementations must be privacy-safe in logs and avoid leaking full text at INFO.
 */
public interface TextInserter {

    /**
     * @param text transcript text (can be empty)
     * @return true if the text reached the user
     */
    boolean insert(String text);

    String name();
}
