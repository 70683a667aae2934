package com.gamebook.storage;

import java.io.IOException;

/**
 * The story store exists but cannot be used: invalid JSON or a root that is not an array.
 */
public class StoryStoreException extends IOException {

    public StoryStoreException(String message) {
        super(message);
    }

    public StoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
