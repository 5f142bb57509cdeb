package com.sysmuse.leadership.config;

import java.io.IOException;

/**
 * The hierarchy catalogue could not be found, read or validated.
 */
public class HierarchyConfigException extends IOException {

    public HierarchyConfigException(String message) {
        super(message);
    }

    public HierarchyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
