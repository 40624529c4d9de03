package com.lumen.grading.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Supported LMS platforms for grade sync.
 */
@Getter
@RequiredArgsConstructor
public enum LmsType {

    /**
     * Canvas LMS by Instructure
     */
    CANVAS("Canvas LMS", "https://canvas.instructure.com"),

    /**
     * Moodle (web services REST endpoint)
     */
    MOODLE("Moodle", "https://moodle.org"),

    /**
     * Blackboard Learn
     */
    BLACKBOARD("Blackboard", "https://blackboard.com");

    /**
     * Display name for the platform
     */
    private final String displayName;

    /**
     * Default API base URL
     */
    private final String defaultApiUrl;
}
