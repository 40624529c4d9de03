package com.lumen.grading.model.enums;

/**
 * Where the final score of a grade came from.
 */
public enum GradeSource {

    /**
     * Score taken from the active AI evaluation
     */
    AI,

    /**
     * Score entered by an instructor with no AI evaluation behind it
     */
    MANUAL,

    /**
     * Instructor score replacing an AI evaluation
     */
    AI_OVERRIDDEN
}
