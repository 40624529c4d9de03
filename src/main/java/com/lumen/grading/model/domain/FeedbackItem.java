package com.lumen.grading.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One categorized comment from an AI evaluation.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackItem {

    public static final int MAX_CATEGORY_LENGTH = 50;
    public static final int MAX_COMMENT_LENGTH = 2000;

    /**
     * e.g. "grammar", "vocabulary", "general"
     */
    @Column(name = "category", nullable = false, length = MAX_CATEGORY_LENGTH)
    private String category;

    @Column(name = "comment", nullable = false, length = MAX_COMMENT_LENGTH)
    private String comment;
}
