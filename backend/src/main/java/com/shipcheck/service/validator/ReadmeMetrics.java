package com.shipcheck.service.validator;

/**
 * Structural measurements of a README.
 *
 * @param length      character count
 * @param headingCount number of markdown heading lines
 */
public record ReadmeMetrics(int length, int headingCount) {

    static final int MIN_LENGTH = 200;

    public boolean hasHeadings() {
        return headingCount > 0;
    }

    public boolean hasSections() {
        return headingCount >= 2;
    }

    public boolean tooShort() {
        return length <= MIN_LENGTH;
    }

    /** Quality floor: longer than 200 characters and at least one heading. */
    public boolean meetsFloor() {
        return !tooShort() && hasHeadings();
    }
}
