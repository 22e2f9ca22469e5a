package com.cdlc.core.model;

/**
 * Vocabulary of a vendor tag payload.
 */
public enum TagKind {
    /** Brick schema, payload is Turtle text. */
    BRICK("brick"),
    /** Project Haystack, payload is JSON text. */
    HAYSTACK("haystack");

    private final String keyword;

    TagKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the keyword used inside {@code __cdl(...)}.
     *
     * @return {@code brick} or {@code haystack}
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * Maps a keyword to a tag kind.
     *
     * @param keyword {@code brick} or {@code haystack}
     * @return the tag kind
     * @throws IllegalArgumentException for other keywords
     */
    public static TagKind fromKeyword(String keyword) {
        for (TagKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown tag keyword: " + keyword);
    }
}
