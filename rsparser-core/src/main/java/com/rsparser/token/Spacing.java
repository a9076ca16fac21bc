package com.rsparser.token;

public enum Spacing {
    /** Followed by whitespace, a non-punctuation token, or the end of the group. */
    ALONE,
    /** Immediately followed by another punctuation character. */
    JOINT
}
