package com.previewenv.core.model;

/**
 * Source pull request the environment was built for.
 * baseBranch and merged are optional.
 */
public record PrMetadata(
    int number,
    String url,
    String baseBranch,
    Boolean merged
) {
    public static PrMetadata of(int number, String url) {
        return new PrMetadata(number, url, null, null);
    }
}
