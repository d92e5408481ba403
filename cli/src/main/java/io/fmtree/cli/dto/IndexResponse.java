package io.fmtree.cli.dto;

/**
 * JSON response for the index-of command; index is -1 when the element is absent.
 */
public class IndexResponse {
    public int index;
}
