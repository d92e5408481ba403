package io.fmtree.cli.dto;

/**
 * JSON response for the root command.
 *   { "root": "f5a5fd42..." }
 */
public class RootResponse {
    public Object root;
}
