package io.fmtree.cli.dto;

import java.util.List;

/**
 * JSON response for the proof command.
 * Example:
 *   {
 *     "index": 0,
 *     "pathElements": [3, 0],
 *     "pathIndices": [0, 0]
 *   }
 */
public class ProofResponse {
    public int index;
    public List<?> pathElements;
    public List<Integer> pathIndices;
}
