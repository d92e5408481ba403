package io.fmtree.cli.dto;

import java.util.List;

/**
 * JSON shape of a tree description.
 * Example:
 *   {
 *     "levels": 20,
 *     "hash": "sha256",
 *     "zeroElement": "0000...0000",
 *     "elements": ["ab12...", "cd34..."]
 *   }
 */
public class TreeConfigJson {
    public Integer levels;
    public String hash;
    public String zeroElement;
    public List<String> elements;
}
