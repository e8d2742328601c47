package io.github.yok.credload.core;

import lombok.Value;

/**
 * Key and value fields of one input line.
 */
@Value
public class ParsedLine {
    String key;
    String value;
}
