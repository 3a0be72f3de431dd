package com.dcruver.clippets.pointer;

import lombok.Value;

/**
 * An insertion position as the ID of the reference element and whether the
 * position is after it. Used for highlighting the position.
 */
@Value
public class InsertionAddress {
    String uid;
    boolean after;
}
