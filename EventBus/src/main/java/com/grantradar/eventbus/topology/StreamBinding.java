package com.grantradar.eventbus.topology;

import lombok.Value;

/**
 * A consumer group bound to one stream.
 */
@Value
public class StreamBinding {
    String stream;
    String group;
}
