package com.modulestack.resolver.descriptor;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code KEY=VALUE} line of a version descriptor.
 */
@Value
public class DescriptorLine {

    @NonNull
    String key;

    @NonNull
    String value;

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
