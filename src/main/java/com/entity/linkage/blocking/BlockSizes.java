package com.entity.linkage.blocking;

import com.entity.linkage.core.exception.ConfigurationException;

final class BlockSizes {

    private BlockSizes() {
    }

    static void validate(int minBlockSize, int maxBlockSize) {
        if (minBlockSize < 2) {
            throw new ConfigurationException("minBlockSize must be >= 2, got " + minBlockSize);
        }
        if (maxBlockSize < minBlockSize) {
            throw new ConfigurationException(
                    "maxBlockSize (" + maxBlockSize + ") must be >= minBlockSize (" + minBlockSize + ")");
        }
    }
}
