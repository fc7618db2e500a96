package com.entity.linkage.scoring;

import com.entity.linkage.core.model.Record;

/**
 * Two already-loaded records to score. Either side may be null when the
 * caller could not load it; the scorer reports such pairs as failed.
 */
public record RecordPair(Record left, Record right) {
}
