package com.entity.linkage.ann;

import java.util.Comparator;
import java.util.List;

/**
 * Two records whose vectors are similar. {@code doc1Key} sorts before {@code doc2Key}.
 */
public record VectorPair(String doc1Key, String doc2Key, double similarity, String method) {

    public static final Comparator<VectorPair> BY_SIMILARITY =
            Comparator.comparingDouble(VectorPair::similarity).reversed()
                    .thenComparing(VectorPair::doc1Key)
                    .thenComparing(VectorPair::doc2Key);

    public VectorPair {
        if (doc1Key.compareTo(doc2Key) > 0) {
            String tmp = doc1Key;
            doc1Key = doc2Key;
            doc2Key = tmp;
        }
    }

    /**
     * Identity of the unordered pair.
     */
    public List<String> ids() {
        return List.of(doc1Key, doc2Key);
    }

    /**
     * Readable {@code doc1|doc2} label; not unique when keys contain the separator.
     */
    public String pairKey() {
        return doc1Key + "|" + doc2Key;
    }
}
