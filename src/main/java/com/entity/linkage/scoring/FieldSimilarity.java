package com.entity.linkage.scoring;

/**
 * Similarity of one field of a record pair and its contribution to the score.
 *
 * @param field        the compared field
 * @param similarity   raw similarity in [0, 1]
 * @param algorithm    name of the similarity primitive
 * @param weight       the field's configured parameters
 * @param agreed       whether the similarity reached the field threshold
 * @param contribution the field's term in the aggregate log-likelihood
 */
public record FieldSimilarity(String field, double similarity, String algorithm,
                              FieldWeight weight, boolean agreed, double contribution) {
}
