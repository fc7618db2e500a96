package com.entity.linkage.similarity;

/**
 * Phonetic-code equality: 1.0 when both values share a Soundex code, else 0.0.
 */
public class PhoneticSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        String a = SoundexEncoder.encode(s1);
        if (SoundexEncoder.EMPTY_CODE.equals(a)) {
            return 0.0;
        }
        return a.equals(SoundexEncoder.encode(s2)) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "phonetic";
    }
}
