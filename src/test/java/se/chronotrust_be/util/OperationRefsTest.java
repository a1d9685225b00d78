package se.chronotrust_be.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperationRefsTest {

    private static final String KEY = "G" + "A".repeat(55);

    @Test
    void tokenizationRefIsDeterministic() {
        String first = OperationRefs.tokenization(42L, "SN-1", KEY);

        assertThat(OperationRefs.tokenization(42L, "SN-1", KEY)).isEqualTo(first);
        assertThat(OperationRefs.tokenization(43L, "SN-1", KEY)).isNotEqualTo(first);
        assertThat(OperationRefs.tokenization(42L, "SN-1", "G" + "B".repeat(55))).isNotEqualTo(first);
    }

    @Test
    void assetCodeFitsStellarLimit() {
        assertThat(OperationRefs.assetCode(7L)).isEqualTo("CTW000000007");
        assertThat(OperationRefs.assetCode(7L)).hasSizeLessThanOrEqualTo(12);
    }

    @Test
    void stellarKeyFormat() {
        assertThat(StellarKeys.isValidPublicKey(KEY)).isTrue();
        assertThat(StellarKeys.isValidPublicKey("S" + "A".repeat(55))).isFalse();
        assertThat(StellarKeys.isValidPublicKey("G" + "A".repeat(54))).isFalse();
        assertThat(StellarKeys.isValidPublicKey("G" + "a".repeat(55))).isFalse();
        assertThat(StellarKeys.isValidPublicKey(null)).isFalse();
    }
}
