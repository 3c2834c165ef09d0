package uk.ac.ebi.biostudies.taxonomy_service.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NameNormalizerTest {

  @Test
  void testNormalizeFoldsLowercasesAndRemovesHyphens() {
    assertEquals("abceaao !", NameNormalizer.normalize("AbcéÅäö-- !"));
    assertEquals("abce", NameNormalizer.normalize("Ab-Cé"));
  }

  @Test
  void testNormalizeDropsCharactersWithoutAsciiEquivalent() {
    assertEquals(" car", NameNormalizer.normalize("日本 car"));
  }

  @Test
  void testNormalizeHandlesEmptyInput() {
    assertEquals("", NameNormalizer.normalize(""));
    assertEquals("", NameNormalizer.normalize(null));
  }

  @ParameterizedTest
  @ValueSource(strings = {"AbcéÅäö-- !", "Straße", "Big Car", "naïve café", "x-ray 3D", "日本"})
  void testNormalizeIsIdempotent(String name) {
    String normalized = NameNormalizer.normalize(name);

    assertEquals(normalized, NameNormalizer.normalize(normalized));
  }

  @Test
  void testTokenizeSplitsOnNonLetters() {
    assertThat(NameNormalizer.tokenize("uafygwe#;3! (iuf) hui :)"))
        .containsExactly("uafygwe", "iuf", "hui");
  }

  @Test
  void testTokenizeReturnsNoTokensForPunctuation() {
    assertThat(NameNormalizer.tokenize(" !")).isEmpty();
    assertThat(NameNormalizer.tokenize("")).isEmpty();
  }

  @Test
  void testTokenizeAfterNormalize() {
    assertThat(NameNormalizer.tokenize(NameNormalizer.normalize("Medium-sized Car (EU)")))
        .containsExactly("mediumsized", "car", "eu");
  }

  @Test
  void testTokenizeKeepsLongWordsWhole() {
    String longWord = "a".repeat(300);

    assertThat(NameNormalizer.tokenize(longWord + " car")).containsExactly(longWord, "car");
  }
}
