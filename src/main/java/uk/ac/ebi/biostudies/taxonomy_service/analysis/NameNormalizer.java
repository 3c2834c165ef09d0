package uk.ac.ebi.biostudies.taxonomy_service.analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Normalization shared by indexed taxonomy names and search queries.
 *
 * <p>{@link #normalize(String)} transliterates accented characters to their ASCII equivalents,
 * lowercases, drops whatever has no ASCII equivalent and removes hyphens, so {@code "Ab-Cé"}
 * becomes {@code "abce"}. The result is a fixed point: normalizing it again returns it unchanged.
 * {@link #tokenize(String)} then splits the normalized text into words of letters.
 */
public final class NameNormalizer {

  private static final String FIELD = "name";
  private static final Analyzer ANALYZER = new TaxonomyNameAnalyzer();

  private NameNormalizer() {}

  public static String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    char[] input = text.toCharArray();
    // a single char can fold into up to four
    char[] folded = new char[input.length * 4];
    int length = ASCIIFoldingFilter.foldToASCII(input, 0, folded, 0, input.length);

    StringBuilder normalized = new StringBuilder(length);
    String lower = new String(folded, 0, length).toLowerCase(Locale.ROOT);
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      if (c < 128 && c != '-') {
        normalized.append(c);
      }
    }
    return normalized.toString();
  }

  /**
   * Splits already normalized text into words on every non-letter character.
   *
   * @return the words in order, never containing empty strings
   */
  public static List<String> tokenize(String normalized) {
    List<String> tokens = new ArrayList<>();
    if (normalized == null || normalized.isEmpty()) {
      return tokens;
    }
    try (TokenStream stream = ANALYZER.tokenStream(FIELD, normalized)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        tokens.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to tokenize '" + normalized + "'", e);
    }
    return tokens;
  }
}
