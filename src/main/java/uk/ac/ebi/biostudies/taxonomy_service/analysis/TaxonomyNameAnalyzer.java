package uk.ac.ebi.biostudies.taxonomy_service.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LetterTokenizer;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.TokenStream;

/**
 * Splits taxonomy names into words on every non-letter character.
 *
 * <p>Expects text already reduced to lowercase ASCII by {@link NameNormalizer}, so no filters
 * follow the tokenizer. Words are never cut at a length limit.
 */
public final class TaxonomyNameAnalyzer extends Analyzer {

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    Tokenizer source =
        new LetterTokenizer(
            TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY,
            StandardTokenizer.MAX_TOKEN_LENGTH_LIMIT);
    return new TokenStreamComponents(source);
  }
}
