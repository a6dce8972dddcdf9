package com.coverwise.insurance.domain;

import com.coverwise.insurance.entity.Quote;
import com.coverwise.insurance.entity.QuoteRecommendation;

import java.util.List;

/**
 * @param quotes          every generated quote, best score first
 * @param recommendations the top quotes, rank 1 first
 */
public record QuoteGenerationResult(
    List<Quote> quotes,
    List<QuoteRecommendation> recommendations
) {
}
