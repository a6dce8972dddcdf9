package com.coverwise.insurance.entity;

import com.coverwise.insurance.entity.Quote.QuoteStatus;
import com.coverwise.insurance.exception.InvalidStateException;
import com.coverwise.insurance.exception.QuoteExpiredException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static com.coverwise.insurance.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuoteTest {

    private static Quote quote(QuoteStatus status, LocalDateTime expiryAt) {
        return Quote.builder()
                .quoteNumber("QT-20260315-0A1B2C3D")
                .status(status)
                .totalPremium(new BigDecimal("7198.00"))
                .generatedAt(expiryAt.minusDays(30))
                .expiryAt(expiryAt)
                .validityDays(30)
                .build();
    }

    @Test
    void shouldAcceptOpenQuoteBeforeExpiry() {
        Quote quote = quote(QuoteStatus.GENERATED, NOW.plusDays(1));

        quote.accept(NOW);

        assertThat(quote.getStatus()).isEqualTo(QuoteStatus.ACCEPTED);
        assertThat(quote.getAcceptedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldRefuseExpiredQuoteEvenIfAlreadyDecided() {
        Quote expiredOpen = quote(QuoteStatus.GENERATED, NOW.minusSeconds(1));
        Quote expiredRejected = quote(QuoteStatus.REJECTED, NOW.minusDays(1));

        assertThatThrownBy(() -> expiredOpen.accept(NOW))
                .isInstanceOf(QuoteExpiredException.class)
                .hasFieldOrPropertyWithValue("errorCode", "QUOTE_EXPIRED");
        assertThatThrownBy(() -> expiredRejected.accept(NOW))
                .isInstanceOf(QuoteExpiredException.class);
        assertThat(expiredOpen.getStatus()).isEqualTo(QuoteStatus.GENERATED);
    }

    @Test
    void shouldTreatExpiryInstantAsExpired() {
        Quote quote = quote(QuoteStatus.GENERATED, NOW);

        assertThat(quote.isExpiredAt(NOW)).isTrue();
        assertThatThrownBy(() -> quote.accept(NOW)).isInstanceOf(QuoteExpiredException.class);
    }

    @Test
    void shouldOnlyAcceptGeneratedQuotes() {
        Quote accepted = quote(QuoteStatus.ACCEPTED, NOW.plusDays(5));
        Quote sent = quote(QuoteStatus.SENT, NOW.plusDays(5));

        assertThatThrownBy(() -> accepted.accept(NOW)).isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> sent.accept(NOW)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void shouldRejectGeneratedQuote() {
        Quote quote = quote(QuoteStatus.GENERATED, NOW.plusDays(5));

        quote.reject(NOW);

        assertThat(quote.getStatus()).isEqualTo(QuoteStatus.REJECTED);
        assertThat(quote.getRejectedAt()).isEqualTo(NOW);
        assertThatThrownBy(() -> quote.accept(NOW)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void effectiveStatusShouldDeriveExpiryForOpenQuotesOnly() {
        assertThat(quote(QuoteStatus.GENERATED, NOW.minusDays(1)).effectiveStatus(NOW)).isEqualTo(QuoteStatus.EXPIRED);
        assertThat(quote(QuoteStatus.SENT, NOW.minusDays(1)).effectiveStatus(NOW)).isEqualTo(QuoteStatus.EXPIRED);
        assertThat(quote(QuoteStatus.ACCEPTED, NOW.minusDays(1)).effectiveStatus(NOW)).isEqualTo(QuoteStatus.ACCEPTED);
        assertThat(quote(QuoteStatus.GENERATED, NOW.plusDays(1)).effectiveStatus(NOW)).isEqualTo(QuoteStatus.GENERATED);
    }
}
