package com.coverwise.insurance.entity;

import com.coverwise.insurance.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Payout record for an approved claim. Disbursement itself happens outside the engine.
 */
@Entity
@Table(name = "claim_settlements", indexes = {
    @Index(name = "idx_settlement_claim", columnList = "claim_id"),
    @Index(name = "idx_settlement_status", columnList = "status")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClaimSettlement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "claim_id", nullable = false, updatable = false)
    private Claim claim;

    @Column(name = "settlement_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal settlementAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "settlement_method", nullable = false, length = 20)
    private SettlementMethod settlementMethod;

    @Column(name = "bank_account_number", length = 34)
    private String bankAccountNumber;

    @Column(name = "bank_name")
    private String bankName;

    @Column(name = "ifsc_code", length = 11)
    private String ifscCode;

    @Column(name = "account_holder_name")
    private String accountHolderName;

    @Column(name = "approved_by", nullable = false, updatable = false)
    private String approvedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "transaction_reference", length = 100)
    private String transactionReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public void markProcessed(String transactionReference, LocalDateTime at) {
        if (status != SettlementStatus.PENDING) {
            throw new InvalidStateException("Settlement", status.name(), SettlementStatus.PENDING.name());
        }
        this.status = SettlementStatus.PROCESSED;
        this.transactionReference = transactionReference;
        this.processedAt = at;
    }

    public enum SettlementMethod {
        BANK_TRANSFER,
        CHEQUE,
        UPI
    }

    public enum SettlementStatus {
        PENDING,
        PROCESSED,
        FAILED
    }
}
