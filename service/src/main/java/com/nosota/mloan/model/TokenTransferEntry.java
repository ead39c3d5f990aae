package com.nosota.mloan.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Journal entry of a value movement executed by the local token transfer adapter.
 *
 * <p>Entries are immutable. Deposits appear as depositor → vault, withdrawals and
 * releases as vault → depositor, liquidations as vault → pool recipient.
 */
@Entity
@Table(name = "token_transfer")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TokenTransferEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "currency_code", nullable = false, length = 16)
    private String currencyCode;

    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "from_identity", nullable = false)
    private String fromIdentity;

    @Column(name = "to_identity", nullable = false)
    private String toIdentity;

    @Column(name = "height", nullable = false)
    private Long height;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
