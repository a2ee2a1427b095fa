package com.yieldbasket.settlement.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One cross-chain transfer of accumulated fees into the reward pool.
 *
 * Artifacts, each written in the same row update as the state that produced it:
 *   lockRef                → SOURCE_LOCKED
 *   messageHash            → SOURCE_CONFIRMED
 *   attestationRequestedAt → ATTESTATION_PENDING
 *   attestation            → ATTESTATION_RECEIVED
 *   mintRef                → DEST_MINTED
 *   depositRef             → DEPOSITED
 *
 * A FAILED job keeps every artifact it had; failedStep names the state it could not leave.
 */
@Data
@NoArgsConstructor
@Table("bridge_job")
public class BridgeJob {

    @Id
    private Long id;

    /** Raw 6-decimal units. */
    private long amountRaw;

    private BridgeState state;

    private String lockRef;

    private String messageHash;

    private LocalDateTime attestationRequestedAt;

    private String attestation;

    private String mintRef;

    private String depositRef;

    private Long netDepositedRaw;

    private String error;

    private String failedStep;

    private int retryCount;

    private String triggerReason;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
