package com.yieldbasket.staking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * The single reward pool row (id 1, seeded by schema.sql).
 *
 * accumulator is the 128-bit fixed-point reward-per-weighted-unit as a decimal string.
 * Amounts are raw 6-decimal units.
 */
@Data
@NoArgsConstructor
@Table("stake_pool")
public class StakePoolRecord {

    public static final long POOL_ID = 1L;

    @Id
    private Long id;

    private long totalPrincipal;

    private long totalWeightedStake;

    private String accumulator;

    private long totalDeposited;

    private long retainedDust;

    private LocalDateTime lastUpdate;
}
