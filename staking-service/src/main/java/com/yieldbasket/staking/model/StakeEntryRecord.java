package com.yieldbasket.staking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One owner's position. Rows are never deleted; a full unstake leaves principal at zero.
 * accumulatorSnapshot is a decimal string, like the pool accumulator.
 */
@Data
@NoArgsConstructor
@Table("stake_entry")
public class StakeEntryRecord {

    @Id
    private Long id;

    private String owner;

    private long principal;

    private long weightedStake;

    private int multiplierBps;

    private LocalDateTime stakeStart;

    private String accumulatorSnapshot;

    private long unclaimedReward;

    private LocalDateTime lastInteraction;
}
