package com.yieldbasket.staking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** One accepted reward deposit, unique by reference. */
@Data
@NoArgsConstructor
@Table("reward_deposit")
public class RewardDepositRecord {

    @Id
    private Long id;

    private String reference;

    private long amountRaw;

    private long creditedRaw;

    private long dustRaw;

    private String accumulatorAfter;

    private LocalDateTime depositedAt;
}
