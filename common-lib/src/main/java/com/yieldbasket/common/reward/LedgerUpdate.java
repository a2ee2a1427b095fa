package com.yieldbasket.common.reward;

/**
 * Result of one ledger operation.
 *
 * @param rewardPaid        reward released to the owner by a claim
 * @param principalReturned principal released by an unstake
 */
public record LedgerUpdate(StakePoolState pool, StakeEntryState entry, long rewardPaid, long principalReturned) {}
