package com.yieldbasket.staking.service;

import com.yieldbasket.common.reward.StakeEntryState;
import com.yieldbasket.common.reward.StakePoolState;
import com.yieldbasket.staking.model.StakeEntryRecord;
import com.yieldbasket.staking.model.StakePoolRecord;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/** Conversions between persisted rows and the ledger's immutable states. Timestamps are UTC. */
final class LedgerRecords {

    private LedgerRecords() {}

    static StakePoolState toState(StakePoolRecord record) {
        return new StakePoolState(record.getTotalPrincipal(), record.getTotalWeightedStake(),
            new BigInteger(record.getAccumulator()), record.getTotalDeposited(), record.getRetainedDust(),
            toInstant(record.getLastUpdate()));
    }

    /** Writes {@code state} onto {@code record}, keeping its id. */
    static StakePoolRecord apply(StakePoolRecord record, StakePoolState state) {
        record.setTotalPrincipal(state.totalPrincipal());
        record.setTotalWeightedStake(state.totalWeightedStake());
        record.setAccumulator(state.accumulator().toString());
        record.setTotalDeposited(state.totalDeposited());
        record.setRetainedDust(state.retainedDust());
        record.setLastUpdate(toLocal(state.lastUpdate()));
        return record;
    }

    static StakeEntryState toState(StakeEntryRecord record) {
        return new StakeEntryState(record.getOwner(), record.getPrincipal(), record.getWeightedStake(),
            record.getMultiplierBps(), toInstant(record.getStakeStart()),
            new BigInteger(record.getAccumulatorSnapshot()), record.getUnclaimedReward(),
            toInstant(record.getLastInteraction()));
    }

    static StakeEntryRecord apply(StakeEntryRecord record, StakeEntryState state) {
        record.setOwner(state.owner());
        record.setPrincipal(state.principal());
        record.setWeightedStake(state.weightedStake());
        record.setMultiplierBps(state.multiplierBps());
        record.setStakeStart(toLocal(state.stakeStart()));
        record.setAccumulatorSnapshot(state.accumulatorSnapshot().toString());
        record.setUnclaimedReward(state.unclaimedReward());
        record.setLastInteraction(toLocal(state.lastInteraction()));
        return record;
    }

    static Instant toInstant(LocalDateTime time) {
        return time != null ? time.toInstant(ZoneOffset.UTC) : null;
    }

    static LocalDateTime toLocal(Instant instant) {
        return instant != null ? LocalDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }
}
