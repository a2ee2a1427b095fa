package com.yieldbasket.staking.service;

import com.yieldbasket.common.reward.AccumulatorLedger;
import com.yieldbasket.common.reward.RewardTier;
import com.yieldbasket.common.reward.StakeEntryState;
import com.yieldbasket.common.reward.StakePoolState;
import com.yieldbasket.staking.exception.StakeEntryNotFoundException;
import com.yieldbasket.staking.model.EntryView;
import com.yieldbasket.staking.model.PoolStats;
import com.yieldbasket.staking.model.StakePoolRecord;
import com.yieldbasket.staking.model.TierView;
import com.yieldbasket.staking.repository.RewardDepositRepository;
import com.yieldbasket.staking.repository.StakeEntryRepository;
import com.yieldbasket.staking.repository.StakePoolRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Read side. Not serialized with mutations; values may trail an in-flight command. */
@Service
public class StakingQueryService {

    static final Duration APY_WINDOW = Duration.ofDays(30);

    private final StakePoolRepository poolRepository;
    private final StakeEntryRepository entryRepository;
    private final RewardDepositRepository depositRepository;
    private final Clock clock;

    public StakingQueryService(StakePoolRepository poolRepository,
                               StakeEntryRepository entryRepository,
                               RewardDepositRepository depositRepository,
                               Clock clock) {
        this.poolRepository    = poolRepository;
        this.entryRepository   = entryRepository;
        this.depositRepository = depositRepository;
        this.clock             = clock;
    }

    public Mono<PoolStats> pool() {
        Instant now = clock.instant();
        return Mono.zip(
                poolRepository.findById(StakePoolRecord.POOL_ID),
                entryRepository.countByPrincipalGreaterThan(0L),
                depositRepository.sumAmountSince(LedgerRecords.toLocal(now.minus(APY_WINDOW))).defaultIfEmpty(0L))
            .map(t -> {
                StakePoolState pool = LedgerRecords.toState(t.getT1());
                long recent = t.getT3();
                return new PoolStats(pool.totalPrincipal(), pool.totalWeightedStake(), t.getT2(),
                    pool.accumulator().toString(), pool.totalDeposited(), pool.retainedDust(), recent,
                    estimatedApy(recent, pool.totalPrincipal()), pool.lastUpdate());
            });
    }

    public Mono<EntryView> entry(String owner) {
        Instant now = clock.instant();
        return Mono.zip(poolRepository.findById(StakePoolRecord.POOL_ID), entryRepository.findByOwner(owner))
            .switchIfEmpty(Mono.error(new StakeEntryNotFoundException(owner)))
            .map(t -> {
                StakePoolState pool = LedgerRecords.toState(t.getT1());
                StakeEntryState entry = LedgerRecords.toState(t.getT2());
                long days = entry.stakeStart() == null ? 0 : Duration.between(entry.stakeStart(), now).toDays();
                RewardTier tier = entry.isActive() ? RewardTier.forStakeDays(days) : RewardTier.BASE;
                return new EntryView(entry.owner(), entry.principal(), entry.weightedStake(), tier.multiplier(),
                    tier.displayName(), days, entry.isActive() ? RewardTier.daysToNextTier(days) : null,
                    AccumulatorLedger.pendingReward(pool, entry), entry.stakeStart(), entry.lastInteraction());
            });
    }

    public List<TierView> tiers() {
        return Arrays.stream(RewardTier.values()).map(TierView::of).collect(Collectors.toList());
    }

    /** Last-window deposits annualised over principal. */
    static double estimatedApy(long depositsInWindow, long totalPrincipal) {
        if (totalPrincipal <= 0) return 0.0;
        return (double) depositsInWindow / totalPrincipal * (365.0 / APY_WINDOW.toDays());
    }
}
