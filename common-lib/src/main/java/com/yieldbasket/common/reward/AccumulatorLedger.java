package com.yieldbasket.common.reward;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Pure state transitions of the reward distributor.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Every entry-touching operation first settles pending reward at the entry's
 *       <em>stored</em> weighted stake against the current accumulator, then refreshes the
 *       time multiplier and moves the pool total by the weighted-stake delta.</li>
 *   <li>{@code depositReward} adds {@code floor(amount * PRECISION / totalWeighted)} to the
 *       accumulator; the floored remainder is recorded as retained dust.</li>
 *   <li>Pending reward is {@code weighted * (acc - snapshot) / PRECISION}, O(1) per entry.</li>
 * </ol>
 *
 * <p>Nothing here mutates its inputs. Any exception leaves the caller's state untouched.
 */
public final class AccumulatorLedger {

    private AccumulatorLedger() {}

    public static LedgerUpdate stake(StakePoolState pool, StakeEntryState entry, String owner,
                                     long amount, Instant now) {
        if (amount <= 0) {
            throw new IllegalArgumentException("stake amount must be positive, got " + amount);
        }
        StakeEntryState current = entry != null ? entry : StakeEntryState.fresh(owner, pool.accumulator(), now);
        Settled settled = settleAndRefresh(pool, current, now);

        StakeEntryState e = settled.entry();
        long principal = RewardMath.addExact(e.principal(), amount);
        Instant start = e.principal() == 0 || e.stakeStart() == null
            ? now
            : weightedStart(e.stakeStart(), e.principal(), now, amount);
        int bps = RewardTier.forStakeAge(Duration.between(start, now)).multiplierBps();
        long weighted = RewardMath.weightedStake(principal, bps);

        StakePoolState p = settled.pool();
        StakePoolState nextPool = new StakePoolState(
            RewardMath.addExact(p.totalPrincipal(), amount),
            RewardMath.addExact(p.totalWeightedStake(), weighted - e.weightedStake()),
            p.accumulator(), p.totalDeposited(), p.retainedDust(), now);
        StakeEntryState nextEntry = new StakeEntryState(
            e.owner(), principal, weighted, bps, start, p.accumulator(), e.unclaimedReward(), now);
        return new LedgerUpdate(nextPool, nextEntry, 0L, 0L);
    }

    public static LedgerUpdate unstake(StakePoolState pool, StakeEntryState entry, long amount, Instant now) {
        if (amount <= 0) {
            throw new IllegalArgumentException("unstake amount must be positive, got " + amount);
        }
        if (entry == null || amount > entry.principal()) {
            throw new IllegalArgumentException("unstake " + amount + " exceeds staked principal "
                + (entry == null ? 0 : entry.principal()));
        }
        Settled settled = settleAndRefresh(pool, entry, now);

        StakeEntryState e = settled.entry();
        long principal = e.principal() - amount;
        long weighted = principal == 0 ? 0L : RewardMath.weightedStake(principal, e.multiplierBps());
        Instant start = principal == 0 ? null : e.stakeStart();
        int bps = principal == 0 ? RewardTier.BASE.multiplierBps() : e.multiplierBps();

        StakePoolState p = settled.pool();
        StakePoolState nextPool = new StakePoolState(
            p.totalPrincipal() - amount,
            p.totalWeightedStake() - (e.weightedStake() - weighted),
            p.accumulator(), p.totalDeposited(), p.retainedDust(), now);
        StakeEntryState nextEntry = new StakeEntryState(
            e.owner(), principal, weighted, bps, start, p.accumulator(), e.unclaimedReward(), now);
        return new LedgerUpdate(nextPool, nextEntry, 0L, amount);
    }

    public static LedgerUpdate claim(StakePoolState pool, StakeEntryState entry, Instant now) {
        if (entry == null) {
            throw new IllegalArgumentException("no stake entry to claim from");
        }
        Settled settled = settleAndRefresh(pool, entry, now);
        StakeEntryState e = settled.entry();
        StakeEntryState nextEntry = new StakeEntryState(
            e.owner(), e.principal(), e.weightedStake(), e.multiplierBps(), e.stakeStart(),
            e.accumulatorSnapshot(), 0L, now);
        return new LedgerUpdate(settled.pool(), nextEntry, e.unclaimedReward(), 0L);
    }

    public static StakePoolState depositReward(StakePoolState pool, long amount, Instant now) {
        BigInteger increment = RewardMath.accumulatorIncrement(amount, pool.totalWeightedStake());
        BigInteger next = RewardMath.checkedAdd(pool.accumulator(), increment);
        long distributable = RewardMath.distributed(increment, pool.totalWeightedStake());
        long dust = amount - distributable;
        return new StakePoolState(
            pool.totalPrincipal(), pool.totalWeightedStake(), next,
            RewardMath.addExact(pool.totalDeposited(), amount),
            RewardMath.addExact(pool.retainedDust(), dust), now);
    }

    /** Reward owed to the entry right now, without changing anything. */
    public static long pendingReward(StakePoolState pool, StakeEntryState entry) {
        return RewardMath.addExact(entry.unclaimedReward(),
            RewardMath.pending(entry.weightedStake(), pool.accumulator(), entry.accumulatorSnapshot()));
    }

    private record Settled(StakePoolState pool, StakeEntryState entry) {}

    private static Settled settleAndRefresh(StakePoolState pool, StakeEntryState entry, Instant now) {
        long pending = RewardMath.pending(entry.weightedStake(), pool.accumulator(), entry.accumulatorSnapshot());
        long unclaimed = RewardMath.addExact(entry.unclaimedReward(), pending);

        int bps = entry.principal() == 0 || entry.stakeStart() == null
            ? entry.multiplierBps()
            : RewardTier.forStakeAge(Duration.between(entry.stakeStart(), now)).multiplierBps();
        long weighted = entry.principal() == 0 ? 0L : RewardMath.weightedStake(entry.principal(), bps);
        long delta = weighted - entry.weightedStake();

        StakePoolState nextPool = delta == 0 ? pool : new StakePoolState(
            pool.totalPrincipal(), RewardMath.addExact(pool.totalWeightedStake(), delta),
            pool.accumulator(), pool.totalDeposited(), pool.retainedDust(), now);
        StakeEntryState nextEntry = new StakeEntryState(
            entry.owner(), entry.principal(), weighted, bps, entry.stakeStart(),
            pool.accumulator(), unclaimed, now);
        return new Settled(nextPool, nextEntry);
    }

    /** Principal-weighted average of the old start and now. */
    static Instant weightedStart(Instant oldStart, long oldPrincipal, Instant now, long added) {
        BigInteger total = BigInteger.valueOf(oldPrincipal).add(BigInteger.valueOf(added));
        BigInteger epoch = BigInteger.valueOf(oldStart.getEpochSecond()).multiply(BigInteger.valueOf(oldPrincipal))
            .add(BigInteger.valueOf(now.getEpochSecond()).multiply(BigInteger.valueOf(added)))
            .divide(total);
        return Instant.ofEpochSecond(epoch.longValueExact());
    }
}
