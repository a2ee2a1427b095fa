package com.yieldbasket.common.reward;

import com.yieldbasket.common.exception.AccumulatorOverflowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AccumulatorLedgerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final long ONE = 1_000_000L;

    // ── accumulator property ────────────────────────────────────────────────

    @Nested
    @DisplayName("conservation")
    class Conservation {

        @Test
        @DisplayName("pending rewards sum to deposits minus bounded truncation while weight is constant")
        void depositsAreConserved() {
            Random random = new Random(7);
            StakePoolState pool = StakePoolState.empty(T0);
            List<StakeEntryState> entries = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                LedgerUpdate u = AccumulatorLedger.stake(pool, null, "p" + i, 1 + random.nextInt(5_000) * ONE / 7, T0);
                pool = u.pool();
                entries.add(u.entry());
            }
            long expectedWeight = entries.stream().mapToLong(StakeEntryState::weightedStake).sum();
            assertEquals(expectedWeight, pool.totalWeightedStake());

            long deposited = 0;
            for (int i = 0; i < 40; i++) {
                long amount = 1 + random.nextInt(3_000_000);
                pool = AccumulatorLedger.depositReward(pool, amount, T0.plusSeconds(i));
                deposited += amount;
            }
            final StakePoolState finalPool = pool;
            long paid = entries.stream().mapToLong(e -> AccumulatorLedger.pendingReward(finalPool, e)).sum();

            assertThat(paid).isLessThanOrEqualTo(deposited);
            assertThat(deposited - paid).isLessThanOrEqualTo(finalPool.retainedDust() + entries.size());
            assertEquals(deposited, finalPool.totalDeposited());
        }

        @Test
        @DisplayName("deposit with no weighted stake is refused")
        void depositWithoutStake() {
            assertThrows(IllegalStateException.class,
                () -> AccumulatorLedger.depositReward(StakePoolState.empty(T0), ONE, T0));
        }
    }

    // ── settle-before-change ────────────────────────────────────────────────

    @Nested
    @DisplayName("stake / unstake / claim")
    class EntryOperations {

        @Test
        @DisplayName("restaking settles reward earned under the old weight first")
        void restakeSettlesFirst() {
            LedgerUpdate a = AccumulatorLedger.stake(StakePoolState.empty(T0), null, "alice", 100 * ONE, T0);
            StakePoolState pool = AccumulatorLedger.depositReward(a.pool(), 10 * ONE, T0.plusSeconds(60));

            LedgerUpdate again = AccumulatorLedger.stake(pool, a.entry(), "alice", 100 * ONE, T0.plusSeconds(120));

            assertEquals(10 * ONE, again.entry().unclaimedReward());
            assertEquals(200 * ONE, again.entry().principal());
            assertEquals(again.pool().accumulator(), again.entry().accumulatorSnapshot());
        }

        @Test
        @DisplayName("two equal stakers split a deposit equally")
        void proportional() {
            LedgerUpdate a = AccumulatorLedger.stake(StakePoolState.empty(T0), null, "alice", 50 * ONE, T0);
            LedgerUpdate b = AccumulatorLedger.stake(a.pool(), null, "bob", 50 * ONE, T0);
            StakePoolState pool = AccumulatorLedger.depositReward(b.pool(), 9 * ONE, T0);

            assertEquals(AccumulatorLedger.pendingReward(pool, a.entry()), AccumulatorLedger.pendingReward(pool, b.entry()));
            assertEquals(4_500_000L, AccumulatorLedger.pendingReward(pool, a.entry()));
        }

        @Test
        @DisplayName("full unstake zeroes the entry, keeps its unclaimed reward and moves the pool by the delta")
        void fullUnstake() {
            LedgerUpdate a = AccumulatorLedger.stake(StakePoolState.empty(T0), null, "alice", 40 * ONE, T0);
            LedgerUpdate b = AccumulatorLedger.stake(a.pool(), null, "bob", 60 * ONE, T0);
            StakePoolState pool = AccumulatorLedger.depositReward(b.pool(), 10 * ONE, T0);

            LedgerUpdate out = AccumulatorLedger.unstake(pool, a.entry(), 40 * ONE, T0.plusSeconds(1));

            assertEquals(0L, out.entry().principal());
            assertEquals(0L, out.entry().weightedStake());
            assertEquals(4 * ONE, out.entry().unclaimedReward());
            assertEquals(40 * ONE, out.principalReturned());
            assertEquals(b.entry().weightedStake(), out.pool().totalWeightedStake());

            LedgerUpdate claimed = AccumulatorLedger.claim(out.pool(), out.entry(), T0.plusSeconds(2));
            assertEquals(4 * ONE, claimed.rewardPaid());
            assertEquals(0L, claimed.entry().unclaimedReward());
        }

        @Test
        @DisplayName("unstaking more than the principal is rejected")
        void overUnstake() {
            LedgerUpdate a = AccumulatorLedger.stake(StakePoolState.empty(T0), null, "alice", ONE, T0);
            assertThrows(IllegalArgumentException.class,
                () -> AccumulatorLedger.unstake(a.pool(), a.entry(), 2 * ONE, T0));
        }
    }

    // ── tiers ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("time multiplier")
    class Tiers {

        @Test
        @DisplayName("tier boundaries at 30 and 90 days")
        void boundaries() {
            assertEquals(RewardTier.BASE, RewardTier.forStakeDays(29));
            assertEquals(RewardTier.SILVER, RewardTier.forStakeDays(30));
            assertEquals(RewardTier.GOLD, RewardTier.forStakeDays(90));
            assertEquals(1, RewardTier.daysToNextTier(29));
            assertEquals(60, RewardTier.daysToNextTier(30));
            assertNull(RewardTier.daysToNextTier(400));
        }

        @Test
        @DisplayName("multiplier is refreshed lazily on interaction and the pool total follows")
        void lazyRefresh() {
            LedgerUpdate a = AccumulatorLedger.stake(StakePoolState.empty(T0), null, "alice", 100 * ONE, T0);
            assertEquals(100 * ONE, a.entry().weightedStake());

            Instant later = T0.plus(Duration.ofDays(31));
            LedgerUpdate claimed = AccumulatorLedger.claim(a.pool(), a.entry(), later);

            assertEquals(125 * ONE, claimed.entry().weightedStake());
            assertEquals(125 * ONE, claimed.pool().totalWeightedStake());
        }

        @Test
        @DisplayName("topping up moves the start to the principal-weighted average")
        void weightedStart() {
            Instant start = AccumulatorLedger.weightedStart(T0, 100, T0.plus(Duration.ofDays(100)), 100);
            assertEquals(T0.plus(Duration.ofDays(50)), start);
        }
    }

    // ── overflow ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("accumulator overflow is a hard failure")
    void overflow() {
        StakePoolState nearCeiling = new StakePoolState(1, 1, RewardMath.MAX_ACCUMULATOR.subtract(BigInteger.TEN), 0, 0, T0);
        assertThrows(AccumulatorOverflowException.class,
            () -> AccumulatorLedger.depositReward(nearCeiling, ONE, T0));
    }
}
