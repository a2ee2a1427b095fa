package com.yieldbasket.staking.controller;

import com.yieldbasket.common.model.RewardDepositReceipt;
import com.yieldbasket.common.model.RewardDepositRequest;
import com.yieldbasket.staking.model.EntryView;
import com.yieldbasket.staking.model.PoolStats;
import com.yieldbasket.staking.model.StakingReceipt;
import com.yieldbasket.staking.model.StakingRequests;
import com.yieldbasket.staking.model.TierView;
import com.yieldbasket.staking.service.RewardDistributorService;
import com.yieldbasket.staking.service.StakingQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/staking")
public class StakingController {

    private static final Logger log = LoggerFactory.getLogger(StakingController.class);

    private final RewardDistributorService distributor;
    private final StakingQueryService queries;

    public StakingController(RewardDistributorService distributor, StakingQueryService queries) {
        this.distributor = distributor;
        this.queries     = queries;
    }

    @PostMapping("/stake")
    public Mono<StakingReceipt> stake(@RequestBody StakingRequests.Stake request) {
        log.info("Stake requested. owner={} amountRaw={}", request.owner(), request.amountRaw());
        return distributor.stake(request.owner(), request.amountRaw());
    }

    @PostMapping("/unstake")
    public Mono<StakingReceipt> unstake(@RequestBody StakingRequests.Unstake request) {
        log.info("Unstake requested. owner={} amountRaw={}", request.owner(), request.amountRaw());
        return distributor.unstake(request.owner(), request.amountRaw());
    }

    @PostMapping("/claim")
    public Mono<StakingReceipt> claim(@RequestBody StakingRequests.Claim request) {
        return distributor.claim(request.owner());
    }

    @PostMapping("/deposit")
    public Mono<RewardDepositReceipt> deposit(@RequestBody RewardDepositRequest request) {
        log.info("Reward deposit received. reference={} amountRaw={}", request.reference(), request.amountRaw());
        return distributor.deposit(request);
    }

    @GetMapping("/pool")
    public Mono<PoolStats> pool() {
        return queries.pool();
    }

    @GetMapping("/entries/{owner}")
    public Mono<EntryView> entry(@PathVariable String owner) {
        return queries.entry(owner);
    }

    @GetMapping("/tiers")
    public List<TierView> tiers() {
        return queries.tiers();
    }
}
