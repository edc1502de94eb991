package io.github.vevoly.rewards.core.support;

import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.core.RewardsDistributor;

import java.util.HashSet;
import java.util.Set;

import static io.github.vevoly.rewards.core.support.TestAddresses.ADMIN;
import static io.github.vevoly.rewards.core.support.TestAddresses.HARVESTER;

/**
 * Distributor wired to in-memory collaborators, administered by {@link TestAddresses#ADMIN}.
 */
public class RewardsFixture {

    public final MutableClock clock = new MutableClock(0);
    public final InMemoryBalanceLedger ledger = new InMemoryBalanceLedger();
    public final StubHarvestSource harvestSource = new StubHarvestSource();
    public final RecordingTransfer transfer = new RecordingTransfer();
    public final Set<Address> contracts = new HashSet<>();
    public final RewardsDistributor distributor;

    public RewardsFixture() throws RewardsLedgerException {
        this.distributor = RewardsDistributor.builder()
                .administrator(ADMIN)
                .harvester(HARVESTER)
                .balanceLedger(ledger)
                .harvestSource(harvestSource)
                .rewardTransfer(transfer)
                .contractInspector(contracts::contains)
                .clock(clock)
                .build();
        ledger.attach(distributor);
    }

    public void deposit(Address producer, Address reward, long amount) throws RewardsLedgerException {
        distributor.rewardAccrue(HARVESTER, producer, reward, amount);
    }
}
