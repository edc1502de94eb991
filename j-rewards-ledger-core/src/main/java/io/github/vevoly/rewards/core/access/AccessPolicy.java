package io.github.vevoly.rewards.core.access;

import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.exception.UnauthorizedException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.state.StateJournal;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static io.github.vevoly.rewards.core.LedgerChecks.requireIdentity;

/**
 * <h3>权限策略 (Access Policy)</h3>
 *
 * <p>
 * 两种能力：<b>管理员</b> (注册表与特权接收人管理、能力转移) 与 <b>收获方</b> (向奖励仓存入)。
 * 两者都保存在 {@link RewardsState} 中，随快照持久化。权限校验先于参数校验。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Access Policy.</b><br>
 * Two capabilities: the <b>administrator</b> (registry, privileged recipients, capability transfer) and the
 * <b>harvester</b> (silo deposits). Both live in {@link RewardsState} and are snapshotted with it.
 * Authorization is checked before argument validation.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class AccessPolicy {

    private final RewardsState state;
    private final StateJournal journal;

    public AccessPolicy(RewardsState state, StateJournal journal) {
        this.state = state;
        this.journal = journal;
    }

    public void requireAdministrator(Address caller) throws UnauthorizedException {
        if (Address.isNull(caller) || !caller.equals(state.getAdministrator())) {
            throw new UnauthorizedException("Caller " + caller + " is not the administrator");
        }
    }

    public void requireHarvester(Address caller) throws UnauthorizedException {
        if (Address.isNull(caller) || !caller.equals(state.getHarvester())) {
            throw new UnauthorizedException("Caller " + caller + " is not the harvester");
        }
    }

    public void setHarvester(Address caller, Address harvester) throws RewardsLedgerException {
        requireAdministrator(caller);
        requireIdentity(harvester, "harvester");
        Address previous = state.getHarvester();
        journal.record(() -> state.setHarvester(previous));
        state.setHarvester(harvester);
        log.info("Harvester changed: {} -> {}", previous, harvester);
    }

    public void transferAdministration(Address caller, Address newAdministrator) throws RewardsLedgerException {
        requireAdministrator(caller);
        requireIdentity(newAdministrator, "newAdministrator");
        Address previous = state.getAdministrator();
        if (Objects.equals(previous, newAdministrator)) {
            return;
        }
        journal.record(() -> state.setAdministrator(previous));
        state.setAdministrator(newAdministrator);
        log.info("Administration transferred: {} -> {}", previous, newAdministrator);
    }

    public Address administrator() {
        return state.getAdministrator();
    }

    public Address harvester() {
        return state.getHarvester();
    }
}
