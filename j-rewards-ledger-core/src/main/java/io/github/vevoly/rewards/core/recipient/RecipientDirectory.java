package io.github.vevoly.rewards.core.recipient;

import io.github.vevoly.rewards.api.exception.NotContractException;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.spi.ContractInspector;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.state.RouteKey;
import io.github.vevoly.rewards.core.state.StateJournal;

import java.util.Optional;

import static io.github.vevoly.rewards.core.LedgerChecks.requireIdentity;

/**
 * <h3>接收人目录 (Recipient Directory)</h3>
 *
 * <p>领取时奖励的去向按以下顺序解析 (Resolution order on claim)：</p>
 * <ol>
 *     <li>以账户为键的特权接收人 (由管理员为包装合约设置)<br>
 *     <span style="color: gray;">privileged recipient keyed by the account (set by the administrator for wrappers)</span></li>
 *     <li>账户自己设置的个人接收人<br>
 *     <span style="color: gray;">personal recipient set by the account itself</span></li>
 *     <li>账户本身<br>
 *     <span style="color: gray;">the account itself</span></li>
 * </ol>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class RecipientDirectory {

    private final RewardsState state;
    private final StateJournal journal;
    private final ContractInspector contractInspector;

    public RecipientDirectory(RewardsState state, StateJournal journal, ContractInspector contractInspector) {
        this.state = state;
        this.journal = journal;
        this.contractInspector = contractInspector;
    }

    public void setPersonal(Address holder, Address producerToken, Address rewardToken, Address recipient)
            throws RewardsLedgerException {
        RouteKey key = route(holder, producerToken, rewardToken);
        requireIdentity(recipient, "recipient");
        journal.put(state.getPersonalRecipients(), key, recipient);
    }

    public void unsetPersonal(Address holder, Address producerToken, Address rewardToken) throws RewardsLedgerException {
        journal.remove(state.getPersonalRecipients(), route(holder, producerToken, rewardToken));
    }

    public void setPrivileged(Address wrapper, Address producerToken, Address rewardToken, Address recipient)
            throws RewardsLedgerException {
        RouteKey key = route(wrapper, producerToken, rewardToken);
        requireIdentity(recipient, "recipient");
        requireContract(wrapper);
        journal.put(state.getPrivilegedRecipients(), key, recipient);
    }

    public void unsetPrivileged(Address wrapper, Address producerToken, Address rewardToken) throws RewardsLedgerException {
        RouteKey key = route(wrapper, producerToken, rewardToken);
        requireContract(wrapper);
        journal.remove(state.getPrivilegedRecipients(), key);
    }

    public Address resolve(Address account, Address producerToken, Address rewardToken) {
        RouteKey key = new RouteKey(account, producerToken, rewardToken);
        Address privileged = state.getPrivilegedRecipients().get(key);
        if (privileged != null) {
            return privileged;
        }
        return state.getPersonalRecipients().getOrDefault(key, account);
    }

    public Optional<Address> personal(Address holder, Address producerToken, Address rewardToken) {
        return Optional.ofNullable(state.getPersonalRecipients().get(new RouteKey(holder, producerToken, rewardToken)));
    }

    public Optional<Address> privileged(Address wrapper, Address producerToken, Address rewardToken) {
        return Optional.ofNullable(state.getPrivilegedRecipients().get(new RouteKey(wrapper, producerToken, rewardToken)));
    }

    private static RouteKey route(Address account, Address producerToken, Address rewardToken) throws RewardsLedgerException {
        requireIdentity(account, "account");
        requireIdentity(producerToken, "producerToken");
        requireIdentity(rewardToken, "rewardToken");
        return new RouteKey(account, producerToken, rewardToken);
    }

    private void requireContract(Address wrapper) throws RewardsLedgerException {
        boolean contract;
        try {
            contract = contractInspector.isContract(wrapper);
        } catch (RuntimeException e) {
            throw new RewardsLedgerException(RewardsErrorCode.DELIVERY_FAILED,
                    "isContract(" + wrapper + ") failed: " + e.getMessage(), e);
        }
        if (!contract) {
            throw new NotContractException("Wrapper " + wrapper + " has no deployed code");
        }
    }
}
