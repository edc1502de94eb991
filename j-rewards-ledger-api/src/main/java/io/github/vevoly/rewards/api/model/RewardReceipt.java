package io.github.vevoly.rewards.api.model;

import io.github.vevoly.rewards.api.command.CommandType;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.openhft.chronicle.bytes.BytesIn;
import net.openhft.chronicle.bytes.BytesMarshallable;
import net.openhft.chronicle.bytes.BytesOut;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * <h3>命令回执 (Command Receipt)</h3>
 *
 * <p>
 * 每条成功提交的命令产生一张回执。回执会被追加到审计日志 (Chronicle Queue)，并交给异步写入器落库。
 * 实现 {@link BytesMarshallable}，直接按字段顺序读写二进制，跳过反射。
 * </p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Command Receipt.</b><br>
 * Produced for every committed command, appended to the audit journal and handed to the async writer.
 * Implements {@link BytesMarshallable} so Chronicle writes the fields directly in a fixed order.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
public class RewardReceipt implements BytesMarshallable, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private String txId;

    private CommandType type;

    /**
     * 处理时刻 (秒) / Processing time in epoch seconds.
     */
    private long timestamp;

    private Address caller;

    private Address producerToken;

    /**
     * 持有人、包装合约或新的能力持有人，视命令类型而定。
     * <br><span style="color: gray;">Holder, wrapper or new capability holder, depending on the command type.</span>
     */
    private Address account;

    private List<RewardMovement> movements = new ArrayList<>();

    public RewardReceipt(String txId, CommandType type, long timestamp, Address caller, Address producerToken, Address account) {
        this.txId = txId;
        this.type = type;
        this.timestamp = timestamp;
        this.caller = caller;
        this.producerToken = producerToken;
        this.account = account;
    }

    @Override
    public void writeMarshallable(BytesOut<?> bytes) {
        bytes.writeUtf8(txId);
        bytes.writeUtf8(type == null ? null : type.name());
        bytes.writeLong(timestamp);
        writeAddress(bytes, caller);
        writeAddress(bytes, producerToken);
        writeAddress(bytes, account);
        bytes.writeInt(movements.size());
        for (RewardMovement movement : movements) {
            writeAddress(bytes, movement.getProducerToken());
            writeAddress(bytes, movement.getRewardToken());
            writeAddress(bytes, movement.getCounterparty());
            bytes.writeLong(movement.getAmount());
        }
    }

    @Override
    public void readMarshallable(BytesIn<?> bytes) {
        // 读取顺序必须与写入顺序一致 / Must match the write order
        this.txId = bytes.readUtf8();
        String typeName = bytes.readUtf8();
        this.type = typeName == null ? null : CommandType.valueOf(typeName);
        this.timestamp = bytes.readLong();
        this.caller = readAddress(bytes);
        this.producerToken = readAddress(bytes);
        this.account = readAddress(bytes);
        int size = bytes.readInt();
        this.movements = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Address producer = readAddress(bytes);
            Address reward = readAddress(bytes);
            Address counterparty = readAddress(bytes);
            long amount = bytes.readLong();
            movements.add(new RewardMovement(producer, reward, counterparty, amount));
        }
    }

    private static void writeAddress(BytesOut<?> bytes, Address address) {
        bytes.writeUtf8(address == null ? null : address.getValue());
    }

    private static Address readAddress(BytesIn<?> bytes) {
        String value = bytes.readUtf8();
        return value == null ? null : Address.of(value);
    }
}
