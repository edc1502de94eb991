package io.github.vevoly.rewards.api.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serial;
import java.io.Serializable;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <h3>账户身份 (Account Identity)</h3>
 *
 * <p>
 * 生产代币、奖励代币、持有人、接收人、包装合约和管理员都用同一种 20 字节身份表示，
 * 形如 {@code 0x} 加 40 位十六进制字符，统一转为小写。
 * {@link #ZERO} 为空身份，任何要求身份的操作遇到它都会以 {@code NULL_IDENTITY} 失败。
 * </p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Account Identity.</b><br>
 * Producer tokens, reward tokens, holders, recipients, wrappers and the administrator share one 20-byte identity,
 * written as {@code 0x} followed by 40 hex characters and normalized to lower case.
 * {@link #ZERO} is the null identity.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Address implements Serializable, Comparable<Address> {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Pattern HEX_40 = Pattern.compile("^0x[0-9a-f]{40}$");

    /**
     * 空身份 (Null Identity).
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    private final String value;

    /**
     * 解析地址 (Parse Address).
     *
     * @param text 十六进制地址，大小写不敏感 (Hex address, case-insensitive)
     * @return 规范化后的地址 (Normalized address)
     * @throws IllegalArgumentException 格式不合法时 (When malformed)
     */
    public static Address of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Address text must not be null");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (!HEX_40.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Malformed address: " + text);
        }
        return ZERO.value.equals(normalized) ? ZERO : new Address(normalized);
    }

    /**
     * 判断是否为空身份。Java {@code null} 同样视为空身份。
     * <br><span style="color: gray;">True for {@link #ZERO} and for a Java {@code null}.</span>
     */
    public static boolean isNull(Address address) {
        return address == null || ZERO.equals(address);
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
