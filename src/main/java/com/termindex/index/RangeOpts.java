package com.termindex.index;

import com.termindex.codec.TermMetadata;

import java.util.Arrays;

/**
 * 词项范围，上下界均可缺省，分别带包含/排除标记。
 *
 * @param lower 下界逻辑词项，null 表示无下界
 * @param upper 上界逻辑词项，null 表示无上界
 * @param includesLower 是否包含下界
 * @param includesUpper 是否包含上界
 */
public record RangeOpts(byte[] lower, byte[] upper, boolean includesLower, boolean includesUpper) {

    private static final RangeOpts UNBOUNDED = new RangeOpts(null, null, false, false);

    public RangeOpts {
        lower = lower == null ? null : Arrays.copyOf(lower, lower.length);
        upper = upper == null ? null : Arrays.copyOf(upper, upper.length);
    }

    public static RangeOpts unbounded() {
        return UNBOUNDED;
    }

    public static RangeOpts between(byte[] lower, boolean includesLower, byte[] upper, boolean includesUpper) {
        return new RangeOpts(lower, upper, includesLower, includesUpper);
    }

    public static RangeOpts atLeast(byte[] lower) {
        return new RangeOpts(lower, null, true, false);
    }

    public static RangeOpts greaterThan(byte[] lower) {
        return new RangeOpts(lower, null, false, false);
    }

    public static RangeOpts atMost(byte[] upper) {
        return new RangeOpts(null, upper, false, true);
    }

    public static RangeOpts lessThan(byte[] upper) {
        return new RangeOpts(null, upper, false, false);
    }

    public boolean hasLower() {
        return lower != null;
    }

    public boolean hasUpper() {
        return upper != null;
    }

    @Override
    public byte[] lower() {
        return lower == null ? null : Arrays.copyOf(lower, lower.length);
    }

    @Override
    public byte[] upper() {
        return upper == null ? null : Arrays.copyOf(upper, upper.length);
    }

    /**
     * 判断词项相对范围的位置。
     *
     * @return -1 表示低于下界（含等于被排除的下界），1 表示高于上界，0 表示在范围内
     */
    public int locate(int fieldId, byte[] term, TermMetadata termMetadata) {
        if (lower != null) {
            int compared = termMetadata.compare(fieldId, term, lower);
            if (compared < 0 || (compared == 0 && !includesLower)) {
                return -1;
            }
        }
        if (upper != null) {
            int compared = termMetadata.compare(fieldId, term, upper);
            if (compared > 0 || (compared == 0 && !includesUpper)) {
                return 1;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RangeOpts opts)) {
            return false;
        }
        return includesLower == opts.includesLower
            && includesUpper == opts.includesUpper
            && Arrays.equals(lower, opts.lower)
            && Arrays.equals(upper, opts.upper);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(lower);
        result = 31 * result + Arrays.hashCode(upper);
        result = 31 * result + Boolean.hashCode(includesLower);
        return 31 * result + Boolean.hashCode(includesUpper);
    }

    @Override
    public String toString() {
        return (lower == null ? "(-∞" : (includesLower ? "[" : "(") + Arrays.toString(lower))
            + ", "
            + (upper == null ? "+∞)" : Arrays.toString(upper) + (includesUpper ? "]" : ")"));
    }
}
