package com.bit.attest.structure.contribution;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 终结分账：工人/建筑/维护者三份按整数除法取整，国库吸收余数
 * 四份之和恒等于贡献金额
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PayoutSplit {

    private long worker;

    private long building;

    private long maintainer;

    private long treasury;

    public static PayoutSplit of(long amount, int workerPercent, int buildingPercent, int maintainerPercent) {
        if (amount < 0) {
            throw new IllegalArgumentException("分账金额不能为负数");
        }
        long worker = share(amount, workerPercent);
        long building = share(amount, buildingPercent);
        long maintainer = share(amount, maintainerPercent);
        long treasury = amount - worker - building - maintainer;
        return new PayoutSplit(worker, building, maintainer, treasury);
    }

    // 等价于 floor(amount * percent / 100)，不会溢出
    private static long share(long amount, int percent) {
        return (amount / 100) * percent + (amount % 100) * percent / 100;
    }

    public long total() {
        return worker + building + maintainer + treasury;
    }
}
