package com.bit.attest.oracle;

import com.bit.attest.common.ContributionKey;

/**
 * 争议裁决后对贡献记录的处置能力，只交给争议仲裁器使用
 * 必须在仲裁器的定序器事务内调用
 */
public interface ContributionSettlement {

    /**
     * 裁决维持：清除轻量标记，满足确认数与终结延迟时立即终结分账
     * @return 是否已终结
     */
    boolean finalizeUpheld(ContributionKey key);

    /**
     * 裁决推翻：取消记录，不发放任何资金
     */
    void cancel(ContributionKey key);
}
