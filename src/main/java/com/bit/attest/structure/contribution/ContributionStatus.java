package com.bit.attest.structure.contribution;

public enum ContributionStatus {
    PROPOSED,   // 收集确认中 / 等待终结延迟
    DISPUTED,   // 被验证者打了轻量争议标记
    FINALIZED,  // 已终结并分账
    CANCELLED   // 被裁决推翻，未发放任何资金
}
