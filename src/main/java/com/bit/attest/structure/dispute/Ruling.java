package com.bit.attest.structure.dispute;

public enum Ruling {
    UNRESOLVED, // 争议进行中
    UPHELD,     // 维持原证明，保证金没收
    OVERTURNED  // 推翻原证明，贡献记录取消，保证金退还
}
