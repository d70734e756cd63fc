package com.bit.attest.exception;

public enum ErrorType {
    AUTHORIZATION(403, "权限不足（非验证者/质押不足/非管理员）"),
    NOT_FOUND(404, "对象不存在（建筑/贡献记录/争议/承诺）"),
    VALIDATION(400, "参数校验失败（金额非法/证明不匹配/签名错误）"),
    REPLAY(409, "重放攻击（证明或承诺已被使用）"),
    DUPLICATE(409, "重复操作（同一验证者重复确认/承诺/揭示）"),
    STATE(409, "生命周期状态不允许该操作"),
    TIMING(409, "不在允许的时间窗口内"),
    CONSENSUS(409, "确认数或投票数不足"),
    DISPUTED(409, "贡献记录处于争议中"),
    STORAGE(500, "状态持久化失败");

    private final int httpStatus;
    private final String desc;

    ErrorType(int httpStatus, String desc) {
        this.httpStatus = httpStatus;
        this.desc = desc;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getDesc() {
        return desc;
    }
}
