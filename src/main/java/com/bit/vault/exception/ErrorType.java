package com.bit.vault.exception;

public enum ErrorType {
    ACCESS_DENIED("无权访问（调用方不是注册金库或预言机）"),
    INVALID_ROOT("奖励根无效（零值或与当前根相同）"),
    FUTURE_TIMESTAMP("快照时间戳晚于当前时间"),
    TOO_EARLY_UPDATE("距离上次快照未满最小间隔"),
    NOT_ENOUGH_SIGNATURES("预言机签名数量不足"),
    INVALID_SIGNER("签名者无效（未注册/重复/未按地址递增）"),
    INVALID_ORACLES("预言机配置无效"),
    INVALID_PROOF("默克尔证明在当前根与上一根下均校验失败"),
    INVALID_AMOUNT("数量无效"),
    INVALID_CHECKPOINT_INDEX("检查点索引与票据不匹配"),
    EXIT_REQUEST_NOT_PROCESSED("退出请求尚未被任何检查点处理"),
    CLAIM_TOO_EARLY("未到可领取时间"),
    NOT_COLLATERALIZED("金库尚未注册验证者"),
    NOT_HARVESTED("金库需要先更新状态（收割奖励）"),
    INSUFFICIENT_SHARES("份额余额不足"),
    INSUFFICIENT_ASSETS("可用资产不足"),
    VAULT_NOT_FOUND("金库不存在"),
    OVERFLOW("定宽整数溢出"),
    PERSIST_FAILED("数据持久化失败");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
