package com.bit.vault.structure.event;

/**
 * 账本事件标记接口，事务提交后才会发布
 */
public interface LedgerEvent {
}
