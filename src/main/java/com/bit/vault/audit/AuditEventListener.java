package com.bit.vault.audit;

import com.bit.vault.structure.event.LedgerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 账本事件审计日志
 */
@Slf4j
@Component
public class AuditEventListener {

    private final AtomicLong published = new AtomicLong();

    @EventListener
    public void onLedgerEvent(LedgerEvent event) {
        long seq = published.incrementAndGet();
        log.info("[审计#{}] {}", seq, event);
    }

    public long getPublished() {
        return published.get();
    }
}
