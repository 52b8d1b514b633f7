package com.bit.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "system")
public class SystemConfig {
    private String path;//保存路径
    private String dbType = "memory";//memory | rocksdb
}
