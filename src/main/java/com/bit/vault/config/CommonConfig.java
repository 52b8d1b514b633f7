package com.bit.vault.config;

import com.bit.vault.database.DataBase;
import com.bit.vault.database.memory.MemoryDb;
import com.bit.vault.database.rocksDb.RocksDb;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class CommonConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "closeDatabase")
    public DataBase dataBase(SystemConfig config) {
        DataBase dataBase = "rocksdb".equalsIgnoreCase(config.getDbType()) ? new RocksDb() : new MemoryDb();
        log.info("系统数据路径:{}，存储类型:{}", config.getPath(), config.getDbType());
        if (!dataBase.createDatabase(config)) {
            throw new RuntimeException("数据库创建失败");
        }
        return dataBase;
    }
}
