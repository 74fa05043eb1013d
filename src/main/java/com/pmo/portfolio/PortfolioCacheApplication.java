package com.pmo.portfolio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PMO 组合数据服务启动类
 * 分层缓存（Redis + 本地磁盘）+ 层级分页查询，后端为 Databricks SQL 数仓
 */
@SpringBootApplication
public class PortfolioCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioCacheApplication.class, args);
    }
}
