package com.safety.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 安全分析服务 - SpringBoot启动类
 *
 * @author Safety Team
 * @version 1.0.0
 */
@SpringBootApplication
public class SafetyAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(SafetyAnalysisApplication.class, args);
        System.out.println("========================================");
        System.out.println("安全分析服务启动成功！");
        System.out.println("========================================");
    }
}
