package com.sqlitesession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 会话存储应用启动类。
 * <p>
 * Application 类位于顶层包路径，确保能够扫描到所有子模块中的组件。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@SpringBootApplication
public class Application {

    /**
     * 应用程序主入口。
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
